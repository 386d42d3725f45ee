package com.copyleft.DrawGuess.infra.websocket.handler;

import com.copyleft.DrawGuess.feature.drawing.dto.DrawingRequest;
import com.copyleft.DrawGuess.feature.drawing.DrawingService;
import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.infra.websocket.WebSocketSender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Slf4j
@Component
@RequiredArgsConstructor
public class SendDrawingHandler implements WebSocketCommandHandler {

    private final DrawingService drawingService;
    private final WebSocketSender webSocketSender;
    private final ObjectMapper objectMapper;

    @Override
    public String getAction() {
        return "SEND_DRAWING";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            DrawingRequest dto = objectMapper.treeToValue(payload, DrawingRequest.class);
            if (dto == null || dto.getRoomCode() == null) {
                webSocketSender.sendError(session.getId(), ErrorCode.INVALID_REQUEST);
                return;
            }
            drawingService.relayStroke(session.getId(), dto.getRoomCode(), dto.getStroke());
        } catch (Exception e) {
            log.error("[SEND_DRAWING] 처리 중 오류: session={}, msg={}", session.getId(), e.getMessage(), e);
            webSocketSender.sendError(session.getId(), ErrorCode.INVALID_REQUEST);
        }
    }
}
