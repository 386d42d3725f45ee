package com.copyleft.DrawGuess.infra.websocket.handler;

import com.copyleft.DrawGuess.feature.chat.dto.ChatRequest;
import com.copyleft.DrawGuess.feature.chat.ChatService;
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
public class SendMessageHandler implements WebSocketCommandHandler {

    private final ChatService chatService;
    private final WebSocketSender webSocketSender;
    private final ObjectMapper objectMapper;

    @Override
    public String getAction() {
        return "SEND_MESSAGE";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            ChatRequest dto = objectMapper.treeToValue(payload, ChatRequest.class);
            if (dto == null || dto.getRoomCode() == null) {
                webSocketSender.sendError(session.getId(), ErrorCode.INVALID_REQUEST);
                return;
            }
            chatService.sendMessage(session.getId(), dto.getRoomCode(), dto.getText());
        } catch (Exception e) {
            log.error("[SEND_MESSAGE] 처리 중 오류: session={}, msg={}", session.getId(), e.getMessage(), e);
            webSocketSender.sendError(session.getId(), ErrorCode.INVALID_REQUEST);
        }
    }
}
