package com.copyleft.DrawGuess.infra.websocket.handler;

import com.copyleft.DrawGuess.feature.lobby.dto.LobbyRequest;
import com.copyleft.DrawGuess.feature.lobby.LobbyService;
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
public class CreateRoomHandler implements WebSocketCommandHandler {

    private final LobbyService lobbyService;
    private final WebSocketSender webSocketSender;
    private final ObjectMapper objectMapper;

    @Override
    public String getAction() {
        return "CREATE_ROOM";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            LobbyRequest dto = objectMapper.treeToValue(payload, LobbyRequest.class);
            if (dto == null) {
                webSocketSender.sendError(session.getId(), ErrorCode.INVALID_REQUEST);
                return;
            }
            lobbyService.createRoom(session.getId(), dto.getUsername());
        } catch (Exception e) {
            log.error("[CREATE_ROOM] 처리 중 오류: session={}, msg={}", session.getId(), e.getMessage(), e);
            webSocketSender.sendError(session.getId(), ErrorCode.INVALID_REQUEST);
        }
    }
}
