package com.copyleft.DrawGuess.infra.websocket.handler;

import com.copyleft.DrawGuess.feature.lobby.LobbyService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Slf4j
@Component
@RequiredArgsConstructor
public class LeaveRoomHandler implements WebSocketCommandHandler {

    private final LobbyService lobbyService;

    @Override
    public String getAction() {
        return "LEAVE_ROOM";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            lobbyService.leaveRoom(session.getId());
        } catch (Exception e) {
            log.error("[LEAVE_ROOM] 처리 중 오류: session={}, msg={}", session.getId(), e.getMessage(), e);
        }
    }
}
