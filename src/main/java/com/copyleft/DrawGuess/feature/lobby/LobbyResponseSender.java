package com.copyleft.DrawGuess.feature.lobby;

import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.feature.chat.dto.ChatHistoryResponse;
import com.copyleft.DrawGuess.feature.chat.dto.ChatResponse;
import com.copyleft.DrawGuess.feature.lobby.dto.LobbyPayloads;
import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.infra.websocket.Audience;
import com.copyleft.DrawGuess.infra.websocket.WebSocketSender;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LobbyResponseSender {

    private final WebSocketSender webSocketSender;

    public void sendRoomCreated(String sessionId, Room room) {
        LobbyPayloads.RoomCreated data = LobbyPayloads.RoomCreated.builder()
                .roomCode(room.getRoomCode())
                .players(LobbyPayloads.PlayerInfo.from(room.getPlayers()))
                .build();
        webSocketSender.send(Audience.session(sessionId), data);
    }

    public void broadcastRoster(Room room) {
        LobbyPayloads.RosterUpdate data = LobbyPayloads.RosterUpdate.builder()
                .roomCode(room.getRoomCode())
                .state(room.getState())
                .players(LobbyPayloads.PlayerInfo.from(room.getPlayers()))
                .build();
        webSocketSender.send(Audience.room(room), data);
    }

    public void sendChatHistory(String sessionId, Room room) {
        ChatHistoryResponse data = ChatHistoryResponse.builder()
                .roomCode(room.getRoomCode())
                .messages(room.getChatHistory().stream().map(ChatResponse::from).toList())
                .build();
        webSocketSender.send(Audience.session(sessionId), data);
    }

    public void sendLeaveSuccess(String sessionId, String roomCode) {
        webSocketSender.send(Audience.session(sessionId),
                LobbyPayloads.LeaveSuccess.builder().roomCode(roomCode).build());
    }

    public void sendError(String sessionId, ErrorCode errorCode) {
        webSocketSender.sendError(sessionId, errorCode);
    }
}
