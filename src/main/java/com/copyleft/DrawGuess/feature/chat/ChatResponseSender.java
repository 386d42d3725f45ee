package com.copyleft.DrawGuess.feature.chat;

import com.copyleft.DrawGuess.domain.ChatMessage;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.feature.chat.dto.ChatResponse;
import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.infra.websocket.Audience;
import com.copyleft.DrawGuess.infra.websocket.WebSocketSender;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ChatResponseSender {

    private final WebSocketSender webSocketSender;

    public void broadcastChat(Room room, ChatMessage message) {
        webSocketSender.send(Audience.room(room), ChatResponse.from(message));
    }

    public void sendError(String sessionId, ErrorCode errorCode) {
        webSocketSender.sendError(sessionId, errorCode);
    }
}
