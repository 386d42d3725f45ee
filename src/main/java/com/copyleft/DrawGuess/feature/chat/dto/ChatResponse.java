package com.copyleft.DrawGuess.feature.chat.dto;

import com.copyleft.DrawGuess.domain.ChatMessage;
import com.copyleft.DrawGuess.global.constant.SocketEvent;
import com.copyleft.DrawGuess.infra.websocket.dto.SocketPayload;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ChatResponse implements SocketPayload {
    private String username;
    private String text;
    private long timestamp;
    private boolean systemMessage;
    private boolean correctGuess;

    public static ChatResponse from(ChatMessage message) {
        return ChatResponse.builder()
                .username(message.getUsername())
                .text(message.getText())
                .timestamp(message.getTimestamp())
                .systemMessage(message.isSystemMessage())
                .correctGuess(message.isCorrectGuess())
                .build();
    }

    @Override
    public SocketEvent socketEvent() {
        return SocketEvent.CHAT_MESSAGE;
    }
}
