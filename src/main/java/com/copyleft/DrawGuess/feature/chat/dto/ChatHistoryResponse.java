package com.copyleft.DrawGuess.feature.chat.dto;

import com.copyleft.DrawGuess.global.constant.SocketEvent;
import com.copyleft.DrawGuess.infra.websocket.dto.SocketPayload;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class ChatHistoryResponse implements SocketPayload {
    private String roomCode;
    private List<ChatResponse> messages;

    @Override
    public SocketEvent socketEvent() {
        return SocketEvent.CHAT_HISTORY;
    }
}
