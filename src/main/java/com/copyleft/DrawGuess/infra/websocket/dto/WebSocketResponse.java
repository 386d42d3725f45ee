package com.copyleft.DrawGuess.infra.websocket.dto;

import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.global.constant.SocketEvent;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebSocketResponse<T extends SocketPayload> {
    private String event;   // 이벤트 타입 (SocketEvent.name())
    private String message; // 에러 사유 등 사용자 표시용
    private String code;    // 에러 코드

    private T data;         // 실제 페이로드

    public static <T extends SocketPayload> WebSocketResponse<T> of(T data) {
        return WebSocketResponse.<T>builder()
                .event(data.socketEvent().name())
                .data(data)
                .build();
    }

    public static WebSocketResponse<SocketPayload> error(ErrorCode errorCode) {
        return WebSocketResponse.<SocketPayload>builder()
                .event(SocketEvent.ERROR.name())
                .message(errorCode.getMessage())
                .code(errorCode.name())
                .build();
    }
}
