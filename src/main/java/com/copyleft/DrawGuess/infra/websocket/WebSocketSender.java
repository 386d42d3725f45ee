package com.copyleft.DrawGuess.infra.websocket;

import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.infra.websocket.dto.SocketPayload;
import com.copyleft.DrawGuess.infra.websocket.dto.WebSocketResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketSender {

    private final WebSocketSessionManager sessionManager;
    private final ObjectMapper objectMapper;

    public void send(Audience audience, SocketPayload payload) {
        dispatch(audience, WebSocketResponse.of(payload));
    }

    public void sendError(String sessionId, ErrorCode errorCode) {
        dispatch(Audience.session(sessionId), WebSocketResponse.error(errorCode));
    }

    private void dispatch(Audience audience, WebSocketResponse<?> response) {
        if (audience.isEmpty()) {
            return;
        }

        TextMessage message;
        try {
            message = new TextMessage(objectMapper.writeValueAsString(response));
        } catch (JsonProcessingException e) {
            log.error("이벤트 직렬화 실패: [이벤트: {}], [오류: {}]", response.getEvent(), e.getMessage(), e);
            return;
        }

        for (String sessionId : audience.getRecipients()) {
            if (!sessionManager.enqueue(sessionId, message)) {
                log.debug("등록되지 않은 세션, 전송 생략: [세션 ID: {}], [이벤트: {}]", sessionId, response.getEvent());
            }
        }
        log.debug("이벤트 전송: [이벤트: {}], [대상: {} {}명]",
                response.getEvent(), audience.getMode(), audience.getRecipients().size());
    }
}
