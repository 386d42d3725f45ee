package com.copyleft.DrawGuess.infra.websocket;

import com.copyleft.DrawGuess.config.AsyncConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class WebSocketSessionManager {

    private static final long SEND_TIME_LIMIT = 5000;
    private static final int OUTBOX_PENDING_LIMIT = 512;

    private final ConcurrentHashMap<String, SessionOutbox> outboxes = new ConcurrentHashMap<>();
    private final TaskExecutor outboundExecutor;
    private final Clock clock;

    public WebSocketSessionManager(@Qualifier(AsyncConfig.OUTBOUND_EXECUTOR) TaskExecutor outboundExecutor,
                                   Clock clock) {
        this.outboundExecutor = outboundExecutor;
        this.clock = clock;
    }

    public void registerSession(WebSocketSession session) {
        outboxes.put(session.getId(),
                new SessionOutbox(session, outboundExecutor, clock, SEND_TIME_LIMIT, OUTBOX_PENDING_LIMIT));
    }

    /**
     * @return 이번 호출로 등록이 해제되었으면 true. 같은 세션에 대해 true 는 한 번만 나온다.
     */
    public boolean removeSession(WebSocketSession session) {
        return outboxes.remove(session.getId()) != null;
    }

    public boolean isRegistered(String sessionId) {
        return outboxes.containsKey(sessionId);
    }

    /**
     * 전송 대기열에 넣고 바로 돌아온다.
     */
    public boolean enqueue(String sessionId, TextMessage message) {
        SessionOutbox outbox = outboxes.get(sessionId);
        if (outbox == null) {
            return false;
        }
        outbox.enqueue(message);
        return true;
    }
}
