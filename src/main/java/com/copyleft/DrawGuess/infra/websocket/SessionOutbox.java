package com.copyleft.DrawGuess.infra.websocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 세션 하나의 전송 대기열.
 * 넣은 순서대로 보내며, 한 세션에 대해 동시에 두 스레드가 보내지 않는다.
 * <p>
 * 전송 하나가 제한 시간을 넘기거나 대기열이 한도를 넘으면 세션을 닫는다.
 * 닫힌 뒤에 들어온 메시지는 버린다.
 */
@Slf4j
public class SessionOutbox {

    private static final long IDLE = -1L;

    private final WebSocketSession session;
    private final Executor executor;
    private final Clock clock;
    private final long sendTimeLimitMillis;
    private final int pendingLimit;

    private final Queue<TextMessage> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // 진행 중인 전송의 시작 시각, 전송 중이 아니면 IDLE
    private volatile long sendStartedAt = IDLE;

    public SessionOutbox(WebSocketSession session, Executor executor, Clock clock,
                         long sendTimeLimitMillis, int pendingLimit) {
        this.session = session;
        this.executor = executor;
        this.clock = clock;
        this.sendTimeLimitMillis = sendTimeLimitMillis;
        this.pendingLimit = pendingLimit;
    }

    public void enqueue(TextMessage message) {
        if (closed.get()) {
            return;
        }
        if (isSendStalled()) {
            log.warn("전송 시간 초과, 세션 종료: [세션 ID: {}], [제한: {}ms]", session.getId(), sendTimeLimitMillis);
            close(CloseStatus.SESSION_NOT_RELIABLE);
            return;
        }
        if (pending.incrementAndGet() > pendingLimit) {
            pending.decrementAndGet();
            log.warn("전송 대기열 초과, 세션 종료: [세션 ID: {}], [대기: {}]", session.getId(), pendingLimit);
            close(CloseStatus.SESSION_NOT_RELIABLE);
            return;
        }
        queue.add(message);
        scheduleDrain();
    }

    public int getPendingCount() {
        return pending.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    private boolean isSendStalled() {
        long startedAt = sendStartedAt;
        return startedAt != IDLE && clock.millis() - startedAt > sendTimeLimitMillis;
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            executor.execute(this::drain);
        }
    }

    private void drain() {
        try {
            TextMessage message;
            while ((message = queue.poll()) != null) {
                pending.decrementAndGet();
                send(message);
            }
        } finally {
            draining.set(false);
        }
        // drain 종료 직전에 들어온 메시지
        if (!queue.isEmpty()) {
            scheduleDrain();
        }
    }

    private void send(TextMessage message) {
        if (closed.get() || !session.isOpen()) {
            return;
        }
        sendStartedAt = clock.millis();
        try {
            session.sendMessage(message);
        } catch (IOException | RuntimeException e) {
            log.error("전송 실패: [세션 ID: {}], [오류: {}]", session.getId(), e.getMessage());
        } finally {
            sendStartedAt = IDLE;
        }
    }

    private void close(CloseStatus status) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            log.warn("세션 종료 실패: [세션 ID: {}], [오류: {}]", session.getId(), e.getMessage());
        }
    }
}
