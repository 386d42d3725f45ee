package com.copyleft.DrawGuess.infra.websocket;

import com.copyleft.DrawGuess.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SessionOutboxTest {

    private static final long SEND_TIME_LIMIT = 5000;

    private WebSocketSession session;
    private MutableClock clock;
    private ExecutorService outboundExecutor;

    @BeforeEach
    void setUp() {
        session = openSession("s1");
        clock = MutableClock.startingAt(0L);
    }

    @AfterEach
    void tearDown() {
        if (outboundExecutor != null) {
            outboundExecutor.shutdownNow();
        }
    }

    private static WebSocketSession openSession(String id) {
        WebSocketSession mocked = mock(WebSocketSession.class);
        when(mocked.getId()).thenReturn(id);
        when(mocked.isOpen()).thenReturn(true);
        return mocked;
    }

    private SessionOutbox outbox(WebSocketSession target, Executor executor, int pendingLimit) {
        return new SessionOutbox(target, executor, clock, SEND_TIME_LIMIT, pendingLimit);
    }

    @Test
    @DisplayName("넣은 순서대로 전송한다")
    void enqueue_SendsInOrder() throws IOException {
        // given
        SessionOutbox outbox = outbox(session, Runnable::run, 10);
        TextMessage first = new TextMessage("1");
        TextMessage second = new TextMessage("2");

        // when
        outbox.enqueue(first);
        outbox.enqueue(second);

        // then
        InOrder inOrder = inOrder(session);
        inOrder.verify(session).sendMessage(first);
        inOrder.verify(session).sendMessage(second);
        assertEquals(0, outbox.getPendingCount());
    }

    @Test
    @DisplayName("전송 실패는 다음 메시지 전송을 막지 않는다")
    void enqueue_SendFailure_Continues() throws IOException {
        // given
        SessionOutbox outbox = outbox(session, Runnable::run, 10);
        TextMessage broken = new TextMessage("broken");
        TextMessage next = new TextMessage("next");
        doThrow(new IOException("closed pipe")).when(session).sendMessage(broken);

        // when
        outbox.enqueue(broken);
        outbox.enqueue(next);

        // then
        verify(session).sendMessage(next);
    }

    @Test
    @DisplayName("닫힌 세션에는 보내지 않는다")
    void enqueue_ClosedSession() throws IOException {
        when(session.isOpen()).thenReturn(false);
        SessionOutbox outbox = outbox(session, Runnable::run, 10);

        outbox.enqueue(new TextMessage("x"));

        verify(session, never()).sendMessage(any());
    }

    @Test
    @DisplayName("대기열이 한도를 넘으면 세션을 닫는다")
    void enqueue_OverLimit_ClosesSession() throws IOException {
        // given: 실행되지 않는 executor 로 대기열을 쌓는다
        List<Runnable> parked = new ArrayList<>();
        SessionOutbox outbox = outbox(session, parked::add, 3);

        // when
        for (int i = 0; i < 4; i++) {
            outbox.enqueue(new TextMessage("m" + i));
        }

        // then
        assertEquals(3, outbox.getPendingCount());
        assertEquals(1, parked.size());
        verify(session).close(CloseStatus.SESSION_NOT_RELIABLE);
    }

    @Test
    @DisplayName("전송이 제한 시간 넘게 멈추면 세션을 닫고 다른 세션 전송이 이어진다")
    void enqueue_StalledSend_ClosesSessionAndFreesThread() throws Exception {
        // given: 전송 스레드 하나를 두 세션이 함께 쓴다
        outboundExecutor = Executors.newSingleThreadExecutor();
        WebSocketSession slow = openSession("slow");
        WebSocketSession fast = openSession("fast");
        CountDownLatch sending = new CountDownLatch(1);
        CountDownLatch released = new CountDownLatch(1);
        doAnswer(invocation -> {
            sending.countDown();
            released.await(5, TimeUnit.SECONDS);
            return null;
        }).when(slow).sendMessage(any());
        doAnswer(invocation -> {
            released.countDown();
            return null;
        }).when(slow).close(any());

        SessionOutbox slowOutbox = outbox(slow, outboundExecutor, 10);
        SessionOutbox fastOutbox = outbox(fast, outboundExecutor, 10);
        TextMessage toFast = new TextMessage("fast");

        slowOutbox.enqueue(new TextMessage("stuck"));
        assertTrue(sending.await(1, TimeUnit.SECONDS));
        fastOutbox.enqueue(toFast);

        // when: 제한 시간 안에는 닫지 않는다
        clock.advance(Duration.ofMillis(SEND_TIME_LIMIT));
        slowOutbox.enqueue(new TextMessage("within limit"));
        verify(slow, never()).close(any());

        clock.advance(Duration.ofMillis(1));
        slowOutbox.enqueue(new TextMessage("over limit"));

        // then
        verify(slow).close(CloseStatus.SESSION_NOT_RELIABLE);
        assertTrue(slowOutbox.isClosed());
        verify(fast, timeout(1000)).sendMessage(toFast);
        verify(slow, times(1)).sendMessage(any());
    }

    @Test
    @DisplayName("닫힌 대기열은 새 메시지를 버리고 한 번만 닫는다")
    void enqueue_AfterClose_Drops() throws IOException {
        // given
        List<Runnable> parked = new ArrayList<>();
        SessionOutbox outbox = outbox(session, parked::add, 1);
        outbox.enqueue(new TextMessage("m0"));
        outbox.enqueue(new TextMessage("m1"));

        // when
        outbox.enqueue(new TextMessage("m2"));
        parked.forEach(Runnable::run);

        // then
        verify(session, times(1)).close(CloseStatus.SESSION_NOT_RELIABLE);
        verify(session, never()).sendMessage(any());
    }
}
