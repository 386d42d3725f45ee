package com.copyleft.DrawGuess.feature.game;

import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.feature.game.event.RoundTimeoutEvent;
import com.copyleft.DrawGuess.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RoundTimerTest {

    private final TaskScheduler taskScheduler = mock(TaskScheduler.class);
    private final ApplicationEventPublisher eventPublisher = mock(ApplicationEventPublisher.class);

    private Room runningRoom() {
        Room room = TestFixtures.room("TIME01", "apple", "a", "b");
        room.setRoundNumber(3);
        room.setRoundStartTime(1_000_000L);
        return room;
    }

    @Test
    @DisplayName("서버 타이머가 꺼져 있으면 아무것도 예약하지 않는다")
    void start_Disabled() {
        RoundTimer roundTimer = new RoundTimer(taskScheduler, TestFixtures.gameProperties(), eventPublisher);

        roundTimer.start(runningRoom());

        assertFalse(roundTimer.isEnabled());
        verifyNoInteractions(taskScheduler);
        assertFalse(roundTimer.isScheduled("TIME01"));
    }

    @Test
    @DisplayName("라운드 길이 + 유예 시간 뒤에 시간 초과 이벤트를 발행한다")
    void start_SchedulesTimeout() {
        // given
        RoundTimer roundTimer = new RoundTimer(taskScheduler, TestFixtures.gamePropertiesWithServerTimer(), eventPublisher);
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        // when
        roundTimer.start(runningRoom());

        // then
        ArgumentCaptor<Runnable> taskCaptor = ArgumentCaptor.forClass(Runnable.class);
        ArgumentCaptor<Instant> deadlineCaptor = ArgumentCaptor.forClass(Instant.class);
        verify(taskScheduler).schedule(taskCaptor.capture(), deadlineCaptor.capture());
        assertEquals(Instant.ofEpochMilli(1_000_000L).plusSeconds(80 + 3), deadlineCaptor.getValue());
        assertTrue(roundTimer.isScheduled("TIME01"));

        taskCaptor.getValue().run();

        ArgumentCaptor<RoundTimeoutEvent> eventCaptor = ArgumentCaptor.forClass(RoundTimeoutEvent.class);
        verify(eventPublisher).publishEvent(eventCaptor.capture());
        assertEquals("TIME01", eventCaptor.getValue().getRoomCode());
        assertEquals(3, eventCaptor.getValue().getRoundNumber());
    }

    @Test
    @DisplayName("새 라운드 타이머는 이전 타이머를 취소한다")
    void start_ReplacesPrevious() {
        // given
        RoundTimer roundTimer = new RoundTimer(taskScheduler, TestFixtures.gamePropertiesWithServerTimer(), eventPublisher);
        ScheduledFuture<?> first = mock(ScheduledFuture.class);
        ScheduledFuture<?> second = mock(ScheduledFuture.class);
        doReturn(first, second).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        Room room = runningRoom();

        // when
        roundTimer.start(room);
        roundTimer.start(room);

        // then
        verify(first).cancel(false);
        verify(second, never()).cancel(anyBoolean());
    }

    @Test
    @DisplayName("취소하면 예약이 사라진다")
    void cancel_RemovesTimer() {
        RoundTimer roundTimer = new RoundTimer(taskScheduler, TestFixtures.gamePropertiesWithServerTimer(), eventPublisher);
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        roundTimer.start(runningRoom());

        roundTimer.cancel("TIME01");
        roundTimer.cancel("TIME01");

        verify(future, times(1)).cancel(false);
        assertFalse(roundTimer.isScheduled("TIME01"));
    }
}
