package com.copyleft.DrawGuess.feature.game;

import com.copyleft.DrawGuess.config.GameProperties;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.feature.game.event.RoundTimeoutEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * 방별 라운드 카운트다운.
 * <p>
 * 기본 설정에서는 출제자 클라이언트가 카운트다운 종료 시 END_ROUND 를 보내고 서버는 마감을 강제하지 않는다.
 * {@code game.rule.server-round-timer=true} 이면 서버가 (라운드 길이 + 유예) 뒤에 직접 라운드를 끝낸다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoundTimer {

    private final TaskScheduler taskScheduler;
    private final GameProperties gameProperties;
    private final ApplicationEventPublisher eventPublisher;

    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();

    public boolean isEnabled() {
        return gameProperties.serverRoundTimer();
    }

    public void start(Room room) {
        if (!isEnabled()) {
            return;
        }

        String roomCode = room.getRoomCode();
        int roundNumber = room.getRoundNumber();
        Instant deadline = Instant.ofEpochMilli(room.getRoundStartTime())
                .plusSeconds(room.getRoundDurationSeconds())
                .plusSeconds(gameProperties.serverTimerGraceSeconds());

        ScheduledFuture<?> future = taskScheduler.schedule(() -> expire(roomCode, roundNumber), deadline);
        ScheduledFuture<?> previous = timers.put(roomCode, future);
        if (previous != null) {
            previous.cancel(false);
        }
        log.debug("라운드 타이머 예약: room={}, round={}, deadline={}", roomCode, roundNumber, deadline);
    }

    public void cancel(String roomCode) {
        ScheduledFuture<?> future = timers.remove(roomCode);
        if (future != null) {
            future.cancel(false);
            log.debug("라운드 타이머 취소: room={}", roomCode);
        }
    }

    public boolean isScheduled(String roomCode) {
        return timers.containsKey(roomCode);
    }

    private void expire(String roomCode, int roundNumber) {
        log.info("라운드 시간 초과: room={}, round={}", roomCode, roundNumber);
        eventPublisher.publishEvent(new RoundTimeoutEvent(roomCode, roundNumber));
    }
}
