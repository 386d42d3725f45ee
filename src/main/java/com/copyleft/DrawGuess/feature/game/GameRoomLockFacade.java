package com.copyleft.DrawGuess.feature.game;

import com.copyleft.DrawGuess.domain.Room;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 방 단위 상호 배제. 같은 방의 명령은 직렬화되고 다른 방끼리는 서로 막지 않는다.
 * 방송(broadcast)도 락 안에서 대기열에 넣으므로 방 안의 이벤트 순서가 모든 클라이언트에게 같다.
 */
@Slf4j
@Component
public class GameRoomLockFacade {

    private static final long WAIT_TIME = 2L; // 락 대기 최대 시간 (초)

    private static final Comparator<Room> LOCK_ORDER = Comparator.comparing(Room::getRoomCode);

    public LockResult execute(Room room, Runnable action) {
        return executeAll(List.of(room), action);
    }

    /**
     * 두 방의 락을 함께 잡는다 (방 이동). 항상 방 코드 순서로 잡으므로 서로 반대로 이동해도 교착되지 않는다.
     * {@code other} 가 없거나 같은 방이면 {@code room} 하나만 잡는다.
     */
    public LockResult executeBoth(Room room, Room other, Runnable action) {
        if (other == null || other == room) {
            return execute(room, action);
        }
        List<Room> ordered = new ArrayList<>(List.of(room, other));
        ordered.sort(LOCK_ORDER);
        return executeAll(ordered, action);
    }

    /**
     * 연결 종료 정리처럼 잃어버리면 안 되는 작업용. 락을 얻을 때까지 기다린다.
     */
    public void executeAwaiting(Room room, Runnable action) {
        ReentrantLock lock = room.getLock();
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    private LockResult executeAll(List<Room> rooms, Runnable action) {
        List<ReentrantLock> acquired = new ArrayList<>(rooms.size());
        try {
            for (Room room : rooms) {
                if (!tryLock(room)) {
                    return LockResult.LOCK_FAILED;
                }
                acquired.add(room.getLock());
            }

            action.run();
            return LockResult.EXECUTED;
        } catch (RuntimeException e) {
            log.error("비즈니스 로직 오류: room={}", rooms.get(0).getRoomCode(), e);
            throw e;
        } finally {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).unlock();
            }
        }
    }

    private boolean tryLock(Room room) {
        try {
            if (room.getLock().tryLock(WAIT_TIME, TimeUnit.SECONDS)) {
                return true;
            }
            log.error("락 획득 실패 (Timeout): room={}", room.getRoomCode());
            return false;
        } catch (InterruptedException e) {
            log.error("락 인터럽트 발생: room={}", room.getRoomCode(), e);
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
