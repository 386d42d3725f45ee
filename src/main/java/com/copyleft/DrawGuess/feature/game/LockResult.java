package com.copyleft.DrawGuess.feature.game;

/**
 * 방 락 안에서 실행하려던 작업의 결과.
 */
public enum LockResult {
    EXECUTED,    // 락을 얻고 작업을 실행함
    LOCK_FAILED; // 대기 시간 안에 락을 얻지 못해 아무것도 하지 않음

    public boolean isLockFailed() {
        return this == LOCK_FAILED;
    }
}
