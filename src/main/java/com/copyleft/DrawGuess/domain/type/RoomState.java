package com.copyleft.DrawGuess.domain.type;

public enum RoomState {
    WAITING,        // 게임 시작 전 (입장 가능)
    CHOOSING_WORD,  // 예약 (미사용)
    DRAWING,        // 라운드 진행 중
    ROUND_END,      // 정답 공개, 다음 라운드 대기
    GAME_END        // 예약 (미사용)
}
