package com.copyleft.DrawGuess.global.constant;

public enum SocketEvent {
    ROOM_CREATED,       // 방 생성 (개인)
    ROSTER_UPDATE,      // 참가자 목록
    CHAT_HISTORY,       // 입장 시 지난 채팅 (개인)
    LEAVE_SUCCESS,      // 자발적 퇴장 (개인)

    CHAT_MESSAGE,

    ROUND_START_DRAWER, // 출제자 전용: 정답 단어
    ROUND_START,        // 나머지: 마스킹된 단어
    DRAWING,            // 선 중계
    CLEAR_CANVAS,
    CORRECT_GUESS,
    ROUND_END,          // 정답 공개 + 점수순 목록

    ERROR
}
