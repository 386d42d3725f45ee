package com.copyleft.DrawGuess.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "game.rule")
public record GameProperties(
        // 라운드 설정 (초 단위)
        int roundDurationSeconds,    // 라운드 길이 = 시간 보너스 구간
        int minPlayersToStart,       // 시작/다음 라운드 최소 인원

        // 점수
        int correctGuessBasePoints,  // 정답 기본 점수

        // 방 코드
        int roomCodeMaxAttempts,     // 코드 충돌 시 재생성 횟수

        // 입력 제한
        int usernameMaxLength,
        int chatMaxLength,

        // 서버 타이머 (기본: 출제자 클라이언트가 END_ROUND 전송)
        boolean serverRoundTimer,
        int serverTimerGraceSeconds
) {}
