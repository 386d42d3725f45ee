package com.copyleft.DrawGuess.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@Builder
@AllArgsConstructor
@ToString
public class Player {

    private final String sessionId; // 연결 식별자 (연결 단위로 고유)
    private final String username;  // 방 안에서 고유 (대소문자 무시)

    private int score;               // 게임 중 감소하지 않음
    private boolean drawing;         // 방마다 최대 1명
    private boolean guessedCorrectly; // 라운드 시작마다 초기화

    public static Player join(String sessionId, String username) {
        return Player.builder()
                .sessionId(sessionId)
                .username(username)
                .score(0)
                .drawing(false)
                .guessedCorrectly(false)
                .build();
    }

    public void addScore(int points) {
        if (points < 0) {
            throw new IllegalArgumentException("points must not be negative: " + points);
        }
        this.score += points;
    }

    public void resetForRound() {
        this.drawing = false;
        this.guessedCorrectly = false;
    }
}
