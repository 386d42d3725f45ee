package com.copyleft.DrawGuess.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlayerTest {

    @Test
    @DisplayName("입장한 플레이어는 0점, 출제/정답 표시가 없다")
    void join_Defaults() {
        Player player = Player.join("s1", "Alice");

        assertEquals("s1", player.getSessionId());
        assertEquals("Alice", player.getUsername());
        assertEquals(0, player.getScore());
        assertFalse(player.isDrawing());
        assertFalse(player.isGuessedCorrectly());
    }

    @Test
    @DisplayName("음수 점수는 더할 수 없다")
    void addScore_Negative_Throws() {
        Player player = Player.join("s1", "Alice");

        assertThrows(IllegalArgumentException.class, () -> player.addScore(-1));
        assertEquals(0, player.getScore());
    }

    @Test
    @DisplayName("라운드 초기화는 점수를 유지한다")
    void resetForRound_KeepsScore() {
        // given
        Player player = Player.join("s1", "Alice");
        player.addScore(130);
        player.setDrawing(true);
        player.setGuessedCorrectly(true);

        // when
        player.resetForRound();

        // then
        assertEquals(130, player.getScore());
        assertFalse(player.isDrawing());
        assertFalse(player.isGuessedCorrectly());
    }
}
