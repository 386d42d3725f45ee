package com.copyleft.DrawGuess.global.constant;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 시스템 채팅 문구.
 */
@Getter
@AllArgsConstructor
public enum GameCode {

    PLAYER_JOINED("%s joined the room"),
    PLAYER_LEFT("%s left the room"),
    CORRECT_GUESS("%s guessed the word!");

    private final String message;

    public String format(Object... args) {
        return String.format(this.message, args);
    }
}
