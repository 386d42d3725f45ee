package com.copyleft.DrawGuess.global.constant;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ErrorCode {

    INVALID_USERNAME("Username is empty or too long"),
    USERNAME_TAKEN("Username already taken in this room"),

    ROOM_NOT_FOUND("Room not found"),
    ROOM_CREATE_FAILED("Could not create a room, please try again"),
    ROOM_BUSY("Room is busy, please try again"),
    NOT_IN_ROOM("You are not a member of this room"),

    NOT_ENOUGH_PLAYERS("Need at least 2 players to start"),
    GAME_ALREADY_STARTED("Game already started"),

    CHAT_EMPTY("Message cannot be empty"),
    CHAT_TOO_LONG("Message is too long"),

    INVALID_REQUEST("Invalid request");

    private final String message;
}
