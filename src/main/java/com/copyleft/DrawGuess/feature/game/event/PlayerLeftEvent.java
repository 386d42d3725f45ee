package com.copyleft.DrawGuess.feature.game.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public class PlayerLeftEvent {
    private final String roomCode;
    private final String sessionId;
    private final boolean wasDrawing;
    private final boolean roomDeleted;
}
