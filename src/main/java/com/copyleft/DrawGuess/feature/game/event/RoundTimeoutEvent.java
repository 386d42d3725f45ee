package com.copyleft.DrawGuess.feature.game.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public class RoundTimeoutEvent {
    private final String roomCode;
    private final int roundNumber;
}
