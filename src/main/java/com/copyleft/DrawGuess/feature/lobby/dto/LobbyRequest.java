package com.copyleft.DrawGuess.feature.lobby.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class LobbyRequest {
    private String roomCode;  // CREATE_ROOM 에서는 비어 있음
    private String username;
}
