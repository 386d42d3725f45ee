package com.copyleft.DrawGuess.feature.lobby.dto;

import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.type.RoomState;
import com.copyleft.DrawGuess.global.constant.SocketEvent;
import com.copyleft.DrawGuess.infra.websocket.dto.SocketPayload;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

public class LobbyPayloads {

    // 명단 한 줄
    @Getter
    @Builder
    public static class PlayerInfo {
        private String username;
        private int score;
        private boolean drawing;
        private boolean guessedCorrectly;

        public static PlayerInfo from(Player player) {
            return PlayerInfo.builder()
                    .username(player.getUsername())
                    .score(player.getScore())
                    .drawing(player.isDrawing())
                    .guessedCorrectly(player.isGuessedCorrectly())
                    .build();
        }

        public static List<PlayerInfo> from(List<Player> players) {
            return players.stream().map(PlayerInfo::from).toList();
        }
    }

    // 방 생성 (개인)
    @Getter
    @Builder
    public static class RoomCreated implements SocketPayload {
        private String roomCode;
        private List<PlayerInfo> players;

        @Override
        public SocketEvent socketEvent() {
            return SocketEvent.ROOM_CREATED;
        }
    }

    // 명단 갱신 (방 전체)
    @Getter
    @Builder
    public static class RosterUpdate implements SocketPayload {
        private String roomCode;
        private RoomState state;
        private List<PlayerInfo> players;

        @Override
        public SocketEvent socketEvent() {
            return SocketEvent.ROSTER_UPDATE;
        }
    }

    // 자발적 퇴장 확인 (개인)
    @Getter
    @Builder
    public static class LeaveSuccess implements SocketPayload {
        private String roomCode;

        @Override
        public SocketEvent socketEvent() {
            return SocketEvent.LEAVE_SUCCESS;
        }
    }
}
