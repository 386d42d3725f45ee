package com.copyleft.DrawGuess.feature.game.dto;

import com.copyleft.DrawGuess.domain.DrawingStroke;
import com.copyleft.DrawGuess.feature.lobby.dto.LobbyPayloads.PlayerInfo;
import com.copyleft.DrawGuess.global.constant.SocketEvent;
import com.copyleft.DrawGuess.infra.websocket.dto.SocketPayload;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

public class GamePayloads {

    // 라운드 시작 (출제자 전용)
    @Getter
    @Builder
    public static class DrawerRoundStart implements SocketPayload {
        private int roundNumber;
        private String word;
        private int durationSeconds;

        @Override
        public SocketEvent socketEvent() {
            return SocketEvent.ROUND_START_DRAWER;
        }
    }

    // 라운드 시작 (출제자 제외)
    @Getter
    @Builder
    public static class RoundStart implements SocketPayload {
        private int roundNumber;
        private String drawerName;
        private String maskedWord;
        private int wordLength;
        private int durationSeconds;

        @Override
        public SocketEvent socketEvent() {
            return SocketEvent.ROUND_START;
        }
    }

    // 선 중계
    @Getter
    @Builder
    public static class StrokeRelay implements SocketPayload {
        private String username;
        private DrawingStroke stroke;

        @Override
        public SocketEvent socketEvent() {
            return SocketEvent.DRAWING;
        }
    }

    @Getter
    @Builder
    public static class ClearCanvas implements SocketPayload {
        private String roomCode;

        @Override
        public SocketEvent socketEvent() {
            return SocketEvent.CLEAR_CANVAS;
        }
    }

    // 정답자 점수
    @Getter
    @Builder
    public static class CorrectGuess implements SocketPayload {
        private String username;
        private int pointsAwarded;
        private int totalScore;

        @Override
        public SocketEvent socketEvent() {
            return SocketEvent.CORRECT_GUESS;
        }
    }

    // 라운드 결과: 정답 공개 + 점수 내림차순
    @Getter
    @Builder
    public static class RoundEnd implements SocketPayload {
        private int roundNumber;
        private String word;
        private List<PlayerInfo> players;

        @Override
        public SocketEvent socketEvent() {
            return SocketEvent.ROUND_END;
        }
    }
}
