package com.copyleft.DrawGuess.feature.game;

import com.copyleft.DrawGuess.domain.DrawingStroke;
import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.feature.game.dto.GamePayloads;
import com.copyleft.DrawGuess.feature.lobby.dto.LobbyPayloads.PlayerInfo;
import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.infra.websocket.Audience;
import com.copyleft.DrawGuess.infra.websocket.WebSocketSender;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class GameResponseSender {

    private final WebSocketSender webSocketSender;

    // 출제자에게는 단어, 나머지에게는 마스킹된 단어
    public void sendRoundStart(Room room, Player drawer, String maskedWord) {
        GamePayloads.DrawerRoundStart drawerData = GamePayloads.DrawerRoundStart.builder()
                .roundNumber(room.getRoundNumber())
                .word(room.getCurrentWord())
                .durationSeconds(room.getRoundDurationSeconds())
                .build();
        webSocketSender.send(Audience.session(drawer.getSessionId()), drawerData);

        GamePayloads.RoundStart guesserData = GamePayloads.RoundStart.builder()
                .roundNumber(room.getRoundNumber())
                .drawerName(drawer.getUsername())
                .maskedWord(maskedWord)
                .wordLength(maskedWord.length())
                .durationSeconds(room.getRoundDurationSeconds())
                .build();
        webSocketSender.send(Audience.roomExcept(room, drawer.getSessionId()), guesserData);
    }

    // 라운드 도중 입장한 사람에게 현재 라운드 정보
    public void sendRoundInProgress(String sessionId, Room room, Player drawer, String maskedWord) {
        GamePayloads.RoundStart data = GamePayloads.RoundStart.builder()
                .roundNumber(room.getRoundNumber())
                .drawerName(drawer.getUsername())
                .maskedWord(maskedWord)
                .wordLength(maskedWord.length())
                .durationSeconds(room.getRoundDurationSeconds())
                .build();
        webSocketSender.send(Audience.session(sessionId), data);
    }

    public void relayStroke(Room room, Player drawer, DrawingStroke stroke) {
        GamePayloads.StrokeRelay data = GamePayloads.StrokeRelay.builder()
                .username(drawer.getUsername())
                .stroke(stroke)
                .build();
        webSocketSender.send(Audience.roomExcept(room, drawer.getSessionId()), data);
    }

    public void broadcastClearCanvas(Room room) {
        webSocketSender.send(Audience.room(room),
                GamePayloads.ClearCanvas.builder().roomCode(room.getRoomCode()).build());
    }

    public void broadcastCorrectGuess(Room room, Player player, int pointsAwarded) {
        GamePayloads.CorrectGuess data = GamePayloads.CorrectGuess.builder()
                .username(player.getUsername())
                .pointsAwarded(pointsAwarded)
                .totalScore(player.getScore())
                .build();
        webSocketSender.send(Audience.room(room), data);
    }

    public void broadcastRoundEnd(Room room, String revealedWord) {
        GamePayloads.RoundEnd data = GamePayloads.RoundEnd.builder()
                .roundNumber(room.getRoundNumber())
                .word(revealedWord)
                .players(PlayerInfo.from(room.getPlayersByScore()))
                .build();
        webSocketSender.send(Audience.room(room), data);
    }

    public void sendError(String sessionId, ErrorCode errorCode) {
        webSocketSender.sendError(sessionId, errorCode);
    }
}
