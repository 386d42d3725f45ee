package com.copyleft.DrawGuess.feature.game;

import com.copyleft.DrawGuess.config.GameProperties;
import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.domain.type.RoomState;
import com.copyleft.DrawGuess.feature.game.event.PlayerLeftEvent;
import com.copyleft.DrawGuess.feature.game.event.RoundTimeoutEvent;
import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.infra.persistence.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * 라운드 흐름: 게임 시작, 라운드 종료, 다음 라운드.
 * 퇴장/시간 초과에 의한 자동 종료도 여기서 처리한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameFlowService {

    private final RoomRepository roomRepository;
    private final GameRoomLockFacade lockFacade;
    private final GameEngine gameEngine;
    private final GameResponseSender gameResponseSender;
    private final RoundTimer roundTimer;
    private final GameProperties gameProperties;

    public void startGame(String sessionId, String roomCode) {
        Room room = roomRepository.findRoomByCode(roomCode).orElse(null);
        if (room == null) {
            gameResponseSender.sendError(sessionId, ErrorCode.ROOM_NOT_FOUND);
            return;
        }

        LockResult result = lockFacade.execute(room, () -> {
            if (room.isClosed()) {
                gameResponseSender.sendError(sessionId, ErrorCode.ROOM_NOT_FOUND);
                return;
            }
            if (room.getState() != RoomState.WAITING) {
                gameResponseSender.sendError(sessionId, ErrorCode.GAME_ALREADY_STARTED);
                return;
            }
            if (room.getPlayers().size() < gameProperties.minPlayersToStart()) {
                gameResponseSender.sendError(sessionId, ErrorCode.NOT_ENOUGH_PLAYERS);
                return;
            }
            beginRound(room);
        });

        if (result.isLockFailed()) {
            gameResponseSender.sendError(sessionId, ErrorCode.ROOM_BUSY);
        }
    }

    public void endRound(String sessionId, String roomCode) {
        Room room = roomRepository.findRoomByCode(roomCode).orElse(null);
        if (room == null) {
            gameResponseSender.sendError(sessionId, ErrorCode.ROOM_NOT_FOUND);
            return;
        }

        LockResult result = lockFacade.execute(room, () -> {
            if (room.isClosed()) {
                gameResponseSender.sendError(sessionId, ErrorCode.ROOM_NOT_FOUND);
                return;
            }
            if (!concludeRound(room)) {
                log.debug("진행 중인 라운드 없음, END_ROUND 무시: room={}, state={}", room.getRoomCode(), room.getState());
            }
        });

        if (result.isLockFailed()) {
            gameResponseSender.sendError(sessionId, ErrorCode.ROOM_BUSY);
        }
    }

    public void nextRound(String sessionId, String roomCode) {
        Room room = roomRepository.findRoomByCode(roomCode).orElse(null);
        if (room == null) {
            gameResponseSender.sendError(sessionId, ErrorCode.ROOM_NOT_FOUND);
            return;
        }

        LockResult result = lockFacade.execute(room, () -> {
            if (room.isClosed()) {
                gameResponseSender.sendError(sessionId, ErrorCode.ROOM_NOT_FOUND);
                return;
            }
            // 중복 요청: 이미 다음 라운드가 시작됨
            if (room.getState() == RoomState.DRAWING) {
                log.debug("라운드 진행 중, NEXT_ROUND 무시: room={}", room.getRoomCode());
                return;
            }
            if (room.getPlayers().size() < gameProperties.minPlayersToStart()) {
                gameResponseSender.sendError(sessionId, ErrorCode.NOT_ENOUGH_PLAYERS);
                return;
            }
            gameResponseSender.broadcastClearCanvas(room);
            beginRound(room);
        });

        if (result.isLockFailed()) {
            gameResponseSender.sendError(sessionId, ErrorCode.ROOM_BUSY);
        }
    }

    /**
     * 진행 중인 라운드를 끝내고 결과를 방송한다. 호출자는 방 락을 잡고 있어야 한다.
     *
     * @return 이번 호출로 라운드가 끝났으면 true
     */
    public boolean concludeRound(Room room) {
        String revealedWord = gameEngine.endRound(room).orElse(null);
        if (revealedWord == null) {
            return false;
        }
        roundTimer.cancel(room.getRoomCode());
        gameResponseSender.broadcastRoundEnd(room, revealedWord);
        return true;
    }

    private void beginRound(Room room) {
        Player drawer = gameEngine.startNewRound(room);
        if (drawer == null) {
            return;
        }
        String maskedWord = gameEngine.getMaskedWord(room);
        gameResponseSender.sendRoundStart(room, drawer, maskedWord);
        roundTimer.start(room);
    }

    @EventListener
    public void handlePlayerLeft(PlayerLeftEvent event) {
        if (event.isRoomDeleted()) {
            roundTimer.cancel(event.getRoomCode());
            return;
        }

        Room room = roomRepository.findRoomByCode(event.getRoomCode()).orElse(null);
        if (room == null) {
            return;
        }

        lockFacade.executeAwaiting(room, () -> {
            if (room.isClosed() || room.getState() != RoomState.DRAWING) {
                return;
            }
            if (event.isWasDrawing()) {
                log.info("출제자 퇴장으로 라운드 종료: room={}", room.getRoomCode());
                concludeRound(room);
            } else if (room.allGuessersCorrect()) {
                log.info("남은 인원 전원 정답, 라운드 종료: room={}", room.getRoomCode());
                concludeRound(room);
            }
        });
    }

    @EventListener
    public void handleRoundTimeout(RoundTimeoutEvent event) {
        Room room = roomRepository.findRoomByCode(event.getRoomCode()).orElse(null);
        if (room == null) {
            return;
        }

        lockFacade.executeAwaiting(room, () -> {
            if (room.isClosed() || room.getRoundNumber() != event.getRoundNumber()) {
                return;
            }
            concludeRound(room);
        });
    }
}
