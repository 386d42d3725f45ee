package com.copyleft.DrawGuess.feature.chat;

import com.copyleft.DrawGuess.config.GameProperties;
import com.copyleft.DrawGuess.domain.ChatMessage;
import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.domain.type.RoomState;
import com.copyleft.DrawGuess.feature.game.GameEngine;
import com.copyleft.DrawGuess.feature.game.GameFlowService;
import com.copyleft.DrawGuess.feature.game.GameResponseSender;
import com.copyleft.DrawGuess.feature.game.GameRoomLockFacade;
import com.copyleft.DrawGuess.feature.game.LockResult;
import com.copyleft.DrawGuess.feature.lobby.LobbyResponseSender;
import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.global.constant.GameCode;
import com.copyleft.DrawGuess.infra.persistence.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;

/**
 * 채팅과 정답 판정. 출제자가 아닌 사람의 메시지는 먼저 정답인지 확인한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

    private final RoomRepository roomRepository;
    private final GameRoomLockFacade lockFacade;
    private final GameEngine gameEngine;
    private final GameFlowService gameFlowService;
    private final ChatResponseSender chatResponseSender;
    private final GameResponseSender gameResponseSender;
    private final LobbyResponseSender lobbyResponseSender;
    private final GameProperties gameProperties;
    private final Clock clock;

    public void sendMessage(String sessionId, String roomCode, String text) {
        if (!StringUtils.hasText(text)) {
            chatResponseSender.sendError(sessionId, ErrorCode.CHAT_EMPTY);
            return;
        }
        String message = text.trim();
        if (message.length() > gameProperties.chatMaxLength()) {
            chatResponseSender.sendError(sessionId, ErrorCode.CHAT_TOO_LONG);
            return;
        }

        Room room = roomRepository.findRoomByCode(roomCode).orElse(null);
        if (room == null) {
            chatResponseSender.sendError(sessionId, ErrorCode.ROOM_NOT_FOUND);
            return;
        }

        LockResult result = lockFacade.execute(room, () -> {
            if (room.isClosed()) {
                chatResponseSender.sendError(sessionId, ErrorCode.ROOM_NOT_FOUND);
                return;
            }
            Player sender = room.findPlayer(sessionId).orElse(null);
            if (sender == null) {
                chatResponseSender.sendError(sessionId, ErrorCode.NOT_IN_ROOM);
                return;
            }

            if (!sender.isDrawing()) {
                int scoreBefore = sender.getScore();
                if (gameEngine.checkGuess(room, sessionId, message)) {
                    handleCorrectGuess(room, sender, sender.getScore() - scoreBefore);
                    return;
                }
            }

            // 출제자나 이미 맞힌 사람이 정답을 채팅으로 흘리는 경우
            if (room.getState() == RoomState.DRAWING && gameEngine.matchesWord(room, message)) {
                log.debug("정답 단어 채팅 차단: room={}, player={}", room.getRoomCode(), sender.getUsername());
                return;
            }

            ChatMessage chat = ChatMessage.chat(sender.getUsername(), message, clock.millis());
            room.appendChat(chat);
            chatResponseSender.broadcastChat(room, chat);
        });

        if (result.isLockFailed()) {
            chatResponseSender.sendError(sessionId, ErrorCode.ROOM_BUSY);
        }
    }

    private void handleCorrectGuess(Room room, Player player, int pointsAwarded) {
        log.info("정답: room={}, player={}, points={}", room.getRoomCode(), player.getUsername(), pointsAwarded);

        ChatMessage notice = ChatMessage.correctGuess(GameCode.CORRECT_GUESS.format(player.getUsername()), clock.millis());
        room.appendChat(notice);

        gameResponseSender.broadcastCorrectGuess(room, player, pointsAwarded);
        chatResponseSender.broadcastChat(room, notice);
        lobbyResponseSender.broadcastRoster(room);

        if (room.allGuessersCorrect()) {
            log.info("전원 정답, 라운드 종료: room={}", room.getRoomCode());
            gameFlowService.concludeRound(room);
        }
    }
}
