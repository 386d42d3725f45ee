package com.copyleft.DrawGuess.feature.lobby;

import com.copyleft.DrawGuess.config.GameProperties;
import com.copyleft.DrawGuess.domain.ChatMessage;
import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.domain.type.RoomState;
import com.copyleft.DrawGuess.feature.chat.ChatResponseSender;
import com.copyleft.DrawGuess.feature.game.GameEngine;
import com.copyleft.DrawGuess.feature.game.GameResponseSender;
import com.copyleft.DrawGuess.feature.game.GameRoomLockFacade;
import com.copyleft.DrawGuess.feature.game.LockResult;
import com.copyleft.DrawGuess.feature.game.event.PlayerLeftEvent;
import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.global.constant.GameCode;
import com.copyleft.DrawGuess.infra.persistence.RoomRepository;
import com.copyleft.DrawGuess.infra.websocket.WebSocketSessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;

@Slf4j
@Service
@RequiredArgsConstructor
public class LobbyService {

    private final RoomRepository roomRepository;
    private final GameEngine gameEngine;
    private final GameRoomLockFacade lockFacade;
    private final GameProperties gameProperties;
    private final LobbyResponseSender responseSender;
    private final ChatResponseSender chatResponseSender;
    private final GameResponseSender gameResponseSender;
    private final WebSocketSessionManager sessionManager;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public void createRoom(String sessionId, String username) {
        String name = validateUsername(username);
        if (name == null) {
            responseSender.sendError(sessionId, ErrorCode.INVALID_USERNAME);
            return;
        }

        Room room = null;
        for (int attempt = 1; attempt <= gameProperties.roomCodeMaxAttempts() && room == null; attempt++) {
            String roomCode = gameEngine.generateRoomCode();
            room = gameEngine.createRoom(roomCode).orElse(null);
            if (room == null) {
                log.warn("방 코드 충돌, 재생성 ({}/{}): code={}", attempt, gameProperties.roomCodeMaxAttempts(), roomCode);
            }
        }
        if (room == null) {
            responseSender.sendError(sessionId, ErrorCode.ROOM_CREATE_FAILED);
            return;
        }

        Room created = room;
        Room previous = findCurrentRoom(sessionId);
        LockResult result = lockFacade.executeBoth(created, previous, () -> {
            // 연결 하나당 방 하나: 새 방이 준비된 뒤에만 이전 방에서 나간다
            removeFromRoom(sessionId);

            Player host = gameEngine.addPlayer(created, sessionId, name).orElse(null);
            if (host == null) {
                discardRoom(created);
                responseSender.sendError(sessionId, ErrorCode.ROOM_CREATE_FAILED);
                return;
            }
            if (!attachSession(sessionId, created)) {
                return;
            }

            responseSender.sendRoomCreated(sessionId, created);
            log.info("방 생성 완료: code={}, host={}", created.getRoomCode(), name);
        });

        if (result.isLockFailed()) {
            lockFacade.executeAwaiting(created, () -> discardRoom(created));
            responseSender.sendError(sessionId, ErrorCode.ROOM_BUSY);
        }
    }

    public void joinRoom(String sessionId, String roomCode, String username) {
        String name = validateUsername(username);
        if (name == null) {
            responseSender.sendError(sessionId, ErrorCode.INVALID_USERNAME);
            return;
        }

        Room room = StringUtils.hasText(roomCode) ? roomRepository.findRoomByCode(roomCode).orElse(null) : null;
        if (room == null) {
            responseSender.sendError(sessionId, ErrorCode.ROOM_NOT_FOUND);
            return;
        }

        String currentRoomCode = roomRepository.getRoomCodeBySessionId(sessionId);
        if (room.getRoomCode().equals(currentRoomCode)) {
            log.info("이미 입장한 방에 다시 입장 요청: session={}, room={}", sessionId, currentRoomCode);
            return;
        }

        Room previous = findCurrentRoom(sessionId);
        LockResult result = lockFacade.executeBoth(room, previous, () -> {
            if (room.isClosed()) {
                responseSender.sendError(sessionId, ErrorCode.ROOM_NOT_FOUND);
                return;
            }
            if (room.isUsernameTaken(name)) {
                responseSender.sendError(sessionId, ErrorCode.USERNAME_TAKEN);
                return;
            }

            // 입장이 확정된 뒤에만 이전 방에서 나간다
            removeFromRoom(sessionId);

            Player player = gameEngine.addPlayer(room, sessionId, name).orElse(null);
            if (player == null) {
                responseSender.sendError(sessionId, ErrorCode.USERNAME_TAKEN);
                return;
            }
            if (!attachSession(sessionId, room)) {
                return;
            }

            responseSender.sendChatHistory(sessionId, room);
            sendRoundInProgress(sessionId, room);

            ChatMessage joined = ChatMessage.system(GameCode.PLAYER_JOINED.format(name), clock.millis());
            room.appendChat(joined);
            responseSender.broadcastRoster(room);
            chatResponseSender.broadcastChat(room, joined);

            log.info("방 입장 완료: room={}, player={}", room.getRoomCode(), name);
        });

        if (result.isLockFailed()) {
            responseSender.sendError(sessionId, ErrorCode.ROOM_BUSY);
        }
    }

    public void leaveRoom(String sessionId) {
        String roomCode = removeFromRoom(sessionId);
        if (roomCode == null) {
            log.info("이미 방에 없는 유저의 퇴장 요청: {}", sessionId);
        }
        responseSender.sendLeaveSuccess(sessionId, roomCode);
    }

    public void handleDisconnect(String sessionId) {
        removeFromRoom(sessionId);
    }

    /**
     * 세션 매핑을 떼어낸 쪽만 퇴장 처리를 한다. 연결 종료와 명령이 겹쳐도 한 번만 실행된다.
     *
     * @return 떠난 방 코드. 방에 없었으면 null
     */
    private String removeFromRoom(String sessionId) {
        String roomCode = roomRepository.deleteSessionRoomMapping(sessionId);
        if (roomCode == null) {
            return null;
        }

        Room room = roomRepository.findRoomByCode(roomCode).orElse(null);
        if (room == null) {
            return roomCode;
        }

        lockFacade.executeAwaiting(room, () -> removePlayer(room, sessionId));
        return roomCode;
    }

    private Room findCurrentRoom(String sessionId) {
        String roomCode = roomRepository.getRoomCodeBySessionId(sessionId);
        return roomCode == null ? null : roomRepository.findRoomByCode(roomCode).orElse(null);
    }

    private void removePlayer(Room room, String sessionId) {
        Player player = room.findPlayer(sessionId).orElse(null);
        if (player == null) {
            return;
        }
        boolean wasDrawing = room.isDrawer(sessionId);

        if (!gameEngine.removePlayer(room, sessionId)) {
            return;
        }

        boolean roomDeleted = room.isClosed();
        if (!roomDeleted) {
            ChatMessage left = ChatMessage.system(GameCode.PLAYER_LEFT.format(player.getUsername()), clock.millis());
            room.appendChat(left);
            responseSender.broadcastRoster(room);
            chatResponseSender.broadcastChat(room, left);
        }

        eventPublisher.publishEvent(new PlayerLeftEvent(room.getRoomCode(), sessionId, wasDrawing, roomDeleted));
        log.info("방 퇴장 처리 완료: session={}, room={}, roomDeleted={}", sessionId, room.getRoomCode(), roomDeleted);
    }

    /**
     * 세션을 방에 연결한다. 그 사이 연결이 끊겼으면 방금 추가한 플레이어를 조용히 되돌린다.
     */
    private boolean attachSession(String sessionId, Room room) {
        if (!roomRepository.saveSessionRoomMapping(sessionId, room.getRoomCode())) {
            log.warn("세션이 이미 다른 방에 연결됨: session={}", sessionId);
            gameEngine.removePlayer(room, sessionId);
            return false;
        }

        if (!sessionManager.isRegistered(sessionId)) {
            log.info("입장 처리 중 연결 종료: session={}, room={}", sessionId, room.getRoomCode());
            if (roomRepository.deleteSessionRoomMapping(sessionId, room.getRoomCode())) {
                gameEngine.removePlayer(room, sessionId);
            }
            return false;
        }
        return true;
    }

    private void sendRoundInProgress(String sessionId, Room room) {
        if (room.getState() != RoomState.DRAWING) {
            return;
        }
        room.getDrawer().ifPresent(drawer ->
                gameResponseSender.sendRoundInProgress(sessionId, room, drawer, gameEngine.getMaskedWord(room)));
    }

    private void discardRoom(Room room) {
        if (room.isEmpty() && !room.isClosed()) {
            room.close();
            roomRepository.deleteRoom(room);
        }
    }

    private String validateUsername(String username) {
        if (!StringUtils.hasText(username)) {
            return null;
        }
        String trimmed = username.trim();
        return trimmed.length() > gameProperties.usernameMaxLength() ? null : trimmed;
    }
}
