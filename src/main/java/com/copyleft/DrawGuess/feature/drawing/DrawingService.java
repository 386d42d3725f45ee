package com.copyleft.DrawGuess.feature.drawing;

import com.copyleft.DrawGuess.domain.DrawingStroke;
import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.feature.game.GameResponseSender;
import com.copyleft.DrawGuess.feature.game.GameRoomLockFacade;
import com.copyleft.DrawGuess.infra.persistence.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 그림 중계. 요청마다 연결 ID 로 출제자인지 다시 확인하고, 아니면 응답 없이 버린다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DrawingService {

    private final RoomRepository roomRepository;
    private final GameRoomLockFacade lockFacade;
    private final GameResponseSender gameResponseSender;

    public void relayStroke(String sessionId, String roomCode, DrawingStroke stroke) {
        Room room = roomRepository.findRoomByCode(roomCode).orElse(null);
        if (room == null || stroke == null) {
            log.debug("그림 중계 무시 (방 없음/빈 선): session={}, room={}", sessionId, roomCode);
            return;
        }

        lockFacade.execute(room, () -> {
            Player drawer = currentDrawer(room, sessionId);
            if (drawer == null) {
                return;
            }
            gameResponseSender.relayStroke(room, drawer, stroke);
        });
    }

    public void clearCanvas(String sessionId, String roomCode) {
        Room room = roomRepository.findRoomByCode(roomCode).orElse(null);
        if (room == null) {
            log.debug("캔버스 지우기 무시 (방 없음): session={}, room={}", sessionId, roomCode);
            return;
        }

        lockFacade.execute(room, () -> {
            if (currentDrawer(room, sessionId) == null) {
                return;
            }
            gameResponseSender.broadcastClearCanvas(room);
        });
    }

    private Player currentDrawer(Room room, String sessionId) {
        if (room.isClosed() || !room.isDrawer(sessionId)) {
            log.debug("출제자가 아닌 연결의 그림 요청 무시: session={}, room={}", sessionId, room.getRoomCode());
            return null;
        }
        return room.findPlayer(sessionId).orElse(null);
    }
}
