package com.copyleft.DrawGuess.infra.persistence;

import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.domain.type.WordData;
import org.springframework.stereotype.Repository;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 프로세스 메모리 위의 방 저장소.
 * <p>
 * 맵 단위 연산(생성/조회/삭제)은 개별 방의 락과 무관하게 동시 호출에 안전하다.
 * 방 코드는 항상 대문자로 정규화해서 비교/저장한다.
 * 세션 → 방 코드 매핑도 함께 관리한다 (연결 하나당 방 하나).
 */
@Repository
public class RoomRepository {

    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> sessionRooms = new ConcurrentHashMap<>();

    /**
     * 새 방을 등록한다. 같은 코드의 방이 이미 있으면 비어 있는 결과를 돌려준다.
     */
    public Optional<Room> createRoom(String roomCode, int roundDurationSeconds) {
        String code = normalize(roomCode);
        Room room = Room.create(code, WordData.allWords(), roundDurationSeconds);

        Room existing = rooms.putIfAbsent(code, room);
        return existing == null ? Optional.of(room) : Optional.empty();
    }

    public Optional<Room> findRoomByCode(String roomCode) {
        if (roomCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rooms.get(normalize(roomCode)));
    }

    public boolean deleteRoom(String roomCode) {
        if (roomCode == null) {
            return false;
        }
        return rooms.remove(normalize(roomCode)) != null;
    }

    /**
     * 지정한 인스턴스일 때만 삭제한다. 같은 코드로 새로 만들어진 방을 지우지 않기 위함.
     */
    public boolean deleteRoom(Room room) {
        return rooms.remove(room.getRoomCode(), room);
    }

    public int countRooms() {
        return rooms.size();
    }

    // 세션 매핑

    public boolean saveSessionRoomMapping(String sessionId, String roomCode) {
        return sessionRooms.putIfAbsent(sessionId, normalize(roomCode)) == null;
    }

    public String getRoomCodeBySessionId(String sessionId) {
        return sessionRooms.get(sessionId);
    }

    /**
     * 매핑을 제거하고 제거된 방 코드를 돌려준다. 동시에 여러 번 불려도 한 번만 값을 얻는다.
     */
    public String deleteSessionRoomMapping(String sessionId) {
        return sessionRooms.remove(sessionId);
    }

    public boolean deleteSessionRoomMapping(String sessionId, String roomCode) {
        return sessionRooms.remove(sessionId, normalize(roomCode));
    }

    public static String normalize(String roomCode) {
        return roomCode.trim().toUpperCase(Locale.ROOT);
    }
}
