package com.copyleft.DrawGuess.infra.websocket;

import com.copyleft.DrawGuess.domain.Room;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 이벤트 수신 대상.
 * 수신자 목록은 생성 시점의 방 인원으로 고정되므로 방 락 안에서 만들어야 한다.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Audience {

    public enum Mode {
        SESSION,     // 요청자 본인 또는 특정 연결 하나
        ROOM,        // 방 전체
        ROOM_EXCEPT  // 방 전체에서 한 명 제외
    }

    private final Mode mode;
    private final List<String> recipients;

    public static Audience session(String sessionId) {
        return new Audience(Mode.SESSION, List.of(sessionId));
    }

    public static Audience room(Room room) {
        return new Audience(Mode.ROOM, room.getSessionIds());
    }

    public static Audience roomExcept(Room room, String excludedSessionId) {
        List<String> recipients = room.getSessionIds().stream()
                .filter(id -> !id.equals(excludedSessionId))
                .toList();
        return new Audience(Mode.ROOM_EXCEPT, recipients);
    }

    public boolean isEmpty() {
        return recipients.isEmpty();
    }
}
