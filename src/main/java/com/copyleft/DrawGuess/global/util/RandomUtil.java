package com.copyleft.DrawGuess.global.util;

import java.security.SecureRandom;
import java.util.List;

public class RandomUtil {

    private static final SecureRandom random = new SecureRandom();
    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    public static final int ROOM_CODE_LENGTH = 6;

    private RandomUtil() {
    }

    /**
     * 대문자+숫자 6자리 코드 생성 (RoomCode용).
     * 고유성은 보장하지 않는다. 충돌은 저장소가 거절하고 호출자가 다시 생성한다.
     */
    public static String generateRoomCode() {
        StringBuilder sb = new StringBuilder(ROOM_CODE_LENGTH);
        for (int i = 0; i < ROOM_CODE_LENGTH; i++) {
            int index = random.nextInt(ALPHANUMERIC.length());
            sb.append(ALPHANUMERIC.charAt(index));
        }
        return sb.toString();
    }

    public static <T> T pick(List<T> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("candidates must not be empty");
        }
        return candidates.get(random.nextInt(candidates.size()));
    }
}
