package com.copyleft.DrawGuess.global.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RandomUtilTest {

    @RepeatedTest(20)
    @DisplayName("방 코드는 대문자와 숫자 6자리다")
    void generateRoomCode_Format() {
        String code = RandomUtil.generateRoomCode();

        assertEquals(RandomUtil.ROOM_CODE_LENGTH, code.length());
        assertTrue(code.matches("[A-Z0-9]{6}"), code);
    }

    @Test
    @DisplayName("후보 목록에서 하나를 고른다")
    void pick_ReturnsCandidate() {
        List<String> words = List.of("cat", "dog", "bird");

        assertTrue(words.contains(RandomUtil.pick(words)));
        assertEquals("only", RandomUtil.pick(List.of("only")));
    }

    @Test
    @DisplayName("빈 목록에서 고르면 예외가 발생한다")
    void pick_Empty_Throws() {
        assertThrows(IllegalArgumentException.class, () -> RandomUtil.pick(List.of()));
        assertThrows(IllegalArgumentException.class, () -> RandomUtil.pick(null));
    }
}
