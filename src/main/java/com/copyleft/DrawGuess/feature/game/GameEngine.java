package com.copyleft.DrawGuess.feature.game;

import com.copyleft.DrawGuess.config.GameProperties;
import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.domain.type.RoomState;
import com.copyleft.DrawGuess.global.util.RandomUtil;
import com.copyleft.DrawGuess.infra.persistence.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 방 하나에 대한 게임 규칙 (입퇴장, 출제자 순환, 단어 선택, 정답 판정, 점수).
 * <p>
 * 모든 연산은 방 락(재진입 가능) 안에서 실행되므로 같은 방에 대해 순차적으로 보인다.
 * I/O 가 없고 즉시 끝난다. "없음" 은 예외 대신 빈 값이나 false 로 돌려준다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameEngine {

    private final RoomRepository roomRepository;
    private final GameProperties gameProperties;
    private final Clock clock;

    public Optional<Room> createRoom(String roomCode) {
        Optional<Room> created = roomRepository.createRoom(roomCode, gameProperties.roundDurationSeconds());
        created.ifPresent(room -> log.info("방 생성: code={}", room.getRoomCode()));
        return created;
    }

    public String generateRoomCode() {
        return RandomUtil.generateRoomCode();
    }

    /**
     * @return 추가된 플레이어. 같은 이름(대소문자 무시)이 이미 있거나 방이 닫혔으면 빈 값
     */
    public Optional<Player> addPlayer(Room room, String sessionId, String username) {
        return locked(room, () -> {
            if (room.isClosed() || room.isUsernameTaken(username)) {
                return Optional.<Player>empty();
            }
            Player player = Player.join(sessionId, username);
            room.addPlayer(player);
            return Optional.of(player);
        });
    }

    /**
     * 플레이어를 제거한다. 방이 비면 저장소에서 방을 지운다.
     *
     * @return 실제로 제거했으면 true
     */
    public boolean removePlayer(Room room, String sessionId) {
        return locked(room, () -> {
            Optional<Player> removed = room.removePlayer(sessionId);
            if (removed.isEmpty()) {
                return false;
            }

            if (room.isDrawer(sessionId)) {
                room.setCurrentDrawerId(null);
            }

            if (room.isEmpty()) {
                room.close();
                roomRepository.deleteRoom(room);
                log.info("방 삭제 (인원 0): code={}", room.getRoomCode());
            }
            return true;
        });
    }

    /**
     * 새 라운드. 인원 조건(2명 이상)은 호출자가 확인한다.
     * 출제자는 현재 명단의 위치 기준으로 다음 사람이며, 현재 출제자가 명단에 없으면 맨 앞 사람이다.
     *
     * @return 새 출제자. 방이 비어 있으면 null
     */
    public Player startNewRound(Room room) {
        return locked(room, () -> {
            if (room.isEmpty()) {
                return null;
            }

            room.getPlayers().forEach(Player::resetForRound);

            // 순서는 매번 현재 명단에서 다시 계산한다
            List<Player> turnOrder = List.copyOf(room.getPlayers());
            int currentIndex = room.indexOfPlayer(room.getCurrentDrawerId());
            Player nextDrawer = turnOrder.get((currentIndex + 1) % turnOrder.size());

            nextDrawer.setDrawing(true);
            room.setCurrentDrawerId(nextDrawer.getSessionId());
            room.setCurrentWord(RandomUtil.pick(room.getWordPool()));
            room.setRoundStartTime(clock.millis());
            room.setRoundNumber(room.getRoundNumber() + 1);
            room.setState(RoomState.DRAWING);

            log.info("라운드 시작: code={}, round={}, drawer={}",
                    room.getRoomCode(), room.getRoundNumber(), nextDrawer.getUsername());
            return nextDrawer;
        });
    }

    /**
     * 정답이면 점수를 주고 true. 오답, 출제자, 이미 맞힌 사람, 라운드 밖이면 아무것도 바꾸지 않고 false.
     */
    public boolean checkGuess(Room room, String sessionId, String text) {
        return locked(room, () -> {
            if (room.getState() != RoomState.DRAWING) {
                return false;
            }
            Player player = room.findPlayer(sessionId).orElse(null);
            if (player == null || player.isGuessedCorrectly() || player.isDrawing()) {
                return false;
            }
            if (!matchesWord(room, text)) {
                return false;
            }

            int points = calculatePoints(room);
            player.setGuessedCorrectly(true);
            player.addScore(points);
            return true;
        });
    }

    public boolean matchesWord(Room room, String text) {
        String word = room.getCurrentWord();
        return text != null && word != null && !word.isEmpty()
                && text.trim().equalsIgnoreCase(word);
    }

    /**
     * 기본 점수 + 남은 시간 보너스 (0 아래로 내려가지 않음).
     */
    int calculatePoints(Room room) {
        long elapsedSeconds = Math.max(0L, Math.floorDiv(clock.millis() - room.getRoundStartTime(), 1000L));
        long bonus = Math.max(0L, room.getRoundDurationSeconds() - elapsedSeconds);
        return gameProperties.correctGuessBasePoints() + (int) bonus;
    }

    public String getMaskedWord(Room room) {
        return locked(room, () -> {
            String word = room.getCurrentWord();
            return word == null ? "" : "_".repeat(word.length());
        });
    }

    /**
     * 진행 중인 라운드만 끝내고 정답 단어를 비운다. 이미 끝났거나 시작 전이면 비어 있다.
     *
     * @return 이번 라운드의 정답 단어
     */
    public Optional<String> endRound(Room room) {
        return locked(room, () -> {
            if (room.getState() != RoomState.DRAWING) {
                return Optional.empty();
            }
            String revealedWord = room.getCurrentWord();
            room.setState(RoomState.ROUND_END);
            room.setCurrentWord("");
            log.info("라운드 종료: code={}, round={}", room.getRoomCode(), room.getRoundNumber());
            return Optional.of(revealedWord);
        });
    }

    private <T> T locked(Room room, Supplier<T> action) {
        ReentrantLock lock = room.getLock();
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
