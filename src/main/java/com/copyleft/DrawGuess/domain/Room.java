package com.copyleft.DrawGuess.domain;

import com.copyleft.DrawGuess.domain.type.RoomState;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 게임 한 판의 모든 가변 상태.
 * 상태 변경은 반드시 {@link #getLock()} 을 잡은 상태에서 이루어진다.
 */
@Getter
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@ToString
public class Room {

    private final String roomCode;  // 6자리, 대문자 정규화, 생성 후 불변

    @Builder.Default
    private final List<Player> players = new ArrayList<>(); // 입장 순서 = 출제 순서

    @Setter
    private String currentDrawerId;
    @Setter
    @Builder.Default
    private String currentWord = "";  // 라운드 밖에서는 빈 문자열

    @Builder.Default
    private final List<String> wordPool = List.of();

    @Setter
    private int roundNumber;
    @Setter
    private long roundStartTime;    // epoch millis
    private final int roundDurationSeconds;

    @Setter
    @Builder.Default
    private RoomState state = RoomState.WAITING;

    @ToString.Exclude
    @Builder.Default
    private final List<ChatMessage> chatHistory = new ArrayList<>();

    @ToString.Exclude
    @Builder.Default
    private final ReentrantLock lock = new ReentrantLock();

    // 저장소에서 제거된 방. 오래된 참조로 들어온 요청을 거절하기 위함
    private boolean closed;

    public static Room create(String roomCode, List<String> wordPool, int roundDurationSeconds) {
        return Room.builder()
                .roomCode(roomCode)
                .wordPool(List.copyOf(wordPool))
                .roundDurationSeconds(roundDurationSeconds)
                .state(RoomState.WAITING)
                .build();
    }

    public void addPlayer(Player player) {
        this.players.add(player);
    }

    public Optional<Player> removePlayer(String sessionId) {
        Optional<Player> target = findPlayer(sessionId);
        target.ifPresent(this.players::remove);
        return target;
    }

    public Optional<Player> findPlayer(String sessionId) {
        return this.players.stream()
                .filter(p -> Objects.equals(p.getSessionId(), sessionId))
                .findFirst();
    }

    public boolean isUsernameTaken(String username) {
        return this.players.stream()
                .anyMatch(p -> p.getUsername().equalsIgnoreCase(username));
    }

    public int indexOfPlayer(String sessionId) {
        for (int i = 0; i < this.players.size(); i++) {
            if (Objects.equals(this.players.get(i).getSessionId(), sessionId)) {
                return i;
            }
        }
        return -1;
    }

    public Optional<Player> getDrawer() {
        if (this.currentDrawerId == null) {
            return Optional.empty();
        }
        return findPlayer(this.currentDrawerId);
    }

    public boolean isDrawer(String sessionId) {
        return sessionId != null && sessionId.equals(this.currentDrawerId);
    }

    public List<Player> getGuessers() {
        return this.players.stream()
                .filter(p -> !p.isDrawing())
                .toList();
    }

    /**
     * 출제자를 제외한 전원이 정답을 맞혔는지. 맞힐 사람이 없으면 false.
     */
    public boolean allGuessersCorrect() {
        List<Player> guessers = getGuessers();
        return !guessers.isEmpty() && guessers.stream().allMatch(Player::isGuessedCorrectly);
    }

    public List<Player> getPlayersByScore() {
        List<Player> sorted = new ArrayList<>(this.players);
        sorted.sort(Comparator.comparingInt(Player::getScore).reversed());
        return sorted;
    }

    public void appendChat(ChatMessage message) {
        this.chatHistory.add(message);
    }

    public List<ChatMessage> getChatHistory() {
        return Collections.unmodifiableList(this.chatHistory);
    }

    public List<String> getSessionIds() {
        return this.players.stream()
                .map(Player::getSessionId)
                .toList();
    }

    public boolean isEmpty() {
        return this.players.isEmpty();
    }

    public void close() {
        this.closed = true;
    }
}
