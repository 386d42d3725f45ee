package com.copyleft.DrawGuess.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@AllArgsConstructor
@ToString
public class ChatMessage {

    public static final String SYSTEM_USERNAME = "System";

    private final String username;
    private final String text;
    private final long timestamp;
    private final boolean systemMessage;
    private final boolean correctGuess;

    public static ChatMessage chat(String username, String text, long timestamp) {
        return new ChatMessage(username, text, timestamp, false, false);
    }

    public static ChatMessage system(String text, long timestamp) {
        return new ChatMessage(SYSTEM_USERNAME, text, timestamp, true, false);
    }

    public static ChatMessage correctGuess(String text, long timestamp) {
        return new ChatMessage(SYSTEM_USERNAME, text, timestamp, true, true);
    }
}
