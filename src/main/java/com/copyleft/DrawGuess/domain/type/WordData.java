package com.copyleft.DrawGuess.domain.type;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;

@Getter
public enum WordData {
    ANIMAL(Arrays.asList(
            "cat", "dog", "elephant", "giraffe", "penguin", "octopus",
            "rabbit", "snake", "turtle", "butterfly", "shark", "owl"
    )),

    FOOD(Arrays.asList(
            "pizza", "banana", "hamburger", "ice cream", "apple", "carrot",
            "sandwich", "cake", "cheese", "popcorn"
    )),

    OBJECT(Arrays.asList(
            "umbrella", "guitar", "bicycle", "scissors", "glasses", "clock",
            "camera", "lamp", "key", "ladder", "candle", "backpack"
    )),

    PLACE(Arrays.asList(
            "house", "castle", "beach", "mountain", "bridge", "island",
            "lighthouse", "volcano"
    )),

    THING_IN_THE_SKY(Arrays.asList(
            "airplane", "rocket", "rainbow", "moon", "sun", "star",
            "cloud", "kite", "balloon"
    ));

    private final List<String> words;

    WordData(List<String> words) {
        this.words = words;
    }

    private static final List<String> ALL_WORDS = Arrays.stream(values())
            .flatMap(data -> data.getWords().stream())
            .toList();

    /**
     * 전체 단어 목록 (불변). 방 생성 시 wordPool 로 사용된다.
     */
    public static List<String> allWords() {
        return ALL_WORDS;
    }
}
