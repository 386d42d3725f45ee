package com.copyleft.DrawGuess.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 캔버스 선 하나. 서버는 내용을 해석하지 않고 출제자 권한만 확인한 뒤 중계한다.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DrawingStroke {

    private Point start;
    private Point end;

    private String color;
    private double width;
    private String action;   // DRAW, ERASE, FILL ...

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Point {
        private double x;
        private double y;
    }
}
