package com.copyleft.DrawGuess.feature.drawing.dto;

import com.copyleft.DrawGuess.domain.DrawingStroke;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DrawingRequest {
    private String roomCode;
    private DrawingStroke stroke; // CLEAR_CANVAS 에서는 비어 있음
}
