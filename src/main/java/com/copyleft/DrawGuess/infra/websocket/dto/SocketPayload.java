package com.copyleft.DrawGuess.infra.websocket.dto;

import com.copyleft.DrawGuess.global.constant.SocketEvent;

/**
 * 서버 → 클라이언트 이벤트 데이터. 구현 타입마다 이벤트가 하나로 정해진다.
 */
public interface SocketPayload {

    SocketEvent socketEvent();
}
