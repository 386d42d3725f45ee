package com.copyleft.DrawGuess.infra.websocket.handler;

import com.copyleft.DrawGuess.domain.DrawingStroke;
import com.copyleft.DrawGuess.feature.chat.ChatService;
import com.copyleft.DrawGuess.feature.drawing.DrawingService;
import com.copyleft.DrawGuess.feature.game.GameFlowService;
import com.copyleft.DrawGuess.feature.lobby.LobbyService;
import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.infra.websocket.WebSocketSender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.WebSocketSession;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CommandHandlersTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private LobbyService lobbyService;
    private GameFlowService gameFlowService;
    private ChatService chatService;
    private DrawingService drawingService;
    private WebSocketSender webSocketSender;
    private WebSocketSession session;

    @BeforeEach
    void setUp() {
        lobbyService = mock(LobbyService.class);
        gameFlowService = mock(GameFlowService.class);
        chatService = mock(ChatService.class);
        drawingService = mock(DrawingService.class);
        webSocketSender = mock(WebSocketSender.class);
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
    }

    @Test
    @DisplayName("CREATE_ROOM 은 닉네임으로 방을 만든다")
    void createRoom() throws Exception {
        CreateRoomHandler handler = new CreateRoomHandler(lobbyService, webSocketSender, objectMapper);

        handler.handle(session, objectMapper.readTree("{\"username\":\"Alice\"}"));

        assertEquals("CREATE_ROOM", handler.getAction());
        verify(lobbyService).createRoom("s1", "Alice");
    }

    @Test
    @DisplayName("payload 가 없으면 INVALID_REQUEST")
    void createRoom_MissingPayload() {
        CreateRoomHandler handler = new CreateRoomHandler(lobbyService, webSocketSender, objectMapper);

        handler.handle(session, null);

        verify(webSocketSender).sendError("s1", ErrorCode.INVALID_REQUEST);
        verifyNoInteractions(lobbyService);
    }

    @Test
    @DisplayName("JOIN_ROOM 은 방 코드가 없으면 INVALID_REQUEST")
    void joinRoom() throws Exception {
        JoinRoomHandler handler = new JoinRoomHandler(lobbyService, webSocketSender, objectMapper);

        handler.handle(session, objectMapper.readTree("{\"username\":\"Bob\"}"));
        handler.handle(session, objectMapper.readTree("{\"roomCode\":\"AB12CD\",\"username\":\"Bob\"}"));

        verify(webSocketSender).sendError("s1", ErrorCode.INVALID_REQUEST);
        verify(lobbyService).joinRoom("s1", "AB12CD", "Bob");
    }

    @Test
    @DisplayName("LEAVE_ROOM 은 payload 없이 동작한다")
    void leaveRoom() {
        new LeaveRoomHandler(lobbyService).handle(session, null);

        verify(lobbyService).leaveRoom("s1");
    }

    @Test
    @DisplayName("라운드 명령은 방 코드로 게임 흐름을 호출한다")
    void roundCommands() throws Exception {
        JsonNode payload = objectMapper.readTree("{\"roomCode\":\"AB12CD\"}");

        new StartGameHandler(gameFlowService, webSocketSender, objectMapper).handle(session, payload);
        new EndRoundHandler(gameFlowService, webSocketSender, objectMapper).handle(session, payload);
        new NextRoundHandler(gameFlowService, webSocketSender, objectMapper).handle(session, payload);

        verify(gameFlowService).startGame("s1", "AB12CD");
        verify(gameFlowService).endRound("s1", "AB12CD");
        verify(gameFlowService).nextRound("s1", "AB12CD");
    }

    @Test
    @DisplayName("SEND_MESSAGE 는 채팅 서비스로 전달된다")
    void sendMessage() throws Exception {
        new SendMessageHandler(chatService, webSocketSender, objectMapper)
                .handle(session, objectMapper.readTree("{\"roomCode\":\"AB12CD\",\"text\":\"apple\"}"));

        verify(chatService).sendMessage("s1", "AB12CD", "apple");
    }

    @Test
    @DisplayName("SEND_DRAWING 은 선 데이터를 그대로 읽어 넘긴다")
    void sendDrawing() throws Exception {
        String json = "{\"roomCode\":\"AB12CD\",\"stroke\":{\"start\":{\"x\":1,\"y\":2},"
                + "\"end\":{\"x\":3,\"y\":4},\"color\":\"#ff0000\",\"width\":3.5,\"action\":\"DRAW\"}}";

        new SendDrawingHandler(drawingService, webSocketSender, objectMapper)
                .handle(session, objectMapper.readTree(json));

        ArgumentCaptor<DrawingStroke> captor = ArgumentCaptor.forClass(DrawingStroke.class);
        verify(drawingService).relayStroke(eq("s1"), eq("AB12CD"), captor.capture());
        assertEquals("#ff0000", captor.getValue().getColor());
        assertEquals(3.5, captor.getValue().getWidth());
        assertEquals(4.0, captor.getValue().getEnd().getY());
    }

    @Test
    @DisplayName("CLEAR_CANVAS 는 그림 서비스로 전달된다")
    void clearCanvas() throws Exception {
        new ClearCanvasHandler(drawingService, webSocketSender, objectMapper)
                .handle(session, objectMapper.readTree("{\"roomCode\":\"AB12CD\"}"));

        verify(drawingService).clearCanvas("s1", "AB12CD");
    }

    @Test
    @DisplayName("형식이 맞지 않는 payload 는 INVALID_REQUEST")
    void malformedPayload() throws Exception {
        new SendMessageHandler(chatService, webSocketSender, objectMapper)
                .handle(session, objectMapper.readTree("{\"roomCode\":{\"nested\":true}}"));

        verify(webSocketSender).sendError("s1", ErrorCode.INVALID_REQUEST);
        verify(chatService, never()).sendMessage(anyString(), anyString(), any());
    }
}
