package com.copyleft.DrawGuess;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class DrawGuessApplicationTests {

    @LocalServerPort
    private int port;

    @Autowired
    private ObjectMapper objectMapper;

    private WebSocketSession connect(BlockingQueue<JsonNode> received) throws Exception {
        TextWebSocketHandler handler = new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
                received.add(objectMapper.readTree(message.getPayload()));
            }
        };
        return new StandardWebSocketClient()
                .execute(handler, "ws://localhost:" + port + "/ws")
                .get(5, TimeUnit.SECONDS);
    }

    private JsonNode awaitEvent(BlockingQueue<JsonNode> received, String event) throws InterruptedException {
        while (true) {
            JsonNode json = received.poll(5, TimeUnit.SECONDS);
            assertNotNull(json, event + " 수신 대기 시간 초과");
            if (event.equals(json.get("event").asText())) {
                return json;
            }
        }
    }

    @Test
    @DisplayName("웹소켓으로 방을 만들고 다른 연결이 입장할 수 있다")
    void createAndJoinOverWebSocket() throws Exception {
        BlockingQueue<JsonNode> aliceInbox = new LinkedBlockingQueue<>();
        BlockingQueue<JsonNode> bobInbox = new LinkedBlockingQueue<>();
        WebSocketSession alice = connect(aliceInbox);
        WebSocketSession bob = connect(bobInbox);

        try {
            alice.sendMessage(new TextMessage("{\"action\":\"CREATE_ROOM\",\"payload\":{\"username\":\"Alice\"}}"));
            String roomCode = awaitEvent(aliceInbox, "ROOM_CREATED").get("data").get("roomCode").asText();
            assertTrue(roomCode.matches("[A-Z0-9]{6}"));

            bob.sendMessage(new TextMessage("{\"action\":\"JOIN_ROOM\",\"payload\":{\"roomCode\":\""
                    + roomCode.toLowerCase() + "\",\"username\":\"Bob\"}}"));
            awaitEvent(bobInbox, "CHAT_HISTORY");
            JsonNode roster = awaitEvent(aliceInbox, "ROSTER_UPDATE");
            assertEquals(2, roster.get("data").get("players").size());

            bob.sendMessage(new TextMessage("{\"action\":\"JOIN_ROOM\",\"payload\":{\"roomCode\":\"ZZZZZZ\",\"username\":\"Bob\"}}"));
            assertEquals("ROOM_NOT_FOUND", awaitEvent(bobInbox, "ERROR").get("code").asText());
        } finally {
            alice.close();
            bob.close();
        }
    }
}
