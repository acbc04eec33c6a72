package dev.sidechain.websocket.message;

public record AuthAck(String userId, String status) {
}
