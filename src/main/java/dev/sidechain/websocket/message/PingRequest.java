package dev.sidechain.websocket.message;

public record PingRequest(Long clientTime) {
}
