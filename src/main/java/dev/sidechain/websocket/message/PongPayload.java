package dev.sidechain.websocket.message;

public record PongPayload(Long clientTime, long serverTime, Long latencyMs) {
}
