package dev.sidechain.websocket.message;

public record TypingRequest(String postId) {
}
