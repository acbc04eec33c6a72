package dev.sidechain.websocket.message;

public record TypingIndicator(String postId, String userId, String username, long timestamp) {
}
