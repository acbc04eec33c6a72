package dev.sidechain.websocket.message;

/**
 * Sent to connected followers when a user's visible presence changes.
 * {@code lastActiveAt} is epoch millis and omitted when the subject hides it.
 */
public record PresenceChanged(String userId, String username, String status, String customStatus,
                              String daw, Long lastActiveAt, long timestamp) {
}
