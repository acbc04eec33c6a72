package dev.sidechain.websocket.message;

/**
 * Inbound {@code presence} / {@code user_in_studio} payload from the plugin or web app.
 */
public record PresenceUpdateRequest(String status, String daw, String customStatus) {
}
