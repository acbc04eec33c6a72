package dev.sidechain.websocket.message;

/**
 * Outbound frame: {@code {type, payload, id, reply_to, timestamp}}.
 * {@code timestamp} is epoch milliseconds; null fields are omitted on the wire.
 */
public record Envelope(String type, Object payload, String id, String replyTo, long timestamp) {

    public static Envelope of(String type, Object payload) {
        return new Envelope(type, payload, null, null, System.currentTimeMillis());
    }

    public static Envelope withId(String type, Object payload, String id) {
        return new Envelope(type, payload, id, null, System.currentTimeMillis());
    }

    public static Envelope reply(String type, Object payload, String replyTo) {
        return new Envelope(type, payload, null, replyTo, System.currentTimeMillis());
    }
}
