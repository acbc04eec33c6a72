package dev.sidechain.websocket.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.Instant;

/**
 * Frame received from a client. The payload stays untyped until the handler
 * for {@code type} binds it.
 */
public record InboundEnvelope(
        String type,
        JsonNode payload,
        String id,
        String replyTo,
        @JsonDeserialize(using = FlexibleInstantDeserializer.class) Instant timestamp) {
}
