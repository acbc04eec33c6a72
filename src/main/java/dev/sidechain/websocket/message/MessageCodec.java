package dev.sidechain.websocket.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * JSON boundary of the WebSocket protocol. Uses its own copy of the application
 * {@link ObjectMapper} so the snake_case wire format does not leak into REST responses.
 */
@Component
@Slf4j
public class MessageCodec {

    private final ObjectMapper mapper;

    public MessageCodec(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(Envelope envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            // payloads are records of plain values, so this is a programming error
            throw new IllegalStateException("Cannot encode envelope of type " + envelope.type(), e);
        }
    }

    public InboundEnvelope decode(String frame) throws JsonProcessingException {
        InboundEnvelope envelope = mapper.readValue(frame, InboundEnvelope.class);
        if (envelope == null || envelope.type() == null || envelope.type().isBlank()) {
            throw new InvalidFrameException("Missing message type");
        }
        return envelope;
    }

    /**
     * Binds an inbound payload; a missing payload binds to an all-null instance.
     */
    public <T> T readPayload(JsonNode payload, Class<T> type) throws JsonProcessingException {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return mapper.readValue("{}", type);
        }
        return mapper.treeToValue(payload, type);
    }

    /** Thrown for syntactically valid JSON that is not an envelope. */
    public static class InvalidFrameException extends JsonProcessingException {
        public InvalidFrameException(String message) {
            super(message);
        }
    }
}
