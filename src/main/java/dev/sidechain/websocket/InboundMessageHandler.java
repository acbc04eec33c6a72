package dev.sidechain.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.sidechain.metrics.RealtimeMetrics;
import dev.sidechain.service.PresenceTracker;
import dev.sidechain.websocket.message.AuthAck;
import dev.sidechain.websocket.message.Envelope;
import dev.sidechain.websocket.message.ErrorPayload;
import dev.sidechain.websocket.message.InboundEnvelope;
import dev.sidechain.websocket.message.MessageCodec;
import dev.sidechain.websocket.message.MessageType;
import dev.sidechain.websocket.message.PingRequest;
import dev.sidechain.websocket.message.PongPayload;
import dev.sidechain.websocket.message.PresenceUpdateRequest;
import dev.sidechain.websocket.message.TypingIndicator;
import dev.sidechain.websocket.message.TypingRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Handles one inbound frame of a live connection. Every failure is answered with an
 * {@code error} envelope on that connection; nothing here closes the session.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InboundMessageHandler {

    private final ConnectionRegistry registry;
    private final PresenceTracker presenceTracker;
    private final MessageCodec codec;
    private final RealtimeMetrics metrics;

    public void handle(LiveConnection connection, String frame) {
        metrics.messageReceived();
        if (!connection.allowInbound()) {
            log.debug("Rate limited connection {} of user {}", connection.getConnectionId(), connection.getUserId());
            replyError(connection, ErrorPayload.RATE_LIMITED, "Too many messages, slow down", null);
            return;
        }

        InboundEnvelope envelope;
        try {
            envelope = codec.decode(frame);
        } catch (JsonProcessingException e) {
            log.debug("Invalid frame from {}: {}", connection.getConnectionId(), e.getOriginalMessage());
            replyError(connection, ErrorPayload.INVALID_JSON, "Invalid message format", null);
            return;
        }

        try {
            dispatch(connection, envelope);
        } catch (JsonProcessingException | RuntimeException e) {
            metrics.error();
            log.warn("Handler for '{}' failed on connection {}: {}",
                    envelope.type(), connection.getConnectionId(), e.getMessage());
            replyError(connection, ErrorPayload.HANDLER_ERROR, "Failed to process " + envelope.type(), envelope.id());
        }
    }

    private void dispatch(LiveConnection connection, InboundEnvelope envelope) throws JsonProcessingException {
        switch (envelope.type()) {
            case MessageType.PING, MessageType.HEARTBEAT -> handlePing(connection, envelope);
            case MessageType.AUTH -> registry.sendToConnection(connection.getConnectionId(), Envelope.reply(
                    MessageType.AUTH, new AuthAck(connection.getUserId(), "authenticated"), envelope.id()));
            case MessageType.PRESENCE -> {
                PresenceUpdateRequest request = codec.readPayload(envelope.payload(), PresenceUpdateRequest.class);
                presenceTracker.updateStatus(connection.getUserId(), request.status(), request.daw());
                if (request.customStatus() != null) {
                    presenceTracker.setCustomStatus(connection.getUserId(), request.customStatus());
                }
            }
            case MessageType.USER_IN_STUDIO -> {
                PresenceUpdateRequest request = codec.readPayload(envelope.payload(), PresenceUpdateRequest.class);
                presenceTracker.updateStatus(connection.getUserId(), "in_studio", request.daw());
            }
            case MessageType.USER_TYPING, MessageType.USER_STOP_TYPING -> relayTyping(connection, envelope);
            default -> replyError(connection, ErrorPayload.UNKNOWN_TYPE,
                    "Unknown message type: " + envelope.type(), envelope.id());
        }
    }

    private void handlePing(LiveConnection connection, InboundEnvelope envelope) throws JsonProcessingException {
        long serverTime = System.currentTimeMillis();
        PingRequest request = codec.readPayload(envelope.payload(), PingRequest.class);
        Long clientTime = request.clientTime();
        if (clientTime == null && envelope.timestamp() != null) {
            clientTime = envelope.timestamp().toEpochMilli();
        }
        Long latency = clientTime != null && clientTime <= serverTime ? serverTime - clientTime : null;

        registry.touch(connection.getConnectionId());
        presenceTracker.heartbeat(connection.getUserId());
        registry.sendToConnection(connection.getConnectionId(),
                Envelope.reply(MessageType.PONG, new PongPayload(clientTime, serverTime, latency), envelope.id()));
    }

    private void relayTyping(LiveConnection connection, InboundEnvelope envelope) throws JsonProcessingException {
        TypingRequest request = codec.readPayload(envelope.payload(), TypingRequest.class);
        if (request.postId() == null || request.postId().isBlank()) {
            replyError(connection, ErrorPayload.HANDLER_ERROR, "post_id is required", envelope.id());
            return;
        }
        String userId = connection.getUserId();
        TypingIndicator indicator = new TypingIndicator(request.postId(), userId, connection.getUsername(),
                System.currentTimeMillis());
        int sent = registry.broadcast(other -> !userId.equals(other.getUserId()),
                Envelope.of(envelope.type(), indicator));
        log.debug("Relayed {} from {} on post {} to {} connection(s)", envelope.type(), userId, request.postId(), sent);
    }

    private void replyError(LiveConnection connection, String code, String message, String replyTo) {
        registry.sendToConnection(connection.getConnectionId(),
                Envelope.reply(MessageType.ERROR, new ErrorPayload(code, message), replyTo));
    }
}
