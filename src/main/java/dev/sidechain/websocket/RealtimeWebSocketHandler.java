package dev.sidechain.websocket;

import dev.sidechain.exception.ConnectionException;
import dev.sidechain.security.AuthenticatedUser;
import dev.sidechain.websocket.message.Envelope;
import dev.sidechain.websocket.message.MessageType;
import dev.sidechain.websocket.message.SystemNotice;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.security.Principal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Runs one WebSocket session: registers it, pumps its outbound queue and protocol pings
 * to the socket, and feeds inbound frames to {@link InboundMessageHandler}.
 * The handshake is already authenticated by the security filter chain.
 */
@Component
@Slf4j
public class RealtimeWebSocketHandler implements WebSocketHandler {

    private final ConnectionRegistry registry;
    private final InboundMessageHandler inboundHandler;
    private final Duration pingInterval;
    private final Duration idleTimeout;

    public RealtimeWebSocketHandler(
            ConnectionRegistry registry,
            InboundMessageHandler inboundHandler,
            @Value("${websocket.ping-interval-seconds:54}") long pingIntervalSeconds,
            @Value("${websocket.idle-timeout-seconds:90}") long idleTimeoutSeconds) {
        this.registry = registry;
        this.inboundHandler = inboundHandler;
        this.pingInterval = Duration.ofSeconds(pingIntervalSeconds);
        this.idleTimeout = Duration.ofSeconds(idleTimeoutSeconds);
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        return session.getHandshakeInfo().getPrincipal()
                .map(RealtimeWebSocketHandler::toUser)
                .defaultIfEmpty(Optional.empty())
                .flatMap(user -> user
                        .map(u -> serve(session, u))
                        .orElseGet(() -> reject(session, "Handshake carried no authenticated user")));
    }

    private Mono<Void> serve(WebSocketSession session, AuthenticatedUser user) {
        LiveConnection connection;
        try {
            connection = registry.register(user.userId(), user.username(), metadataOf(session.getHandshakeInfo()));
        } catch (ConnectionException e) {
            return reject(session, e.getMessage());
        }
        String connectionId = connection.getConnectionId();
        connection.onForceClose(() -> session.close(CloseStatus.GOING_AWAY)
                .subscribe(null, e -> log.debug("Closing session {} failed: {}", connectionId, e.getMessage())));

        registry.sendToConnection(connectionId, Envelope.of(MessageType.SYSTEM,
                new SystemNotice(SystemNotice.CONNECTED, "Connected to Sidechain", welcomeData(user, connectionId))));

        Flux<WebSocketMessage> frames = connection.outbound().map(session::textMessage);
        Flux<WebSocketMessage> pings = Flux.interval(pingInterval, pingInterval)
                .map(tick -> session.pingMessage(factory -> factory.wrap(new byte[0])))
                .takeUntilOther(connection.onDrainStarted());
        Mono<Void> output = session.send(Flux.merge(frames, pings))
                .then(Mono.defer(() -> session.isOpen()
                        ? session.close(registry.isShuttingDown() ? CloseStatus.GOING_AWAY : CloseStatus.NORMAL)
                        : Mono.empty()));

        Mono<Void> input = session.receive()
                .timeout(idleTimeout)
                .doOnNext(message -> connection.touch())
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(text -> inboundHandler.handle(connection, text))
                .then()
                .onErrorResume(TimeoutException.class, e -> {
                    log.info("Connection {} idle for {}s, closing", connectionId, idleTimeout.toSeconds());
                    return session.close(CloseStatus.GOING_AWAY);
                })
                // the client went away: stop the writer too
                .doFinally(signal -> registry.unregister(connectionId));

        return Mono.zip(input, output)
                .then()
                .doOnError(e -> log.warn("Session {} of user {} ended with error: {}",
                        connectionId, user.userId(), e.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .doFinally(signal -> registry.unregister(connectionId));
    }

    private Mono<Void> reject(WebSocketSession session, String reason) {
        log.warn("Rejecting WebSocket session {}: {}", session.getId(), reason);
        return session.close(CloseStatus.POLICY_VIOLATION);
    }

    private static Optional<AuthenticatedUser> toUser(Principal principal) {
        if (principal instanceof Authentication authentication
                && authentication.getPrincipal() instanceof AuthenticatedUser user) {
            return Optional.of(user);
        }
        return Optional.empty();
    }

    private static ConnectionMetadata metadataOf(HandshakeInfo info) {
        String remote = info.getRemoteAddress() != null ? info.getRemoteAddress().getHostString() : null;
        return new ConnectionMetadata(remote, info.getHeaders().getFirst(HttpHeaders.USER_AGENT));
    }

    private static Map<String, Object> welcomeData(AuthenticatedUser user, String connectionId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user_id", user.userId());
        if (user.username() != null) {
            data.put("username", user.username());
        }
        data.put("server_time", System.currentTimeMillis());
        data.put("session_id", connectionId);
        return data;
    }
}
