package dev.sidechain.websocket;

import dev.sidechain.exception.ConnectionException;
import dev.sidechain.security.AuthenticatedUser;
import dev.sidechain.websocket.message.Envelope;
import dev.sidechain.websocket.message.MessageType;
import dev.sidechain.websocket.message.SystemNotice;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.Principal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RealtimeWebSocketHandler")
class RealtimeWebSocketHandlerTest {

    @Mock
    private ConnectionRegistry registry;

    @Mock
    private InboundMessageHandler inboundHandler;

    @Mock
    private WebSocketSession session;

    private RealtimeWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        handler = new RealtimeWebSocketHandler(registry, inboundHandler, 54, 90);
        lenient().when(session.getId()).thenReturn("session-1");
        lenient().when(session.close(any(CloseStatus.class))).thenReturn(Mono.empty());
    }

    private void handshake(Principal principal) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.USER_AGENT, "SidechainPlugin/2.1 (VST3)");
        when(session.getHandshakeInfo()).thenReturn(new HandshakeInfo(URI.create("ws://localhost/ws"), headers,
                principal != null ? Mono.just(principal) : Mono.empty(), null));
    }

    private static Principal authenticated(String userId, String username) {
        return new UsernamePasswordAuthenticationToken(new AuthenticatedUser(userId, username, "USER"), null,
                List.of(new SimpleGrantedAuthority("ROLE_USER")));
    }

    private static WebSocketMessage text(String payload) {
        return new WebSocketMessage(WebSocketMessage.Type.TEXT,
                DefaultDataBufferFactory.sharedInstance.wrap(payload.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("should close with policy violation when the handshake has no user")
    void shouldRejectAnonymousHandshake() {
        // Given
        handshake(null);

        // When / Then
        StepVerifier.create(handler.handle(session)).verifyComplete();

        verify(session).close(CloseStatus.POLICY_VIOLATION);
        verify(registry, never()).register(anyString(), any(), any());
    }

    @Test
    @DisplayName("should close with policy violation when the registry refuses the connection")
    void shouldRejectWhenRegistryRefuses() {
        // Given
        handshake(authenticated("user-1", "alice"));
        when(registry.register(eq("user-1"), eq("alice"), any(ConnectionMetadata.class)))
                .thenThrow(new ConnectionException("Server is shutting down"));

        // When / Then
        StepVerifier.create(handler.handle(session)).verifyComplete();

        verify(session).close(CloseStatus.POLICY_VIOLATION);
    }

    @Test
    @DisplayName("should register, greet, feed inbound text frames and unregister when the client leaves")
    void shouldServeSession() {
        // Given
        handshake(authenticated("user-1", "alice"));
        LiveConnection connection = new LiveConnection("c-1", "user-1", "alice", ConnectionMetadata.UNKNOWN, 8,
                new TokenBucket(10, 10));
        ArgumentCaptor<ConnectionMetadata> metadata = ArgumentCaptor.forClass(ConnectionMetadata.class);
        when(registry.register(eq("user-1"), eq("alice"), metadata.capture())).thenReturn(connection);
        when(session.receive()).thenReturn(Flux.just(text("{\"type\":\"ping\"}")));
        when(session.send(any())).thenReturn(Mono.empty());
        when(session.isOpen()).thenReturn(false);

        // When / Then
        StepVerifier.create(handler.handle(session)).verifyComplete();

        assertThat(metadata.getValue().userAgent()).isEqualTo("SidechainPlugin/2.1 (VST3)");
        ArgumentCaptor<Envelope> welcome = ArgumentCaptor.forClass(Envelope.class);
        verify(registry).sendToConnection(eq("c-1"), welcome.capture());
        assertThat(welcome.getValue().type()).isEqualTo(MessageType.SYSTEM);
        SystemNotice notice = (SystemNotice) welcome.getValue().payload();
        assertThat(notice.event()).isEqualTo(SystemNotice.CONNECTED);
        assertThat(notice.data()).containsEntry("user_id", "user-1").containsEntry("session_id", "c-1");

        verify(inboundHandler).handle(connection, "{\"type\":\"ping\"}");
        verify(registry, atLeastOnce()).unregister("c-1");
    }
}
