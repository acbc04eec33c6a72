package dev.sidechain.config;

import dev.sidechain.websocket.RealtimeWebSocketHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;
import org.springframework.web.reactive.socket.server.upgrade.ReactorNettyRequestUpgradeStrategy;
import reactor.netty.http.server.WebsocketServerSpec;

import java.util.Map;

@Configuration(proxyBeanMethods = false)
@Slf4j
public class WebSocketConfig {

    @Bean
    public HandlerMapping webSocketHandlerMapping(RealtimeWebSocketHandler handler,
                                                  @Value("${websocket.path:/ws}") String path) {
        log.info("WebSocket endpoint mapped at {}", path);
        // ahead of the annotated controllers
        return new SimpleUrlHandlerMapping(Map.of(path, handler), -1);
    }

    @Bean
    public WebSocketHandlerAdapter webSocketHandlerAdapter(
            @Value("${websocket.max-message-bytes:524288}") int maxMessageBytes) {
        ReactorNettyRequestUpgradeStrategy strategy = new ReactorNettyRequestUpgradeStrategy(
                () -> WebsocketServerSpec.builder().maxFramePayloadLength(maxMessageBytes));
        return new WebSocketHandlerAdapter(new HandshakeWebSocketService(strategy));
    }
}
