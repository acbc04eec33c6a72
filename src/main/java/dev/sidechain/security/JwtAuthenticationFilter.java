package dev.sidechain.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.sidechain.entity.User;
import dev.sidechain.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.Set;

/**
 * Authenticates REST calls and the WebSocket handshake from a bearer token.
 * Browsers cannot set headers on a WebSocket upgrade, so on the WebSocket path the token is
 * also accepted as the {@code token} query parameter.
 */
@Component
@Slf4j
public class JwtAuthenticationFilter implements WebFilter {

    static final String TOKEN_QUERY_PARAM = "token";

    private static final Set<String> ALLOWED_ROLES = Set.of(
            JwtTokenProvider.ROLE_USER, JwtTokenProvider.ROLE_SERVICE, JwtTokenProvider.ROLE_ADMIN);

    private final JwtTokenProvider tokenProvider;
    private final UserRepository userRepository;
    private final String websocketPath;

    /** Deactivated accounts are locked out within the TTL. */
    private final Cache<String, User> userCache = Caffeine.newBuilder()
            .maximumSize(1_000)
            .expireAfterWrite(Duration.ofSeconds(60))
            .build();

    public JwtAuthenticationFilter(JwtTokenProvider tokenProvider, UserRepository userRepository,
                                   @Value("${websocket.path:/ws}") String websocketPath) {
        this.tokenProvider = tokenProvider;
        this.userRepository = userRepository;
        this.websocketPath = websocketPath;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String jwt = resolveToken(exchange);
        if (!StringUtils.hasText(jwt)) {
            return chain.filter(exchange);
        }

        String path = exchange.getRequest().getPath().value();
        var validation = tokenProvider.validateAndParseClaims(jwt);
        if (!validation.valid()) {
            log.warn("Access denied: {} for path {}", validation.error(), path);
            return unauthorizedResponse(exchange, validation.error());
        }

        var claims = validation.claims();
        String userId = claims.getSubject();
        String username = claims.get("username", String.class);
        String role = claims.get("role", String.class);

        if (!StringUtils.hasText(userId) || role == null || !ALLOWED_ROLES.contains(role)) {
            log.warn("Access denied: subject '{}' with role '{}'", userId, role);
            return unauthorizedResponse(exchange, "Invalid role");
        }

        // service accounts have no users row
        if (JwtTokenProvider.ROLE_SERVICE.equals(role)) {
            return proceed(exchange, chain, new AuthenticatedUser(userId, username, role));
        }

        User cached = userCache.getIfPresent(userId);
        Mono<User> userMono = cached != null
                ? Mono.just(cached)
                : userRepository.findById(userId).doOnNext(u -> userCache.put(userId, u));

        return userMono
                .filter(user -> Boolean.TRUE.equals(user.getActive()))
                // must sit before flatMap: chain.filter() completes empty
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Access denied: user {} not found or inactive", userId);
                    return unauthorizedResponse(exchange, "User not found or inactive").then(Mono.empty());
                }))
                .flatMap(user -> proceed(exchange, chain, new AuthenticatedUser(userId,
                        username != null ? username : user.getUsername(), role)));
    }

    private Mono<Void> proceed(ServerWebExchange exchange, WebFilterChain chain, AuthenticatedUser principal) {
        log.debug("Authenticated {} ({})", principal.userId(), principal.role());
        var auth = new UsernamePasswordAuthenticationToken(principal, null,
                Collections.singleton(new SimpleGrantedAuthority("ROLE_" + principal.role())));
        return chain.filter(exchange)
                .contextWrite(ReactiveSecurityContextHolder.withAuthentication(auth));
    }

    private String resolveToken(ServerWebExchange exchange) {
        String bearer = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (StringUtils.hasText(bearer) && bearer.startsWith("Bearer ")) {
            return bearer.substring(7);
        }
        if (websocketPath.equals(exchange.getRequest().getPath().value())) {
            String query = exchange.getRequest().getQueryParams().getFirst(TOKEN_QUERY_PARAM);
            if (StringUtils.hasText(query)) {
                return query;
            }
        }
        return null;
    }

    /** 401 with a JSON body; the message is escaped. */
    private Mono<Void> unauthorizedResponse(ServerWebExchange exchange, String message) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        String safeMessage = message.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
        String body = "{\"error\":\"Unauthorized\",\"message\":\"" + safeMessage + "\"}";
        DataBuffer buffer = exchange.getResponse().bufferFactory().wrap(body.getBytes(StandardCharsets.UTF_8));
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }
}
