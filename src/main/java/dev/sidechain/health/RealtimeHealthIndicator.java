package dev.sidechain.health;

import dev.sidechain.scheduler.ReconciliationSweeper;
import dev.sidechain.service.feed.FeedStore;
import dev.sidechain.service.search.SearchIndex;
import dev.sidechain.websocket.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reports the live connection counts on this node together with the state of the feed store
 * and search index circuit breakers. A registry that is draining reports OUT_OF_SERVICE so the
 * load balancer stops routing new sockets here.
 */
@Component("realtime")
@RequiredArgsConstructor
@Slf4j
public class RealtimeHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ConnectionRegistry registry;
    private final FeedStore feedStore;
    private final SearchIndex searchIndex;
    private final ReconciliationSweeper sweeper;

    @Override
    public Mono<Health> health() {
        return Mono.fromSupplier(this::buildHealth)
                .timeout(TIMEOUT)
                .onErrorResume(this::buildDownHealth);
    }

    private Health buildHealth() {
        Health.Builder builder;
        if (registry.isShuttingDown()) {
            builder = Health.outOfService();
        } else if (!feedStore.isHealthy() || !searchIndex.isHealthy()) {
            // live delivery still works; only durable feed writes or search upserts are degraded
            builder = Health.status("DEGRADED");
        } else {
            builder = Health.up();
        }
        return builder
                .withDetail("activeConnections", registry.activeConnections())
                .withDetail("onlineUsers", registry.onlineUserCount())
                .withDetail("feedStore", feedStore.name() + (feedStore.isHealthy() ? " (up)" : " (circuit open)"))
                .withDetail("searchIndex", searchIndex.name() + (searchIndex.isHealthy() ? " (up)" : " (circuit open)"))
                .withDetail("reconciliationRunning", sweeper.isRunning())
                .build();
    }

    private Mono<Health> buildDownHealth(Throwable ex) {
        log.error("Realtime health check failed: {}", ex.getMessage());
        return Mono.just(Health.down()
                .withDetail("error", ex.getClass().getSimpleName())
                .withDetail("message", ex.getMessage())
                .build());
    }
}
