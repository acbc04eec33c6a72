package dev.sidechain.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.sidechain.config.ResilienceConfig;
import dev.sidechain.dto.PresenceView;
import dev.sidechain.entity.PresenceStatus;
import dev.sidechain.repository.RelationshipRepository;
import dev.sidechain.repository.UserRepository;
import dev.sidechain.scheduler.TaskSupervisor;
import dev.sidechain.websocket.ConnectionListener;
import dev.sidechain.websocket.ConnectionRegistry;
import dev.sidechain.websocket.message.Envelope;
import dev.sidechain.websocket.message.MessageType;
import dev.sidechain.websocket.message.PresenceChanged;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Online/offline/in-studio state per user, derived from the connection registry.
 * <p>
 * The last disconnect does not go offline immediately: a named one-shot task on the
 * {@link TaskSupervisor} fires after the grace period and re-checks the registry, so a
 * reconnect within the window replaces nothing and followers see no flapping.
 * Only users with a live status are held in memory; going offline drops the entry. Custom status
 * text outlives the connection in a bounded cache. Follower broadcasts and the persisted
 * {@code is_online}/{@code last_active_at} columns are best-effort and never undo the in-memory transition.
 * </p>
 */
@Service
@Slf4j
public class PresenceTracker implements ConnectionListener {

    static final String OFFLINE_TASK_PREFIX = "presence-offline:";
    static final String TIMEOUT_TASK = "presence-timeout-check";
    static final int MAX_CUSTOM_STATUS = 100;
    static final int MAX_BULK_LOOKUP = 100;

    private final Map<String, PresenceState> states = new ConcurrentHashMap<>();
    private final Cache<String, String> customStatuses;

    private final ConnectionRegistry registry;
    private final TaskSupervisor supervisor;
    private final PresenceVisibilityService visibility;
    private final RelationshipRepository relationships;
    private final UserRepository userRepository;
    private final ResilienceConfig resilience;
    private final Duration gracePeriod;
    private final Duration timeout;
    private final Duration timeoutCheckInterval;
    private final int maxFollowers;
    private final Duration shutdownTimeout;

    public PresenceTracker(
            ConnectionRegistry registry,
            TaskSupervisor supervisor,
            PresenceVisibilityService visibility,
            RelationshipRepository relationships,
            UserRepository userRepository,
            ResilienceConfig resilience,
            @Value("${presence.grace-period-seconds:5}") long gracePeriodSeconds,
            @Value("${presence.timeout-minutes:5}") long timeoutMinutes,
            @Value("${presence.timeout-check-interval-seconds:60}") long timeoutCheckIntervalSeconds,
            @Value("${presence.max-followers:1000}") int maxFollowers,
            @Value("${presence.shutdown-timeout-seconds:10}") long shutdownTimeoutSeconds,
            @Value("${presence.custom-status-cache.max-size:100000}") long customStatusCacheMaxSize,
            @Value("${presence.custom-status-cache.ttl-hours:72}") long customStatusCacheTtlHours) {
        this.registry = registry;
        this.supervisor = supervisor;
        this.visibility = visibility;
        this.relationships = relationships;
        this.userRepository = userRepository;
        this.resilience = resilience;
        this.gracePeriod = Duration.ofSeconds(gracePeriodSeconds);
        this.timeout = Duration.ofMinutes(timeoutMinutes);
        this.timeoutCheckInterval = Duration.ofSeconds(timeoutCheckIntervalSeconds);
        this.maxFollowers = maxFollowers;
        this.shutdownTimeout = Duration.ofSeconds(shutdownTimeoutSeconds);
        this.customStatuses = Caffeine.newBuilder()
                .maximumSize(customStatusCacheMaxSize)
                .expireAfterAccess(Duration.ofHours(customStatusCacheTtlHours))
                .build();
    }

    @PostConstruct
    public void start() {
        registry.addListener(this);
        supervisor.scheduleAtFixedRate(TIMEOUT_TASK, timeoutCheckInterval, timeoutCheckInterval,
                this::checkTimeouts);
    }

    // ---- connection transitions ----

    @Override
    public void onFirstConnection(String userId, String username) {
        boolean cancelledPending = supervisor.cancel(offlineTaskName(userId));
        Instant now = Instant.now();
        boolean[] resumed = new boolean[1];
        PresenceState next = states.compute(userId, (k, cur) -> {
            if (cur != null && cur.isActive()) {
                resumed[0] = true;
                return cur.touch(now);
            }
            return PresenceState.online(userId, username, customStatuses.getIfPresent(userId), now);
        });

        if (resumed[0]) {
            // reconnect inside the grace window: followers were never told we left
            log.debug("User {} reconnected within grace period (pendingCancelled={})", userId, cancelledPending);
            return;
        }
        log.info("User {} is online", userId);
        announce(next);
        persist(userId, true, now);
    }

    @Override
    public void onLastDisconnect(String userId) {
        boolean scheduled = supervisor.scheduleOnce(offlineTaskName(userId), gracePeriod,
                () -> goOfflineIfDisconnected(userId));
        if (!scheduled) {
            log.debug("Supervisor unavailable, {} goes offline with the shutdown sweep", userId);
        }
    }

    /**
     * Drops the user's state if the registry still has no connection for them. The registry is
     * read inside the map update, so a concurrent {@link #onFirstConnection} either sees the
     * entry gone and starts a fresh online state, or the check here sees the new connection.
     *
     * @return whether the user actually went offline
     */
    boolean goOfflineIfDisconnected(String userId) {
        PresenceState[] removed = new PresenceState[1];
        states.computeIfPresent(userId, (k, cur) -> {
            if (!cur.isActive() || registry.isOnline(userId)) {
                return cur;
            }
            removed[0] = cur;
            return null;
        });
        if (removed[0] == null) {
            log.debug("User {} is connected or already offline, offline timer did nothing", userId);
            return false;
        }
        Instant now = Instant.now();
        log.info("User {} is offline", userId);
        announce(removed[0].offline(now));
        persist(userId, false, now);
        return true;
    }

    // ---- client-driven updates ----

    public void heartbeat(String userId) {
        states.computeIfPresent(userId, (k, cur) -> cur.isActive() ? cur.touch(Instant.now()) : cur);
    }

    /**
     * Applies a status report from a connected client. Only a change of status or DAW is announced.
     */
    public void updateStatus(String userId, String status, String daw) {
        if (!registry.isOnline(userId)) {
            log.debug("Ignoring status update for {} with no live connection", userId);
            return;
        }
        PresenceStatus requested = PresenceStatus.fromClient(status);
        String normalizedDaw = requested == PresenceStatus.IN_STUDIO ? trimToNull(daw, MAX_CUSTOM_STATUS) : null;
        Instant now = Instant.now();
        PresenceState[] before = new PresenceState[1];
        PresenceState next = states.compute(userId, (k, cur) -> {
            before[0] = cur;
            if (cur == null) {
                return new PresenceState(userId, null, requested, customStatuses.getIfPresent(userId),
                        normalizedDaw, now);
            }
            return cur.withStatus(requested, normalizedDaw, now);
        });
        PresenceState prev = before[0];
        boolean changed = prev == null || prev.status() != next.status()
                || !Objects.equals(prev.daw(), next.daw());
        if (changed) {
            log.info("User {} status is now {}{}", userId, next.status().wireValue(),
                    next.daw() != null ? " (" + next.daw() + ")" : "");
            announce(next);
        }
    }

    /**
     * Sets or clears the free-text status. Does not change online state; the text is kept for
     * an offline user and shown once they connect.
     */
    public PresenceState setCustomStatus(String userId, String text) {
        String normalized = trimToNull(text, MAX_CUSTOM_STATUS);
        if (normalized == null) {
            customStatuses.invalidate(userId);
        } else {
            customStatuses.put(userId, normalized);
        }
        PresenceState live = states.computeIfPresent(userId, (k, cur) -> cur.withCustomStatus(normalized));
        if (live == null) {
            return new PresenceState(userId, null, PresenceStatus.OFFLINE, normalized, null, null);
        }
        announce(live);
        return live;
    }

    // ---- queries ----

    public boolean isOnline(String userId) {
        return registry.isOnline(userId);
    }

    /** Live state of a connected user, {@code null} once they are offline. */
    public PresenceState stateOf(String userId) {
        return states.get(userId);
    }

    public Mono<PresenceView> presenceFor(String subjectId) {
        return visibility.visibilityOf(subjectId).map(flags -> view(subjectId, flags));
    }

    /**
     * Bulk {@link #presenceFor(String)}, capped at {@value #MAX_BULK_LOOKUP} distinct ids.
     */
    public Mono<Map<String, PresenceView>> presenceFor(Collection<String> subjectIds) {
        List<String> ids = subjectIds.stream()
                .filter(id -> id != null && !id.isBlank())
                .distinct()
                .collect(Collectors.toCollection(ArrayList::new));
        if (ids.size() > MAX_BULK_LOOKUP) {
            ids = ids.subList(0, MAX_BULK_LOOKUP);
        }
        return Flux.fromIterable(ids)
                .flatMap(this::presenceFor)
                .collectMap(PresenceView::getUserId);
    }

    /**
     * Users {@code viewerId} follows who are connected and in the studio, minus those hiding their activity.
     */
    public Flux<PresenceView> friendsInStudio(String viewerId) {
        return relationships.findFollowingIds(viewerId, maxFollowers)
                .filter(id -> {
                    PresenceState state = states.get(id);
                    return state != null && state.status() == PresenceStatus.IN_STUDIO && registry.isOnline(id);
                })
                .flatMap(this::presenceFor)
                .filter(view -> PresenceStatus.IN_STUDIO.wireValue().equals(view.getStatus()));
    }

    public int trackedOnlineCount() {
        return (int) states.values().stream().filter(PresenceState::isActive).count();
    }

    // ---- timeout checker ----

    void checkTimeouts() {
        Instant now = Instant.now();
        Instant cutoff = now.minus(timeout);
        int markedOffline = 0;
        for (PresenceState state : List.copyOf(states.values())) {
            if (!state.isActive() || state.lastActiveAt() == null || state.lastActiveAt().isAfter(cutoff)) {
                continue;
            }
            if (registry.isOnline(state.userId())) {
                heartbeat(state.userId());
            } else if (goOfflineIfDisconnected(state.userId())) {
                markedOffline++;
            }
        }
        if (markedOffline > 0) {
            log.info("Presence timeout check marked {} user(s) offline", markedOffline);
        }
    }

    // ---- shutdown ----

    @PreDestroy
    public void shutdown() {
        List<String> online = states.values().stream()
                .filter(PresenceState::isActive)
                .map(PresenceState::userId)
                .toList();
        if (online.isEmpty()) {
            return;
        }
        log.info("Persisting {} online user(s) as offline before shutdown", online.size());
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        try {
            Flux.fromIterable(online)
                    .flatMap(id -> userRepository.updatePresence(id, false, now)
                            .onErrorResume(e -> {
                                log.warn("Could not persist offline presence for {}: {}", id, e.getMessage());
                                return Mono.empty();
                            }), 16)
                    .then()
                    .block(shutdownTimeout);
        } catch (RuntimeException e) {
            log.warn("Presence shutdown persistence did not finish within {}s: {}",
                    shutdownTimeout.toSeconds(), e.getMessage());
        }
        states.clear();
    }

    // ---- internals ----

    private PresenceView view(String subjectId, ActivityVisibility flags) {
        if (!flags.showActivityStatus()) {
            return PresenceView.hidden(subjectId);
        }
        PresenceState state = states.get(subjectId);
        boolean online = registry.isOnline(subjectId);
        PresenceStatus status = online
                ? (state != null && state.status() == PresenceStatus.IN_STUDIO ? PresenceStatus.IN_STUDIO : PresenceStatus.ONLINE)
                : PresenceStatus.OFFLINE;
        Instant lastActive = state != null && state.lastActiveAt() != null
                ? state.lastActiveAt()
                : flags.persistedLastActiveAt();
        return PresenceView.builder()
                .userId(subjectId)
                .online(online)
                .status(status.wireValue())
                .customStatus(customStatuses.getIfPresent(subjectId))
                .daw(online && state != null ? state.daw() : null)
                .lastActiveAt(flags.showLastActive() ? lastActive : null)
                .build();
    }

    private void announce(PresenceState state) {
        visibility.visibilityOf(state.userId())
                .flatMap(flags -> {
                    if (!flags.showActivityStatus()) {
                        log.debug("User {} hides activity status, not broadcasting", state.userId());
                        return Mono.just(0);
                    }
                    Envelope envelope = Envelope.of(MessageType.PRESENCE_CHANGED, toPayload(state, flags));
                    return relationships.findFollowerIds(state.userId(), maxFollowers)
                            .filter(registry::isOnline)
                            .collectList()
                            .map(followers -> registry.sendToUsers(followers, envelope));
                })
                .subscribe(
                        sent -> log.debug("Presence of {} sent on {} connection(s)", state.userId(), sent),
                        e -> log.warn("Presence broadcast for {} failed: {}", state.userId(), e.getMessage()));
    }

    private PresenceChanged toPayload(PresenceState state, ActivityVisibility flags) {
        Long lastActive = flags.showLastActive() && state.lastActiveAt() != null
                ? state.lastActiveAt().toEpochMilli()
                : null;
        String username = state.username() != null ? state.username() : flags.username();
        return new PresenceChanged(state.userId(), username, state.status().wireValue(), state.customStatus(),
                state.daw(), lastActive, System.currentTimeMillis());
    }

    private void persist(String userId, boolean online, Instant at) {
        userRepository.updatePresence(userId, online, LocalDateTime.ofInstant(at, ZoneOffset.UTC))
                .timeout(resilience.getDatabaseTimeout())
                .subscribe(
                        rows -> {
                            if (rows == 0) {
                                log.debug("No users row for {}, presence not persisted", userId);
                            }
                        },
                        e -> log.warn("Persisting presence of {} failed: {}", userId, e.getMessage()));
    }

    static String offlineTaskName(String userId) {
        return OFFLINE_TASK_PREFIX + userId;
    }

    private static String trimToNull(String text, int max) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > max ? trimmed.substring(0, max) : trimmed;
    }
}
