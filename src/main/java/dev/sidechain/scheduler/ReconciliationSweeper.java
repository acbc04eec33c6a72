package dev.sidechain.scheduler;

import dev.sidechain.exception.ExternalServiceException;
import dev.sidechain.metrics.RealtimeMetrics;
import dev.sidechain.repository.PostRepository;
import dev.sidechain.repository.UserRepository;
import dev.sidechain.service.search.PostSearchDocument;
import dev.sidechain.service.search.SearchIndex;
import dev.sidechain.service.search.UserSearchDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodically re-indexes a random sample of posts and users so the search index converges
 * on the relational store even when a write-time index update was lost. Posts soft-deleted
 * and accounts deactivated within the removal window are deleted from the index.
 * <p>
 * Passes never overlap: an in-process guard, plus a Redis {@code SETNX} lock across instances.
 * Without Redis the pass runs unlocked. The first search backend failure ends the pass.
 * </p>
 */
@Component
@Slf4j
public class ReconciliationSweeper {

    static final String TASK_NAME = "reconciliation-sweep";
    static final String LOCK_KEY = "scheduler:reconciliation-sweep:lock";
    static final Duration LOCK_TIMEOUT = Duration.ofSeconds(2);

    private final PostRepository postRepository;
    private final UserRepository userRepository;
    private final SearchIndex searchIndex;
    private final TaskSupervisor supervisor;
    private final RealtimeMetrics metrics;
    private final ObjectProvider<ReactiveStringRedisTemplate> redisTemplate;
    private final boolean enabled;
    private final Duration interval;
    private final Duration initialDelay;
    private final int postSampleSize;
    private final int userSampleSize;
    private final Duration removalWindow;
    private final int removalBatchSize;
    private final Duration tickTimeout;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public ReconciliationSweeper(
            PostRepository postRepository,
            UserRepository userRepository,
            SearchIndex searchIndex,
            TaskSupervisor supervisor,
            RealtimeMetrics metrics,
            ObjectProvider<ReactiveStringRedisTemplate> redisTemplate,
            @Value("${reconciliation.enabled:true}") boolean enabled,
            @Value("${reconciliation.interval-minutes:60}") long intervalMinutes,
            @Value("${reconciliation.initial-delay-seconds:120}") long initialDelaySeconds,
            @Value("${reconciliation.post-sample-size:100}") int postSampleSize,
            @Value("${reconciliation.user-sample-size:50}") int userSampleSize,
            @Value("${reconciliation.removal-window-hours:24}") long removalWindowHours,
            @Value("${reconciliation.removal-batch-size:200}") int removalBatchSize,
            @Value("${reconciliation.tick-timeout-minutes:10}") long tickTimeoutMinutes) {
        this.postRepository = postRepository;
        this.userRepository = userRepository;
        this.searchIndex = searchIndex;
        this.supervisor = supervisor;
        this.metrics = metrics;
        this.redisTemplate = redisTemplate;
        this.enabled = enabled;
        this.interval = Duration.ofMinutes(intervalMinutes);
        this.initialDelay = Duration.ofSeconds(initialDelaySeconds);
        this.postSampleSize = postSampleSize;
        this.userSampleSize = userSampleSize;
        this.removalWindow = Duration.ofHours(removalWindowHours);
        this.removalBatchSize = removalBatchSize;
        this.tickTimeout = Duration.ofMinutes(tickTimeoutMinutes);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!enabled) {
            log.info("Search reconciliation disabled");
            return;
        }
        supervisor.scheduleAtFixedRate(TASK_NAME, initialDelay, interval, this::tick);
    }

    public boolean stop() {
        return supervisor.cancel(TASK_NAME);
    }

    /** Scheduled entry point; runs on a supervisor thread. */
    void tick() {
        SweepResult result = sweepOnce().block(tickTimeout);
        if (result != null && result.skipped()) {
            log.info("Reconciliation tick skipped: {}", result.error());
        }
    }

    /**
     * One pass: sample, project, upsert, then drop recently removed rows from the index.
     */
    public Mono<SweepResult> sweepOnce() {
        return Mono.defer(() -> {
            if (!running.compareAndSet(false, true)) {
                metrics.reconciliationSkipped();
                return Mono.just(SweepResult.skipped("A reconciliation pass is already running"));
            }
            return acquireLock()
                    .flatMap(acquired -> {
                        if (!acquired) {
                            log.debug("Skipping reconciliation, another instance holds the lock");
                            metrics.reconciliationSkipped();
                            return Mono.just(SweepResult.skipped("Another instance holds the reconciliation lock"));
                        }
                        return reconcile().doFinally(signal -> releaseLock());
                    })
                    .doFinally(signal -> running.set(false));
        });
    }

    public boolean isRunning() {
        return running.get();
    }

    private Mono<SweepResult> reconcile() {
        AtomicInteger posts = new AtomicInteger();
        AtomicInteger users = new AtomicInteger();
        AtomicInteger postsRemoved = new AtomicInteger();
        AtomicInteger usersRemoved = new AtomicInteger();
        long started = System.nanoTime();
        LocalDateTime removedSince = LocalDateTime.now(ZoneOffset.UTC).minus(removalWindow);

        Mono<Void> postPass = postRepository.findRandomSample(postSampleSize)
                .map(PostSearchDocument::from)
                .concatMap(doc -> searchIndex.upsertPost(doc).doOnSuccess(v -> posts.incrementAndGet()))
                .thenMany(postRepository.findDeletedSince(removedSince, removalBatchSize))
                .concatMap(post -> searchIndex.deletePost(post.getId()).doOnSuccess(v -> postsRemoved.incrementAndGet()))
                .then();
        Mono<Void> userPass = userRepository.findRandomSample(userSampleSize)
                .map(UserSearchDocument::from)
                .concatMap(doc -> searchIndex.upsertUser(doc).doOnSuccess(v -> users.incrementAndGet()))
                .thenMany(userRepository.findDeactivatedSince(removedSince, removalBatchSize))
                .concatMap(user -> searchIndex.deleteUser(user.getId()).doOnSuccess(v -> usersRemoved.incrementAndGet()))
                .then();

        return postPass.then(userPass)
                .then(Mono.fromCallable(() -> {
                    log.info("Reconciled {} post(s) and {} user(s) into {}, removed {} post(s) and {} user(s), in {}ms",
                            posts.get(), users.get(), searchIndex.name(), postsRemoved.get(), usersRemoved.get(),
                            Duration.ofNanos(System.nanoTime() - started).toMillis());
                    return new SweepResult(posts.get(), users.get(), postsRemoved.get(), usersRemoved.get(), false, null);
                }))
                .onErrorResume(e -> {
                    if (e instanceof ExternalServiceException) {
                        log.warn("Search backend unavailable, skipping rest of reconciliation tick: {}", e.getMessage());
                    } else {
                        log.error("Reconciliation pass failed: {}", e.getMessage(), e);
                    }
                    metrics.reconciliationSkipped();
                    return Mono.just(new SweepResult(posts.get(), users.get(), postsRemoved.get(), usersRemoved.get(),
                            true, e.getMessage()));
                })
                .doOnNext(result -> {
                    metrics.documentsReconciled("post", result.postsIndexed());
                    metrics.documentsReconciled("user", result.usersIndexed());
                    metrics.documentsReconciled("post_removed", result.postsRemoved());
                    metrics.documentsReconciled("user_removed", result.usersRemoved());
                });
    }

    private Mono<Boolean> acquireLock() {
        ReactiveStringRedisTemplate redis = redisTemplate.getIfAvailable();
        if (redis == null) {
            return Mono.just(true);
        }
        return redis.opsForValue().setIfAbsent(LOCK_KEY, "locked", tickTimeout)
                .timeout(LOCK_TIMEOUT)
                .map(Boolean.TRUE::equals)
                .onErrorResume(e -> {
                    log.debug("Redis unavailable for reconciliation lock, proceeding without lock: {}", e.getMessage());
                    return Mono.just(true);
                });
    }

    private void releaseLock() {
        ReactiveStringRedisTemplate redis = redisTemplate.getIfAvailable();
        if (redis == null) {
            return;
        }
        redis.delete(LOCK_KEY)
                .timeout(LOCK_TIMEOUT)
                .subscribe(null, e -> log.debug("Could not release reconciliation lock: {}", e.getMessage()));
    }
}
