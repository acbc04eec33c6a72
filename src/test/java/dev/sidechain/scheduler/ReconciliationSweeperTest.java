package dev.sidechain.scheduler;

import dev.sidechain.entity.Post;
import dev.sidechain.entity.User;
import dev.sidechain.exception.ExternalServiceException;
import dev.sidechain.metrics.RealtimeMetrics;
import dev.sidechain.repository.PostRepository;
import dev.sidechain.repository.UserRepository;
import dev.sidechain.service.search.InMemorySearchIndex;
import dev.sidechain.service.search.PostSearchDocument;
import dev.sidechain.service.search.SearchIndex;
import dev.sidechain.service.search.UserSearchDocument;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReconciliationSweeper")
class ReconciliationSweeperTest {

    @Mock
    private PostRepository postRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private ObjectProvider<ReactiveStringRedisTemplate> redisProvider;

    private SimpleMeterRegistry meterRegistry;
    private TaskSupervisor supervisor;
    private InMemorySearchIndex searchIndex;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        supervisor = new TaskSupervisor(1, 1);
        searchIndex = new InMemorySearchIndex();
        lenient().when(redisProvider.getIfAvailable()).thenReturn(null);
        lenient().when(postRepository.findDeletedSince(any(LocalDateTime.class), anyInt())).thenReturn(Flux.empty());
        lenient().when(userRepository.findDeactivatedSince(any(LocalDateTime.class), anyInt())).thenReturn(Flux.empty());
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    private ReconciliationSweeper sweeper(SearchIndex index) {
        RealtimeMetrics metrics = new RealtimeMetrics(meterRegistry);
        metrics.init();
        return new ReconciliationSweeper(postRepository, userRepository, index, supervisor, metrics,
                redisProvider, true, 60, 120, 100, 50, 24, 200, 1);
    }

    private static Post post(String id) {
        return Post.builder()
                .id(id)
                .userId("u-" + id)
                .username("artist-" + id)
                .genre("house, techno")
                .bpm(124)
                .daw("Ableton Live")
                .likeCount(3)
                .createdAt(LocalDateTime.of(2026, 3, 1, 12, 0))
                .build();
    }

    private static User user(String id) {
        return User.builder()
                .id(id)
                .username("user-" + id)
                .displayName("User " + id)
                .active(true)
                .build();
    }

    private double reconciled(String type) {
        return meterRegistry.counter("sidechain.reconciliation.documents", "type", type).count();
    }

    @Nested
    @DisplayName("sweepOnce")
    class SweepOnce {

        @Test
        @DisplayName("should upsert sampled posts and users into the index")
        void shouldUpsertSample() {
            // Given
            when(postRepository.findRandomSample(100)).thenReturn(Flux.just(post("p1"), post("p2")));
            when(userRepository.findRandomSample(50)).thenReturn(Flux.just(user("u1")));
            ReconciliationSweeper sweeper = sweeper(searchIndex);

            // When / Then
            StepVerifier.create(sweeper.sweepOnce())
                    .assertNext(result -> {
                        assertThat(result.postsIndexed()).isEqualTo(2);
                        assertThat(result.usersIndexed()).isEqualTo(1);
                        assertThat(result.skipped()).isFalse();
                        assertThat(result.error()).isNull();
                    })
                    .verifyComplete();

            assertThat(searchIndex.postCount()).isEqualTo(2);
            assertThat(searchIndex.userCount()).isEqualTo(1);
            StepVerifier.create(searchIndex.findPost("p1"))
                    .assertNext(doc -> assertThat(doc.genre()).containsExactly("house", "techno"))
                    .verifyComplete();
            assertThat(reconciled("post")).isEqualTo(2.0);
            assertThat(reconciled("user")).isEqualTo(1.0);
            assertThat(sweeper.isRunning()).isFalse();
        }

        @Test
        @DisplayName("should overwrite a stale indexed post with the current row")
        void shouldRepairStaleDocument() {
            // Given
            Post current = post("p1");
            searchIndex.upsertPost(new PostSearchDocument("p1", "u-p1", "old-name", List.of("ambient"), 90, null,
                    "FL Studio", 0, 0, 0, null)).block();
            when(postRepository.findRandomSample(anyInt())).thenReturn(Flux.just(current));
            when(userRepository.findRandomSample(anyInt())).thenReturn(Flux.empty());
            ReconciliationSweeper sweeper = sweeper(searchIndex);

            // When
            sweeper.sweepOnce().block(Duration.ofSeconds(2));

            // Then
            StepVerifier.create(searchIndex.findPost("p1"))
                    .assertNext(doc -> assertThat(doc).isEqualTo(PostSearchDocument.from(current)))
                    .verifyComplete();
            assertThat(searchIndex.postCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should remove recently deleted posts and deactivated users from the index")
        void shouldRemoveDeletedRows() {
            // Given
            searchIndex.upsertPost(PostSearchDocument.from(post("gone"))).block();
            searchIndex.upsertUser(UserSearchDocument.from(user("banned"))).block();
            when(postRepository.findRandomSample(anyInt())).thenReturn(Flux.just(post("p1")));
            when(userRepository.findRandomSample(anyInt())).thenReturn(Flux.empty());
            when(postRepository.findDeletedSince(any(LocalDateTime.class), eq(200))).thenReturn(Flux.just(post("gone")));
            when(userRepository.findDeactivatedSince(any(LocalDateTime.class), eq(200)))
                    .thenReturn(Flux.just(user("banned"), user("never-indexed")));
            ReconciliationSweeper sweeper = sweeper(searchIndex);

            // When / Then
            StepVerifier.create(sweeper.sweepOnce())
                    .assertNext(result -> {
                        assertThat(result.postsIndexed()).isEqualTo(1);
                        assertThat(result.postsRemoved()).isEqualTo(1);
                        assertThat(result.usersRemoved()).isEqualTo(2);
                        assertThat(result.skipped()).isFalse();
                    })
                    .verifyComplete();

            StepVerifier.create(searchIndex.findPost("gone")).verifyComplete();
            StepVerifier.create(searchIndex.findUser("banned")).verifyComplete();
            assertThat(searchIndex.postCount()).isEqualTo(1);
            assertThat(reconciled("post_removed")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should end the pass on the first backend failure and keep partial counts")
        void shouldAbortOnBackendFailure() {
            // Given
            SearchIndex failing = mock(SearchIndex.class);
            when(failing.upsertPost(any(PostSearchDocument.class)))
                    .thenReturn(Mono.empty())
                    .thenReturn(Mono.error(new ExternalServiceException("search", "connection refused")));
            when(postRepository.findRandomSample(anyInt()))
                    .thenReturn(Flux.just(post("p1"), post("p2"), post("p3")));
            lenient().when(userRepository.findRandomSample(anyInt())).thenReturn(Flux.just(user("u1")));
            ReconciliationSweeper sweeper = sweeper(failing);

            // When / Then
            StepVerifier.create(sweeper.sweepOnce())
                    .assertNext(result -> {
                        assertThat(result.postsIndexed()).isEqualTo(1);
                        assertThat(result.usersIndexed()).isZero();
                        assertThat(result.skipped()).isTrue();
                        assertThat(result.error()).contains("connection refused");
                    })
                    .verifyComplete();

            verify(failing, never()).upsertUser(any());
            assertThat(meterRegistry.counter("sidechain.reconciliation.skipped").count()).isEqualTo(1.0);
            assertThat(sweeper.isRunning()).isFalse();
        }

        @Test
        @DisplayName("should skip a pass while another one is in flight")
        void shouldSkipOverlappingPass() {
            // Given
            when(postRepository.findRandomSample(anyInt())).thenReturn(Flux.never());
            lenient().when(userRepository.findRandomSample(anyInt())).thenReturn(Flux.empty());
            ReconciliationSweeper sweeper = sweeper(searchIndex);
            Disposable first = sweeper.sweepOnce().subscribe();

            try {
                assertThat(sweeper.isRunning()).isTrue();

                // When / Then
                StepVerifier.create(sweeper.sweepOnce())
                        .assertNext(result -> {
                            assertThat(result.skipped()).isTrue();
                            assertThat(result.error()).contains("already running");
                        })
                        .verifyComplete();
            } finally {
                first.dispose();
            }

            assertThat(sweeper.isRunning()).isFalse();
        }

        @Test
        @DisplayName("should allow a new pass after the previous one finished")
        void shouldRunAgainAfterCompletion() {
            // Given
            when(postRepository.findRandomSample(anyInt())).thenReturn(Flux.just(post("p1")));
            when(userRepository.findRandomSample(anyInt())).thenReturn(Flux.empty());
            ReconciliationSweeper sweeper = sweeper(searchIndex);

            // When
            sweeper.sweepOnce().block(Duration.ofSeconds(2));

            // Then
            StepVerifier.create(sweeper.sweepOnce())
                    .assertNext(result -> assertThat(result.skipped()).isFalse())
                    .verifyComplete();
            assertThat(reconciled("post")).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("Distributed lock")
    class DistributedLock {

        @Mock
        private ReactiveStringRedisTemplate redis;

        @Mock
        private ReactiveValueOperations<String, String> valueOps;

        @BeforeEach
        void setUpRedis() {
            when(redisProvider.getIfAvailable()).thenReturn(redis);
            when(redis.opsForValue()).thenReturn(valueOps);
        }

        @Test
        @DisplayName("should skip when another instance holds the lock")
        void shouldSkipWhenLockHeld() {
            // Given
            when(valueOps.setIfAbsent(eq(ReconciliationSweeper.LOCK_KEY), anyString(), any(Duration.class)))
                    .thenReturn(Mono.just(false));
            ReconciliationSweeper sweeper = sweeper(searchIndex);

            // When / Then
            StepVerifier.create(sweeper.sweepOnce())
                    .assertNext(result -> {
                        assertThat(result.skipped()).isTrue();
                        assertThat(result.error()).contains("lock");
                    })
                    .verifyComplete();

            verify(postRepository, never()).findRandomSample(anyInt());
            verify(redis, never()).delete(anyString());
        }

        @Test
        @DisplayName("should release the lock after a pass")
        void shouldReleaseLock() {
            // Given
            when(valueOps.setIfAbsent(eq(ReconciliationSweeper.LOCK_KEY), anyString(), any(Duration.class)))
                    .thenReturn(Mono.just(true));
            when(redis.delete(ReconciliationSweeper.LOCK_KEY)).thenReturn(Mono.just(1L));
            when(postRepository.findRandomSample(anyInt())).thenReturn(Flux.empty());
            when(userRepository.findRandomSample(anyInt())).thenReturn(Flux.empty());
            ReconciliationSweeper sweeper = sweeper(searchIndex);

            // When / Then
            StepVerifier.create(sweeper.sweepOnce())
                    .assertNext(result -> assertThat(result.skipped()).isFalse())
                    .verifyComplete();

            verify(redis).delete(ReconciliationSweeper.LOCK_KEY);
        }

        @Test
        @DisplayName("should run unlocked when Redis errors")
        void shouldRunUnlockedOnRedisError() {
            // Given
            when(valueOps.setIfAbsent(eq(ReconciliationSweeper.LOCK_KEY), anyString(), any(Duration.class)))
                    .thenReturn(Mono.error(new IllegalStateException("redis down")));
            lenient().when(redis.delete(anyString())).thenReturn(Mono.just(0L));
            when(postRepository.findRandomSample(anyInt())).thenReturn(Flux.just(post("p1")));
            when(userRepository.findRandomSample(anyInt())).thenReturn(Flux.empty());
            ReconciliationSweeper sweeper = sweeper(searchIndex);

            // When / Then
            StepVerifier.create(sweeper.sweepOnce())
                    .assertNext(result -> assertThat(result.postsIndexed()).isEqualTo(1))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Scheduling")
    class Scheduling {

        @Test
        @DisplayName("should register and cancel the periodic task")
        void shouldScheduleAndStop() {
            // Given
            ReconciliationSweeper sweeper = sweeper(searchIndex);

            // When
            sweeper.start();

            // Then
            assertThat(supervisor.isScheduled(ReconciliationSweeper.TASK_NAME)).isTrue();
            assertThat(sweeper.stop()).isTrue();
            assertThat(supervisor.isScheduled(ReconciliationSweeper.TASK_NAME)).isFalse();
        }
    }
}
