package dev.sidechain.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SnowflakeId")
class SnowflakeIdTest {

    private SnowflakeId generator;

    @BeforeEach
    void setUp() {
        generator = new SnowflakeId(7);
    }

    @Nested
    @DisplayName("Constructor")
    class Constructor {

        @Test
        @DisplayName("should reject node ids outside 0..1023")
        void shouldRejectOutOfRangeNodeId() {
            assertThatThrownBy(() -> new SnowflakeId(-1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("between 0 and 1023");
            assertThatThrownBy(() -> new SnowflakeId(1024))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(new SnowflakeId(1023).getNodeId()).isEqualTo(1023);
        }
    }

    @Nested
    @DisplayName("nextId")
    class NextId {

        @Test
        @DisplayName("should issue strictly increasing ids on one node")
        void shouldBeMonotonic() {
            long previous = generator.nextId();
            for (int i = 0; i < 10_000; i++) {
                long next = generator.nextId();
                assertThat(next).isGreaterThan(previous);
                previous = next;
            }
        }

        @Test
        @DisplayName("should encode node id and creation time")
        void shouldEncodeComponents() {
            // Given
            Instant before = Instant.now().minusMillis(1);

            // When
            long id = generator.nextId();

            // Then
            assertThat(SnowflakeId.extractNodeId(id)).isEqualTo(7);
            assertThat(SnowflakeId.extractInstant(id)).isAfterOrEqualTo(before);
            assertThat(SnowflakeId.extractInstant(id)).isBeforeOrEqualTo(Instant.now().plusMillis(5));
        }

        @Test
        @DisplayName("should not collide under concurrent callers")
        void shouldBeUniqueAcrossThreads() throws InterruptedException {
            // Given
            int threads = 8;
            int perThread = 5_000;
            Set<Long> ids = ConcurrentHashMap.newKeySet();
            CountDownLatch done = new CountDownLatch(threads);
            ExecutorService pool = Executors.newFixedThreadPool(threads);

            // When
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        ids.add(generator.nextId());
                    }
                    done.countDown();
                });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            pool.shutdown();

            // Then
            assertThat(ids).hasSize(threads * perThread);
        }
    }
}
