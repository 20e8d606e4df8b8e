package wattle.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import wattle.core.model.storage.StorageOptions;
import wattle.testing.MutableClock;

@DisplayName("InMemoryEntityStorage")
class InMemoryEntityStorageTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private InMemoryEntityStorage storage;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        storage = new InMemoryEntityStorage(clock);
    }

    @AfterEach
    void tearDown() {
        storage.shutdown();
    }

    @Nested
    @DisplayName("get()")
    class GetTests {

        @Test
        @DisplayName("should return stored value")
        void shouldReturnStoredValue() {
            storage.set("key", "value", StorageOptions.expiresIn(Duration.ofMinutes(1)))
                    .await()
                    .atMost(TIMEOUT);

            var result = storage.get("key", String.class, false).await().atMost(TIMEOUT);

            assertEquals("value", result.orElseThrow());
        }

        @Test
        @DisplayName("should return empty after absolute expiry")
        void shouldReturnEmptyAfterAbsoluteExpiry() {
            storage.set("key", "value", StorageOptions.expiresIn(Duration.ofMinutes(1)))
                    .await()
                    .atMost(TIMEOUT);
            clock.advance(Duration.ofMinutes(1));

            assertTrue(storage.get("key", String.class, false).await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should remove entry when removeOnRetrieval is set")
        void shouldRemoveEntryOnRetrieval() {
            storage.set("key", "value", StorageOptions.expiresIn(Duration.ofMinutes(1)))
                    .await()
                    .atMost(TIMEOUT);

            var first = storage.get("key", String.class, true).await().atMost(TIMEOUT);
            var second = storage.get("key", String.class, true).await().atMost(TIMEOUT);

            assertTrue(first.isPresent());
            assertTrue(second.isEmpty());
        }

        @Test
        @DisplayName("should extend sliding expiration on read")
        void shouldExtendSlidingExpirationOnRead() {
            storage.set("key", "value", StorageOptions.sliding(Duration.ofMinutes(5)))
                    .await()
                    .atMost(TIMEOUT);

            clock.advance(Duration.ofMinutes(4));
            assertTrue(storage.get("key", String.class, false).await().atMost(TIMEOUT).isPresent());

            clock.advance(Duration.ofMinutes(4));
            assertTrue(storage.get("key", String.class, false).await().atMost(TIMEOUT).isPresent());

            clock.advance(Duration.ofMinutes(5));
            assertTrue(storage.get("key", String.class, false).await().atMost(TIMEOUT).isEmpty());
        }
    }

    @Nested
    @DisplayName("remove()")
    class RemoveTests {

        @Test
        @DisplayName("should report true only for the caller that deleted the entry")
        void shouldReportTrueOnlyOnce() {
            storage.set("key", "value", StorageOptions.expiresIn(Duration.ofMinutes(1)))
                    .await()
                    .atMost(TIMEOUT);

            assertTrue(storage.remove("key").await().atMost(TIMEOUT));
            assertFalse(storage.remove("key").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should report false for expired entry")
        void shouldReportFalseForExpiredEntry() {
            storage.set("key", "value", StorageOptions.expiresIn(Duration.ofSeconds(10)))
                    .await()
                    .atMost(TIMEOUT);
            clock.advance(Duration.ofSeconds(11));

            assertFalse(storage.remove("key").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should let exactly one of many concurrent removals win")
        void shouldLetExactlyOneConcurrentRemovalWin() throws Exception {
            storage.set("key", "value", StorageOptions.expiresIn(Duration.ofMinutes(1)))
                    .await()
                    .atMost(TIMEOUT);

            int threads = 16;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<CompletableFuture<Boolean>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    futures.add(CompletableFuture.supplyAsync(
                            () -> {
                                try {
                                    start.await();
                                } catch (InterruptedException e) {
                                    Thread.currentThread().interrupt();
                                    throw new IllegalStateException(e);
                                }
                                return storage.remove("key").await().atMost(TIMEOUT);
                            },
                            executor));
                }
                start.countDown();

                long winners = 0;
                for (var future : futures) {
                    if (future.get(5, TimeUnit.SECONDS)) {
                        winners++;
                    }
                }
                assertEquals(1, winners);
            } finally {
                executor.shutdownNow();
            }
        }
    }
}
