package wattle.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wattle.core.model.storage.StorageOptions;
import wattle.core.port.out.EntityStorage;

/**
 * In-memory implementation of grant state storage.
 *
 * <p>Entries are lost on restart and not shared across instances. Atomic reads and
 * removals rely on {@link ConcurrentMap#remove(Object)} returning the removed entry to
 * exactly one caller.
 */
public class InMemoryEntityStorage implements EntityStorage {

    private static final Logger LOG = Logger.getLogger(InMemoryEntityStorage.class);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryEntityStorage(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "grant-storage-cleanup");
            t.setDaemon(true);
            return t;
        });

        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
        LOG.info("Initialized in-memory grant storage");
    }

    @Override
    public <T> Uni<Void> set(String key, T value, StorageOptions options) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            entries.put(key, new Entry(value, options.resolveExpiry(now), options.slidingExpiration(), now));
            LOG.debugf("Stored entry: %s", key);
            return null;
        });
    }

    @Override
    public <T> Uni<Optional<T>> get(String key, Class<T> type, boolean removeOnRetrieval) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final Entry entry;
            if (removeOnRetrieval) {
                entry = entries.remove(key);
            } else {
                entry = entries.computeIfPresent(key, (k, existing) -> {
                    if (existing.isExpired(now)) {
                        return null;
                    }
                    return existing.touch(now);
                });
            }

            if (entry == null || entry.isExpired(now)) {
                return Optional.<T>empty();
            }
            return Optional.of(type.cast(entry.value()));
        });
    }

    @Override
    public Uni<Boolean> remove(String key) {
        return Uni.createFrom().item(() -> {
            final var entry = entries.remove(key);
            return entry != null && !entry.isExpired(clock.instant());
        });
    }

    private void cleanupExpired() {
        final var now = clock.instant();
        final var before = entries.size();

        entries.entrySet().removeIf(entry -> entry.getValue().isExpired(now));

        final var removed = before - entries.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired grant storage entries", removed);
        }
    }

    /**
     * Shuts down the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Number of stored entries, expired ones included until cleanup runs.
     */
    public int getEntryCount() {
        return entries.size();
    }

    private record Entry(Object value, Instant absoluteExpiry, Duration slidingExpiration, Instant lastAccess) {

        boolean isExpired(Instant now) {
            if (absoluteExpiry != null && !now.isBefore(absoluteExpiry)) {
                return true;
            }
            return slidingExpiration != null && !now.isBefore(lastAccess.plus(slidingExpiration));
        }

        Entry touch(Instant now) {
            return slidingExpiration == null ? this : new Entry(value, absoluteExpiry, slidingExpiration, now);
        }
    }
}
