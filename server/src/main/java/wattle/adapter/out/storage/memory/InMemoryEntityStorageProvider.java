package wattle.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import wattle.core.port.out.EntityStorage;
import wattle.spi.EntityStorageProvider;

/**
 * In-memory grant storage provider.
 *
 * <p>Always available; the fallback when no shared storage is configured.
 *
 * <p><strong>Warning:</strong> CIBA, device and authorization code state is only visible
 * to the instance that created it. Not recommended for multi-instance deployments.
 */
@ApplicationScoped
public class InMemoryEntityStorageProvider implements EntityStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryEntityStorageProvider.class);
    private static final int PRIORITY = 0;

    private final Clock clock;
    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private volatile InMemoryEntityStorage storage;

    @Inject
    public InMemoryEntityStorageProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized EntityStorage createStorage() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Grant state storage is in-memory only!");
            LOG.warn("  Token requests must reach the instance that issued the code or request id.");
            LOG.warn("  Configure Redis or a custom EntityStorageProvider for production.");
            LOG.warn("========================================================================");
        }

        if (storage == null) {
            storage = new InMemoryEntityStorage(clock);
        }
        return storage;
    }

    @PreDestroy
    void shutdown() {
        if (storage != null) {
            storage.shutdown();
        }
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("grant-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("entries", storage != null ? storage.getEntryCount() : 0)
                .build());
    }
}
