package wattle.core.service.storage;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import wattle.core.config.EntityStorageConfig;
import wattle.core.port.out.EntityStorage;
import wattle.spi.EntityStorageProvider;

/**
 * Discovers grant state storage providers via CDI and selects one.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (wattle.oidc.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class EntityStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(EntityStorageProviderRegistry.class);

    private final Instance<EntityStorageProvider> providers;
    private final EntityStorageConfig config;

    private volatile EntityStorageProvider selectedProvider;
    private volatile EntityStorage storage;

    @Inject
    public EntityStorageProviderRegistry(Instance<EntityStorageProvider> providers, EntityStorageConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Returns the storage of the selected provider, creating it on first use.
     */
    public synchronized EntityStorage getStorage() {
        if (storage == null) {
            storage = getSelectedProvider().createStorage();
        }
        return storage;
    }

    public synchronized EntityStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private EntityStorageProvider selectProvider() {
        final var configuredProvider = config.provider();
        final var availableProviders = getAvailableProviders().stream()
                .sorted(Comparator.comparingInt(EntityStorageProvider::priority).reversed())
                .toList();

        LOG.debugf(
                "Available grant storage providers: %s",
                availableProviders.stream().map(EntityStorageProvider::name).toList());

        Optional<EntityStorageProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();
        if (configured.isPresent()) {
            LOG.infof("Using configured grant storage provider: %s", configuredProvider);
            return configured.get();
        }

        LOG.warnf("Configured grant storage provider '%s' is not available, falling back", configuredProvider);
        if (!availableProviders.isEmpty()) {
            final var provider = availableProviders.get(0);
            LOG.infof("Using grant storage provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new IllegalStateException("No grant storage providers available");
    }

    /**
     * Returns the providers that report themselves available.
     */
    public List<EntityStorageProvider> getAvailableProviders() {
        return providers.stream().filter(EntityStorageProvider::isAvailable).toList();
    }
}
