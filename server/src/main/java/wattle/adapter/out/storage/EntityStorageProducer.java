package wattle.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import wattle.core.port.out.EntityStorage;
import wattle.core.service.storage.EntityStorageProviderRegistry;

/**
 * CDI producer for grant state storage, delegating provider selection to
 * {@link EntityStorageProviderRegistry}.
 *
 * @see wattle.spi.EntityStorageProvider
 */
@ApplicationScoped
public class EntityStorageProducer {

    private final EntityStorageProviderRegistry registry;

    @Inject
    public EntityStorageProducer(EntityStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public EntityStorage entityStorage() {
        return registry.getStorage();
    }
}
