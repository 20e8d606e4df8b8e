package wattle.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import wattle.core.service.storage.EntityStorageProviderRegistry;

/**
 * Readiness of the grant state storage selected at startup.
 *
 * <p>Providers without a health check of their own are reported UP once selected.
 */
@Readiness
@ApplicationScoped
public class StorageHealthCheck implements HealthCheck {

    private final EntityStorageProviderRegistry registry;

    @Inject
    public StorageHealthCheck(EntityStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        final var provider = registry.getSelectedProvider();
        return provider.healthCheck().orElseGet(() -> HealthCheckResponse.builder()
                .name("grant-storage")
                .withData("provider", provider.name())
                .up()
                .build());
    }
}
