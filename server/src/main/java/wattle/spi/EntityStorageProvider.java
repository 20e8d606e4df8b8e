package wattle.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import wattle.core.port.out.EntityStorage;

/**
 * SPI for grant state storage implementations.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - Redis-based storage shared by all instances</li>
 *   <li>memory (priority: 0) - In-memory storage (single instance only)</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider (wattle.oidc.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 *
 * <h2>Custom Implementation Example</h2>
 * <pre>{@code
 * @ApplicationScoped
 * public class DynamoDbEntityStorageProvider implements EntityStorageProvider {
 *
 *     public String name() {
 *         return "dynamodb";
 *     }
 *
 *     public int priority() {
 *         return 150;
 *     }
 *
 *     public boolean isAvailable() {
 *         return client.isReady();
 *     }
 *
 *     public EntityStorage createStorage() {
 *         return new DynamoDbEntityStorage(client);
 *     }
 * }
 * }</pre>
 */
public interface EntityStorageProvider {

    /**
     * Provider name used in {@code wattle.oidc.storage.provider}.
     */
    String name();

    /**
     * Priority for automatic selection; higher wins.
     */
    int priority();

    /**
     * Whether the provider can be used right now. Must return quickly.
     */
    boolean isAvailable();

    /**
     * Creates the storage. Implementations must honor the atomicity guarantees of
     * {@link EntityStorage#remove} and retrieve-and-delete reads.
     */
    EntityStorage createStorage();

    /**
     * Health of the storage backend, reported on the readiness endpoint.
     */
    default Optional<HealthCheckResponse> healthCheck() {
        return Optional.empty();
    }
}
