package wattle.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import wattle.core.model.storage.StorageOptions;

/**
 * Port for key/value storage of grant state with per-entry expiration.
 *
 * <p>Implementations must provide:
 * <ul>
 *   <li>Absolute and sliding expiration per entry</li>
 *   <li>Atomic retrieve-and-delete when {@code removeOnRetrieval} is set</li>
 *   <li>An atomic {@link #remove} that reports whether this caller deleted the entry</li>
 * </ul>
 */
public interface EntityStorage {

    /**
     * Stores a value, replacing any existing entry.
     *
     * @param key     entry key
     * @param value   value to store
     * @param options expiration policy
     */
    <T> Uni<Void> set(String key, T value, StorageOptions options);

    /**
     * Reads a value.
     *
     * @param key               entry key
     * @param type              value type
     * @param removeOnRetrieval delete the entry atomically with the read
     * @return the value, or empty if absent or expired
     */
    <T> Uni<Optional<T>> get(String key, Class<T> type, boolean removeOnRetrieval);

    /**
     * Deletes an entry.
     *
     * <p>When several callers race to remove the same key, exactly one observes {@code true}.
     *
     * @param key entry key
     * @return true if an unexpired entry existed and this call removed it
     */
    Uni<Boolean> remove(String key);
}
