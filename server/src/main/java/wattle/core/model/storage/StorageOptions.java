package wattle.core.model.storage;

import java.time.Duration;
import java.time.Instant;

/**
 * Expiration policy of a stored entry. At most one of the absolute settings applies;
 * {@code absoluteExpiration} wins when both are set.
 *
 * @param absoluteExpiration              fixed instant after which the entry is gone
 * @param absoluteExpirationRelativeToNow lifetime measured from the write
 * @param slidingExpiration               idle period after which the entry is gone,
 *                                        reset on every read
 */
public record StorageOptions(
        Instant absoluteExpiration, Duration absoluteExpirationRelativeToNow, Duration slidingExpiration) {

    public static StorageOptions expiresIn(Duration lifetime) {
        return new StorageOptions(null, lifetime, null);
    }

    public static StorageOptions expiresAt(Instant instant) {
        return new StorageOptions(instant, null, null);
    }

    public static StorageOptions sliding(Duration idle) {
        return new StorageOptions(null, null, idle);
    }

    /**
     * Resolves the absolute expiry of an entry written at {@code now}.
     *
     * @return the expiry instant, or null when the entry has no absolute expiration
     */
    public Instant resolveExpiry(Instant now) {
        if (absoluteExpiration != null) {
            return absoluteExpiration;
        }
        if (absoluteExpirationRelativeToNow != null) {
            return now.plus(absoluteExpirationRelativeToNow);
        }
        return null;
    }
}
