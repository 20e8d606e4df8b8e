package wattle.adapter.out.storage.redis;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Applies a deadline to Redis operations.
 *
 * <p>Grant state is authoritative: a lost write or an unanswered atomic removal cannot be
 * treated as a cache miss. Timeouts therefore fail with {@link RedisTimeoutException}
 * and other failures propagate unchanged.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final String componentName;

    /**
     * @param timeout       deadline of a single operation
     * @param componentName component name for logging
     */
    public RedisTimeoutHelper(Duration timeout, String componentName) {
        this.timeout = timeout;
        this.componentName = componentName;
    }

    /**
     * Fails the operation with {@link RedisTimeoutException} when it exceeds the deadline.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation.ifNoItem().after(timeout).failWith(() -> {
            LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, componentName, timeout);
            return new RedisTimeoutException(operationName, componentName);
        });
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * A Redis operation exceeded its deadline.
     */
    public static class RedisTimeoutException extends RuntimeException {
        private final String operation;
        private final String component;

        public RedisTimeoutException(String operation, String component) {
            super("Redis operation timeout: " + operation + " in " + component);
            this.operation = operation;
            this.component = component;
        }

        public String getOperation() {
            return operation;
        }

        public String getComponent() {
            return component;
        }
    }
}
