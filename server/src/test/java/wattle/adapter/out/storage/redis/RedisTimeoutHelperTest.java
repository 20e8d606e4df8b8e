package wattle.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RedisTimeoutHelper")
class RedisTimeoutHelperTest {

    private final RedisTimeoutHelper helper = new RedisTimeoutHelper(Duration.ofMillis(50), "grant-storage");

    @Test
    @DisplayName("should pass through results within the deadline")
    void shouldPassThroughResult() {
        var result = helper.withTimeout(Uni.createFrom().item("value"), "GET")
                .await()
                .atMost(Duration.ofSeconds(1));

        assertEquals("value", result);
    }

    @Test
    @DisplayName("should fail with RedisTimeoutException when the deadline passes")
    void shouldFailOnTimeout() {
        var subscriber = helper.withTimeout(Uni.createFrom().<String>nothing(), "GETDEL")
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create());

        var failure = subscriber
                .awaitFailure(Duration.ofSeconds(1))
                .assertFailedWith(RedisTimeoutHelper.RedisTimeoutException.class)
                .getFailure();
        var timeout = (RedisTimeoutHelper.RedisTimeoutException) failure;
        assertEquals("GETDEL", timeout.getOperation());
        assertEquals("grant-storage", timeout.getComponent());
    }

    @Test
    @DisplayName("should propagate other failures unchanged")
    void shouldPropagateFailures() {
        var subscriber = helper.withTimeout(
                        Uni.createFrom().<String>failure(new IllegalStateException("connection reset")), "SET")
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create());

        subscriber.assertFailedWith(IllegalStateException.class, "connection reset");
    }
}
