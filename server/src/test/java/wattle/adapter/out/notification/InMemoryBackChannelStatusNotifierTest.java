package wattle.adapter.out.notification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import wattle.core.model.backchannel.BackChannelAuthenticationStatus;

@DisplayName("InMemoryBackChannelStatusNotifier")
class InMemoryBackChannelStatusNotifierTest {

    private InMemoryBackChannelStatusNotifier notifier;

    @BeforeEach
    void setUp() {
        notifier = new InMemoryBackChannelStatusNotifier();
    }

    @Nested
    @DisplayName("waitForStatusChange()")
    class WaitTests {

        @Test
        @DisplayName("should complete with true when notified")
        void shouldCompleteWithTrueWhenNotified() {
            var subscriber = notifier.waitForStatusChange("req-1", Duration.ofSeconds(5))
                    .subscribe()
                    .withSubscriber(UniAssertSubscriber.create());

            assertEquals(1, notifier.getWaiterCount("req-1"));

            notifier.notifyStatusChange("req-1", BackChannelAuthenticationStatus.AUTHENTICATED)
                    .await()
                    .atMost(Duration.ofSeconds(1));

            subscriber.awaitItem(Duration.ofSeconds(1)).assertItem(true);
            assertEquals(0, notifier.getWaiterCount("req-1"));
        }

        @Test
        @DisplayName("should complete with false on timeout and remove the waiter")
        void shouldCompleteWithFalseOnTimeout() {
            Boolean notified = notifier.waitForStatusChange("req-1", Duration.ofMillis(50))
                    .await()
                    .atMost(Duration.ofSeconds(2));

            assertFalse(notified);
            assertEquals(0, notifier.getWaiterCount("req-1"));
        }

        @Test
        @DisplayName("should remove the waiter when the subscription is cancelled")
        void shouldRemoveWaiterOnCancellation() {
            var subscriber = notifier.waitForStatusChange("req-1", Duration.ofSeconds(30))
                    .subscribe()
                    .withSubscriber(UniAssertSubscriber.create());
            assertEquals(1, notifier.getWaiterCount("req-1"));

            subscriber.cancel();

            assertEquals(0, notifier.getWaiterCount("req-1"));
        }

        @Test
        @DisplayName("should wake every waiter of the same request")
        void shouldWakeEveryWaiter() {
            var first = notifier.waitForStatusChange("req-1", Duration.ofSeconds(5))
                    .subscribe()
                    .withSubscriber(UniAssertSubscriber.create());
            var second = notifier.waitForStatusChange("req-1", Duration.ofSeconds(5))
                    .subscribe()
                    .withSubscriber(UniAssertSubscriber.create());
            var other = notifier.waitForStatusChange("req-2", Duration.ofSeconds(5))
                    .subscribe()
                    .withSubscriber(UniAssertSubscriber.create());

            int woken = notifier.notifyLocalWaiters("req-1", BackChannelAuthenticationStatus.DENIED);

            assertEquals(2, woken);
            first.awaitItem(Duration.ofSeconds(1)).assertItem(true);
            second.awaitItem(Duration.ofSeconds(1)).assertItem(true);
            assertEquals(1, notifier.getWaiterCount("req-2"));
            other.cancel();
        }
    }

    @Test
    @DisplayName("should report zero woken waiters when nobody waits")
    void shouldReportZeroWhenNobodyWaits() {
        assertEquals(0, notifier.notifyLocalWaiters("unknown", BackChannelAuthenticationStatus.AUTHENTICATED));
        assertTrue(notifier.getWaiterCount("unknown") == 0);
    }
}
