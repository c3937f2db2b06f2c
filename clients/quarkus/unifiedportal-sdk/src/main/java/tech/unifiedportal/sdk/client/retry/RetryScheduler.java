package tech.unifiedportal.sdk.client.retry;

import java.time.Duration;

/**
 * Runs retry actions after a backoff delay.
 */
public interface RetryScheduler {

    ScheduledRetry schedule(Duration delay, Runnable action);

    /**
     * Release the underlying timer. Pending retries are dropped.
     */
    default void shutdown() {
    }
}
