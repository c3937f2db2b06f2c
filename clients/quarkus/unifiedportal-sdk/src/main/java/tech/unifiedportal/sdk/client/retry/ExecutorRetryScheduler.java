package tech.unifiedportal.sdk.client.retry;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link RetryScheduler} backed by a single daemon timer thread.
 */
public class ExecutorRetryScheduler implements RetryScheduler {

    private final ScheduledExecutorService executor;

    public ExecutorRetryScheduler() {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "unifiedportal-retry");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public ScheduledRetry schedule(Duration delay, Runnable action) {
        ScheduledFuture<?> future = executor.schedule(action, delay.toMillis(), TimeUnit.MILLISECONDS);
        return new ScheduledRetry() {
            @Override
            public boolean cancel() {
                return future.cancel(false);
            }

            @Override
            public boolean isDone() {
                return future.isDone();
            }
        };
    }

    @Override
    public void shutdown() {
        executor.shutdownNow();
    }
}
