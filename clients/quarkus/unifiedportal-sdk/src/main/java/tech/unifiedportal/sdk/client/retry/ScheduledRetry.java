package tech.unifiedportal.sdk.client.retry;

/**
 * A pending backoff. Cancelling prevents the retry action from running.
 */
public interface ScheduledRetry {

    /**
     * @return true if the action had not run yet and will now never run
     */
    boolean cancel();

    boolean isDone();
}
