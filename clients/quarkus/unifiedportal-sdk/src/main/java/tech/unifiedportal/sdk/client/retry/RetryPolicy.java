package tech.unifiedportal.sdk.client.retry;

import io.github.resilience4j.core.IntervalFunction;
import tech.unifiedportal.sdk.enums.ErrorType;
import tech.unifiedportal.sdk.enums.HttpMethod;
import tech.unifiedportal.sdk.exception.PortalClientException;

import java.time.Duration;
import java.util.Set;

/**
 * Decides whether a failed attempt is retried and how long to back off.
 *
 * <p>Backoff is {@code baseDelay * 2^retryCount}: with the defaults 1000, 2000 and 4000ms.
 * Statuses in {@link #NON_RETRYABLE_STATUSES} are never retried, and neither are
 * calls that could not be constructed. Writes are retried only when the caller opts in.
 */
public class RetryPolicy {

    public static final Set<Integer> NON_RETRYABLE_STATUSES = Set.of(400, 401, 403, 404, 422);

    private final int maxAttempts;
    private final IntervalFunction backoff;

    /**
     * @param maxAttempts retries allowed after the first attempt
     * @param baseDelayMs delay before the first retry
     */
    public RetryPolicy(int maxAttempts, long baseDelayMs) {
        this.maxAttempts = maxAttempts;
        this.backoff = IntervalFunction.ofExponentialBackoff(baseDelayMs, 2.0);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * @param retryCount retries already performed for this call
     */
    public boolean shouldRetry(HttpMethod method, boolean retryWrites, PortalClientException failure, int retryCount) {
        if (retryCount >= maxAttempts) {
            return false;
        }
        if (failure.getType() == ErrorType.REQUEST_ERROR || failure.getType() == ErrorType.AUTH_FAILURE) {
            return false;
        }
        if (failure.getType() == ErrorType.API_ERROR && NON_RETRYABLE_STATUSES.contains(failure.getStatusCode())) {
            return false;
        }
        return !method.isMutating() || retryWrites;
    }

    /**
     * @param retryCount retries already performed for this call
     */
    public Duration delayFor(int retryCount) {
        // IntervalFunction counts attempts from 1
        return Duration.ofMillis(backoff.apply(retryCount + 1));
    }
}
