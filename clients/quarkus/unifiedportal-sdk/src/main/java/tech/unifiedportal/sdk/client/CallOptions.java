package tech.unifiedportal.sdk.client;

import tech.unifiedportal.sdk.enums.CacheStrategy;
import tech.unifiedportal.sdk.enums.Priority;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call options. Immutable; each {@code with*} method returns a copy.
 *
 * <p>Unset TTL and timeout fall back to the client's configured defaults.
 */
public final class CallOptions {

    private static final CallOptions DEFAULTS = new CallOptions(
        Priority.NORMAL, CacheStrategy.VOLATILE, null, false, false, null, false, Map.of());

    private final Priority priority;
    private final CacheStrategy cacheStrategy;
    private final Duration cacheTtl;
    private final boolean referenceData;
    private final boolean bypassCache;
    private final Duration timeout;
    private final boolean retryWrites;
    private final Map<String, String> headers;

    private CallOptions(Priority priority, CacheStrategy cacheStrategy, Duration cacheTtl, boolean referenceData,
                        boolean bypassCache, Duration timeout, boolean retryWrites, Map<String, String> headers) {
        this.priority = priority;
        this.cacheStrategy = cacheStrategy;
        this.cacheTtl = cacheTtl;
        this.referenceData = referenceData;
        this.bypassCache = bypassCache;
        this.timeout = timeout;
        this.retryWrites = retryWrites;
        this.headers = headers;
    }

    /**
     * NORMAL priority, volatile caching, configured TTL and timeout, no write retries.
     */
    public static CallOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Durable caching with the configured reference-data TTL, for lookups that rarely change.
     */
    public static CallOptions referenceData() {
        return new CallOptions(Priority.NORMAL, CacheStrategy.DURABLE, null, true, false, null, false, Map.of());
    }

    public CallOptions withPriority(Priority priority) {
        return new CallOptions(priority, cacheStrategy, cacheTtl, referenceData, bypassCache, timeout, retryWrites, headers);
    }

    public CallOptions withCacheStrategy(CacheStrategy cacheStrategy) {
        return new CallOptions(priority, cacheStrategy, cacheTtl, referenceData, bypassCache, timeout, retryWrites, headers);
    }

    public CallOptions withCacheTtl(Duration cacheTtl) {
        return new CallOptions(priority, cacheStrategy, cacheTtl, referenceData, bypassCache, timeout, retryWrites, headers);
    }

    /**
     * Skip the cache lookup. A successful response still refreshes the cache.
     */
    public CallOptions withBypassCache(boolean bypassCache) {
        return new CallOptions(priority, cacheStrategy, cacheTtl, referenceData, bypassCache, timeout, retryWrites, headers);
    }

    public CallOptions withTimeout(Duration timeout) {
        return new CallOptions(priority, cacheStrategy, cacheTtl, referenceData, bypassCache, timeout, retryWrites, headers);
    }

    /**
     * Allow POST, PUT, PATCH and DELETE to be retried after retriable failures.
     */
    public CallOptions withRetryWrites(boolean retryWrites) {
        return new CallOptions(priority, cacheStrategy, cacheTtl, referenceData, bypassCache, timeout, retryWrites, headers);
    }

    public CallOptions withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new CallOptions(priority, cacheStrategy, cacheTtl, referenceData, bypassCache, timeout, retryWrites,
            Collections.unmodifiableMap(copy));
    }

    public Priority priority() {
        return priority;
    }

    public CacheStrategy cacheStrategy() {
        return cacheStrategy;
    }

    /**
     * @return the explicit TTL, or null to use the configured default
     */
    public Duration cacheTtl() {
        return cacheTtl;
    }

    public boolean isReferenceData() {
        return referenceData;
    }

    public boolean bypassCache() {
        return bypassCache;
    }

    /**
     * @return the explicit timeout, or null to use the configured default
     */
    public Duration timeout() {
        return timeout;
    }

    public boolean retryWrites() {
        return retryWrites;
    }

    public Map<String, String> headers() {
        return headers;
    }

    @Override
    public String toString() {
        return "CallOptions[priority=" + priority + ", cacheStrategy=" + cacheStrategy
            + ", bypassCache=" + bypassCache + ", retryWrites=" + retryWrites + "]";
    }
}
