package tech.unifiedportal.sdk.enums;

import java.util.Locale;

/**
 * How a read call interacts with the response cache.
 *
 * <p>There is no separate "aggressive" strategy: it is accepted as a name for
 * {@link #DURABLE} and differs only by the longer TTL callers pass for
 * reference data.
 */
public enum CacheStrategy {
    /** Bypass the cache entirely. */
    NO_CACHE,
    /** In-process tier only. */
    VOLATILE,
    /** Write through to durable storage, promote durable hits into memory. */
    DURABLE;

    public boolean usesDurableTier() {
        return this == DURABLE;
    }

    /**
     * Resolve a strategy from its external name.
     *
     * @param name one of no-cache, volatile, durable, aggressive (case-insensitive,
     *             underscores and hyphens are interchangeable)
     */
    public static CacheStrategy fromName(String name) {
        if (name == null || name.isBlank()) {
            return VOLATILE;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (normalized) {
            case "no-cache", "none" -> NO_CACHE;
            case "volatile", "memory-only", "memory" -> VOLATILE;
            case "durable", "persistent", "aggressive" -> DURABLE;
            default -> throw new IllegalArgumentException("Unknown cache strategy: " + name);
        };
    }
}
