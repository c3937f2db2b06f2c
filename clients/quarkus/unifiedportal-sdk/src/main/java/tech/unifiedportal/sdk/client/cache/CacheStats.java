package tech.unifiedportal.sdk.client.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cache statistics snapshot.
 */
public record CacheStats(
    @JsonProperty("hits") long hits,
    @JsonProperty("misses") long misses,
    @JsonProperty("evictions") long evictions,
    @JsonProperty("volatileSize") int volatileSize,
    @JsonProperty("durableSize") int durableSize,
    @JsonProperty("hitRate") double hitRate
) {}
