package tech.unifiedportal.sdk.client.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached response payload.
 *
 * @param key derived cache key
 * @param value opaque JSON payload
 * @param createdAt when the entry was written
 * @param ttl how long the entry stays valid
 */
public record CacheEntry(String key, JsonNode value, Instant createdAt, Duration ttl) {

    /**
     * Valid while less than {@code ttl} has elapsed since creation.
     */
    public boolean isValidAt(Instant now) {
        return Duration.between(createdAt, now).compareTo(ttl) < 0;
    }
}
