package tech.unifiedportal.sdk.client.scheduling;

import com.fasterxml.jackson.annotation.JsonProperty;
import tech.unifiedportal.sdk.enums.Priority;

import java.util.Map;

/**
 * Scheduler queue snapshot.
 */
public record QueueStats(
    @JsonProperty("perLanePending") Map<Priority, Integer> perLanePending,
    @JsonProperty("activeCount") int activeCount,
    @JsonProperty("totalQueued") int totalQueued,
    @JsonProperty("maxConcurrent") int maxConcurrent
) {}
