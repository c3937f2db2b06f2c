package tech.unifiedportal.sdk.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import tech.unifiedportal.sdk.client.cache.CacheStats;
import tech.unifiedportal.sdk.client.metrics.CallMetrics;
import tech.unifiedportal.sdk.client.scheduling.QueueStats;

/**
 * Telemetry snapshot returned by {@link PortalClient#getMetrics()}.
 */
public record ClientMetrics(
    @JsonProperty("calls") CallMetrics calls,
    @JsonProperty("cache") CacheStats cache,
    @JsonProperty("queue") QueueStats queue
) {}
