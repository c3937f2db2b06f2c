package tech.unifiedportal.sdk.client.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Snapshot of the call performance aggregate.
 *
 * <p>Latencies are in milliseconds. {@code successRate} is a percentage, 0 when
 * no calls have completed.
 */
public record CallMetrics(
    @JsonProperty("totalCalls") long totalCalls,
    @JsonProperty("successCount") long successCount,
    @JsonProperty("failureCount") long failureCount,
    @JsonProperty("totalLatency") long totalLatency,
    @JsonProperty("averageLatency") double averageLatency,
    @JsonProperty("successRate") double successRate,
    @JsonProperty("slowCallCount") long slowCallCount,
    @JsonProperty("serverErrors") long serverErrors,
    @JsonProperty("clientErrors") long clientErrors,
    @JsonProperty("networkErrors") long networkErrors,
    @JsonProperty("recentLatencies") List<Long> recentLatencies
) {}
