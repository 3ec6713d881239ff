package com.pitchforge.observability;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Immutable copy of the process-wide usage counters; also the persisted file format.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UsageMetric(
    long totalRequests,
    Map<String, Long> perProviderCounts,
    Map<String, TaskStats> perTaskStats,
    long successCount,
    long failureCount,
    long cumulativeLatencyMs,
    Map<String, Long> retryCounts,
    String updatedAt
) {
    public UsageMetric {
        perProviderCounts = perProviderCounts != null ? Map.copyOf(perProviderCounts) : Map.of();
        perTaskStats = perTaskStats != null ? Map.copyOf(perTaskStats) : Map.of();
        retryCounts = retryCounts != null ? Map.copyOf(retryCounts) : Map.of();
    }

    public static UsageMetric empty() {
        return new UsageMetric(0, Map.of(), Map.of(), 0, 0, 0, Map.of(), null);
    }

    public record TaskStats(long count, long successCount, long failureCount) {}

    public double successRatePercentage() {
        long total = successCount + failureCount;
        return total == 0 ? 0.0 : successCount * 100.0 / total;
    }

    public double averageLatencyMs() {
        return totalRequests == 0 ? 0.0 : (double) cumulativeLatencyMs / totalRequests;
    }
}
