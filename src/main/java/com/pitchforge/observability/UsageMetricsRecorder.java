package com.pitchforge.observability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pitchforge.providers.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide usage counters. Every update is written through to a JSON file
 * before the call returns, so a restart loses at most the record in flight.
 */
public class UsageMetricsRecorder {

    private static final Logger log = LoggerFactory.getLogger(UsageMetricsRecorder.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;
    private final MetricsConfig meters;
    private final Clock clock;

    private long totalRequests;
    private final Map<String, Long> perProvider = new TreeMap<>();
    private final Map<String, long[]> perTask = new TreeMap<>();
    private long successCount;
    private long failureCount;
    private long cumulativeLatencyMs;
    private final Map<String, Long> retries = new TreeMap<>();

    public UsageMetricsRecorder(Path file) {
        this(file, null, Clock.systemUTC());
    }

    public UsageMetricsRecorder(Path file, MetricsConfig meters) {
        this(file, meters, Clock.systemUTC());
    }

    public UsageMetricsRecorder(Path file, MetricsConfig meters, Clock clock) {
        this.file = file;
        this.meters = meters;
        this.clock = clock;
        restore(load());
    }

    public synchronized void record(String label, String taskKind, long latencyMs, boolean success) {
        totalRequests++;
        perProvider.merge(label, 1L, Long::sum);
        var task = perTask.computeIfAbsent(taskKind, k -> new long[3]);
        task[0]++;
        if (success) {
            task[1]++;
            successCount++;
        } else {
            task[2]++;
            failureCount++;
        }
        cumulativeLatencyMs += Math.max(latencyMs, 0);
        flush();

        if (meters != null) {
            meters.generationCalls(label, taskKind, success).increment();
            meters.generationLatency(label).record(Math.max(latencyMs, 0), TimeUnit.MILLISECONDS);
        }
    }

    /** Counts one same-provider retry triggered by {@code kind}. */
    public synchronized void recordRetry(String providerId, ErrorKind kind) {
        retries.merge(kind.name(), 1L, Long::sum);
        flush();
        if (meters != null) {
            meters.inProviderRetries(providerId, kind.name()).increment();
        }
    }

    public synchronized UsageMetric currentSnapshot() {
        var tasks = new HashMap<String, UsageMetric.TaskStats>();
        perTask.forEach((k, v) -> tasks.put(k, new UsageMetric.TaskStats(v[0], v[1], v[2])));
        return new UsageMetric(totalRequests, perProvider, tasks, successCount, failureCount,
                cumulativeLatencyMs, retries, clock.instant().toString());
    }

    public Path file() {
        return file;
    }

    private void flush() {
        var snapshot = currentSnapshot();
        var tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            var parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            MAPPER.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("Failed to persist usage metrics to {}", file, e);
        }
    }

    private UsageMetric load() {
        if (!Files.exists(file)) return UsageMetric.empty();
        try {
            var loaded = MAPPER.readValue(file.toFile(), UsageMetric.class);
            log.info("Loaded usage metrics from {} ({} requests)", file, loaded.totalRequests());
            return loaded;
        } catch (IOException e) {
            log.error("Unreadable usage metrics at {}, starting from zero", file, e);
            return UsageMetric.empty();
        }
    }

    private void restore(UsageMetric m) {
        totalRequests = m.totalRequests();
        perProvider.putAll(m.perProviderCounts());
        m.perTaskStats().forEach((k, v) ->
                perTask.put(k, new long[]{v.count(), v.successCount(), v.failureCount()}));
        successCount = m.successCount();
        failureCount = m.failureCount();
        cumulativeLatencyMs = m.cumulativeLatencyMs();
        retries.putAll(m.retryCounts());
    }
}
