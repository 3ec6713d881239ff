package com.pitchforge.shared.config;

/**
 * Generation settings. {@code workerThreads} bounds how many submitted requests
 * run at once; further submissions queue.
 */
public record InvokerConfig(
    int minOutputLength,
    long rateLimitBackoffMs,
    int longFormThreshold,
    int workerThreads
) {
    public static final int DEFAULT_WORKER_THREADS = 8;

    public InvokerConfig {
        if (workerThreads < 1) {
            throw new IllegalStateException("generation.worker-threads must be positive: " + workerThreads);
        }
    }

    public InvokerConfig(int minOutputLength, long rateLimitBackoffMs, int longFormThreshold) {
        this(minOutputLength, rateLimitBackoffMs, longFormThreshold, DEFAULT_WORKER_THREADS);
    }

    public static InvokerConfig defaults() {
        return new InvokerConfig(50, 2000, 2000);
    }
}
