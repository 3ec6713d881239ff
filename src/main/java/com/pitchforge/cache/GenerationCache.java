package com.pitchforge.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory store of generated text keyed by (provider, task, prompt prefix).
 * Entries expire lazily: an expired entry is evicted by the read that finds it.
 */
public class GenerationCache {

    static final int KEY_PROMPT_LENGTH = 100;
    private static final String SEPARATOR = ":";

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong saves = new AtomicLong();
    private final Duration ttl;
    private final Clock clock;

    public GenerationCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public GenerationCache(Duration ttl, Clock clock) {
        if (ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("ttl must be positive: " + ttl);
        this.ttl = ttl;
        this.clock = clock;
    }

    record CacheEntry(String key, String value, Instant expiresAt) {}

    /**
     * Two prompts that differ only in whitespace, or share their first 100
     * normalized characters, map to the same key.
     */
    public static String keyFor(String prompt, String providerId, String taskKind) {
        var normalized = prompt.trim().replaceAll("\\s+", " ");
        var prefix = normalized.length() > KEY_PROMPT_LENGTH
                ? normalized.substring(0, KEY_PROMPT_LENGTH)
                : normalized;
        return providerId + SEPARATOR + taskKind + SEPARATOR + prefix;
    }

    public Optional<String> get(String prompt, String providerId, String taskKind) {
        var key = keyFor(prompt, providerId, taskKind);
        var entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry.expiresAt().isBefore(clock.instant())) {
            // only drop the entry we looked at; a concurrent writer may have replaced it
            entries.remove(key, entry);
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.value());
    }

    public void set(String prompt, String providerId, String taskKind, String value) {
        var key = keyFor(prompt, providerId, taskKind);
        entries.put(key, new CacheEntry(key, value, clock.instant().plus(ttl)));
        saves.incrementAndGet();
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public CacheStats stats() {
        long h = hits.get();
        long m = misses.get();
        long total = h + m;
        double rate = total > 0 ? Math.round(h * 10_000.0 / total) / 100.0 : 0.0;
        return new CacheStats(h, m, saves.get(), entries.size(), rate);
    }
}
