package com.pitchforge.shared.config;

import java.time.Duration;

public record CacheConfig(Duration ttl) {
    public static CacheConfig defaults() {
        return new CacheConfig(Duration.ofHours(24));
    }
}
