package com.pitchforge.shared.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record PitchForgeConfig(
    Map<String, ProviderConfig> providers,
    RoutingConfig routing,
    CacheConfig cache,
    InvokerConfig generation,
    Path metricsFile
) {
    public Optional<ProviderConfig> provider(String id) {
        return Optional.ofNullable(providers.get(id));
    }

    public List<ProviderConfig> enabledProviders() {
        return providers.values().stream().filter(ProviderConfig::enabled).toList();
    }
}
