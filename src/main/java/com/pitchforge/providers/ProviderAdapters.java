package com.pitchforge.providers;

import com.pitchforge.shared.config.PitchForgeConfig;
import com.pitchforge.shared.config.ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds one adapter per enabled provider.
 */
public final class ProviderAdapters {

    private static final Logger log = LoggerFactory.getLogger(ProviderAdapters.class);

    private ProviderAdapters() {}

    public static Map<String, ProviderAdapter> fromConfig(PitchForgeConfig config) {
        var adapters = new LinkedHashMap<String, ProviderAdapter>();
        for (var provider : config.providers().values()) {
            if (!provider.enabled()) {
                log.warn("Provider {} disabled (no credential or switched off)", provider.id());
                continue;
            }
            adapters.put(provider.id(), create(provider));
            log.info("Provider {} enabled with default model {}", provider.id(), provider.catalog().defaultModel());
        }
        return Collections.unmodifiableMap(adapters);
    }

    static ProviderAdapter create(ProviderConfig provider) {
        if ("anthropic".equals(provider.type())) return new AnthropicAdapter(provider);
        if ("openai".equals(provider.type())) return new OpenAiAdapter(provider);
        if ("ollama".equals(provider.type())) return new OllamaAdapter(provider);
        throw new IllegalArgumentException("Unsupported provider type: " + provider.type());
    }
}
