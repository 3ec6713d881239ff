package com.pitchforge.providers;

import com.pitchforge.shared.config.ProviderConfig;

import java.util.List;
import java.util.Set;

/** Hand-built catalogs for tests that should not depend on default-models.yaml. */
public final class Fixtures {

    private Fixtures() {}

    public static ProviderDescriptor model(String providerId, String modelId, int maxTokens, String... tags) {
        return new ProviderDescriptor(providerId, modelId, maxTokens, 0.7, Set.of(tags));
    }

    /** Enabled provider whose default is the first model and whose fallback is the last. */
    public static ProviderConfig provider(String id, String type, ProviderDescriptor... models) {
        return provider(id, type, true, models);
    }

    public static ProviderConfig provider(String id, String type, boolean enabled, ProviderDescriptor... models) {
        var list = List.of(models);
        var catalog = new ModelCatalog(id, list.get(0).modelId(), list.get(list.size() - 1).modelId(), list);
        return new ProviderConfig(id, type,
                enabled ? ProviderConfig.Status.ENABLED : ProviderConfig.Status.DISABLED,
                enabled ? "test-key" : "", "http://localhost:0", 5, catalog);
    }

    /** Two-model catalog in the shape of the anthropic defaults. */
    public static ProviderConfig anthropic() {
        return provider("anthropic", "anthropic",
                model("anthropic", "claude-3-opus-20240229", 4000, "complex"),
                model("anthropic", "claude-3-haiku-20240307", 1000, "fast", "cost-effective"));
    }

    public static ProviderConfig openai() {
        return provider("openai", "openai",
                model("openai", "gpt-4o-mini", 4000, "general", "fast"),
                model("openai", "gpt-4o", 4000, "complex"),
                model("openai", "gpt-3.5-turbo", 3000, "fast", "cost-effective"));
    }

    public static ProviderConfig ollama(boolean enabled) {
        return provider("ollama", "ollama", enabled,
                model("ollama", "qwen3:4b", 800, "general"),
                model("ollama", "llama3.2:1b", 400, "fast"));
    }
}
