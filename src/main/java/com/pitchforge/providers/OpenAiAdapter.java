package com.pitchforge.providers;

import com.pitchforge.shared.config.ProviderConfig;

import java.net.http.HttpClient;
import java.util.Optional;

public class OpenAiAdapter extends OpenAiCompatibleAdapter {

    private static final String REASONING_FALLBACK = "gpt-4o-mini";

    public OpenAiAdapter(ProviderConfig config) {
        this(config, defaultClient());
    }

    public OpenAiAdapter(ProviderConfig config, HttpClient httpClient) {
        super(config, httpClient);
    }

    /**
     * A missing gpt-4 variant falls back to another catalogued gpt-4 model, a
     * missing o-series model to gpt-4o-mini, anything else to the configured fallback.
     */
    @Override
    protected Optional<ProviderDescriptor> modelNotFoundFallback(ProviderDescriptor failed) {
        var model = failed.modelId();
        if (model.contains("gpt-4")) {
            var sibling = catalog.models().stream()
                    .filter(m -> m.modelId().contains("gpt-4") && !m.modelId().equals(model))
                    .findFirst();
            if (sibling.isPresent()) return sibling;
        } else if (model.startsWith("o1") || model.startsWith("o3")) {
            var mini = catalog.find(REASONING_FALLBACK);
            if (mini.isPresent()) return mini;
        }
        return catalog.fallbackDescriptor();
    }
}
