package com.pitchforge.providers;

import java.util.Set;

/**
 * One model offered by a provider, with its generation defaults.
 */
public record ProviderDescriptor(
    String providerId,
    String modelId,
    int maxOutputTokens,
    double temperature,
    Set<String> suitabilityTags
) {
    public ProviderDescriptor {
        suitabilityTags = suitabilityTags != null ? Set.copyOf(suitabilityTags) : Set.of();
    }

    public boolean hasAnyTag(String... tags) {
        for (var tag : tags) {
            if (suitabilityTags.contains(tag)) return true;
        }
        return false;
    }

    /** Same settings under another model id, for models the catalog does not list. */
    public ProviderDescriptor withModel(String modelId) {
        return new ProviderDescriptor(providerId, modelId, maxOutputTokens, temperature, suitabilityTags);
    }

    public String label() {
        return providerId + "/" + modelId;
    }
}
