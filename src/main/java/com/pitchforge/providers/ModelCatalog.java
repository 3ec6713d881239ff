package com.pitchforge.providers;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered model list of a single provider. Declaration order is the tie-break
 * for every lookup.
 */
public record ModelCatalog(
    String providerId,
    String defaultModel,
    String fallbackModel,
    List<ProviderDescriptor> models
) {
    public static final String TAG_FAST = "fast";
    public static final String TAG_COST_EFFECTIVE = "cost-effective";
    public static final String TAG_COMPLEX = "complex";

    public ModelCatalog {
        models = List.copyOf(models);
        if (models.isEmpty()) {
            throw new IllegalStateException("Provider " + providerId + " declares no models");
        }
        if (models.stream().noneMatch(m -> m.modelId().equals(defaultModel))) {
            throw new IllegalStateException(
                    "Default model " + defaultModel + " of provider " + providerId + " is not in its catalog");
        }
    }

    public Optional<ProviderDescriptor> find(String modelId) {
        return models.stream().filter(m -> m.modelId().equals(modelId)).findFirst();
    }

    public ProviderDescriptor defaultDescriptor() {
        return find(defaultModel).orElseThrow();
    }

    /** Catalog entry for the id, or the default model's settings under that id. */
    public ProviderDescriptor resolve(String modelId) {
        return find(modelId).orElseGet(() -> defaultDescriptor().withModel(modelId));
    }

    public Optional<ProviderDescriptor> fallbackDescriptor() {
        if (fallbackModel == null || fallbackModel.isBlank()) return Optional.empty();
        return Optional.of(resolve(fallbackModel));
    }

    /**
     * First model suited to the tag. "fast" also accepts "cost-effective".
     */
    public Optional<ProviderDescriptor> bestFor(String tag) {
        if (TAG_FAST.equals(tag)) {
            return models.stream().filter(m -> m.hasAnyTag(TAG_FAST, TAG_COST_EFFECTIVE)).findFirst();
        }
        return models.stream().filter(m -> m.hasAnyTag(tag)).findFirst();
    }

    /**
     * Cheapest model other than {@code excludedModelId}: fast/cost-effective ones
     * first, then fewest output tokens. Empty when the catalog has no other model.
     */
    public Optional<ProviderDescriptor> smallestExcept(String excludedModelId) {
        var others = models.stream().filter(m -> !m.modelId().equals(excludedModelId)).toList();
        var fast = others.stream().filter(m -> m.hasAnyTag(TAG_FAST, TAG_COST_EFFECTIVE)).toList();
        var pool = fast.isEmpty() ? others : fast;
        // min() keeps the first of equal elements, so declaration order breaks ties
        return pool.stream().min(Comparator.comparingInt(ProviderDescriptor::maxOutputTokens));
    }
}
