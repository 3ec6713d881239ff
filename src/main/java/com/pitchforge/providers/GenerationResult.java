package com.pitchforge.providers;

/**
 * Outcome of one invocation. {@code source} is the metrics label that served
 * the text: "cache", a provider id, or "template".
 */
public record GenerationResult(
    String text,
    String source,
    String modelId,
    boolean fromCache,
    int attempts
) {
    public static final String CACHE = "cache";
    public static final String TEMPLATE = "template";

    static GenerationResult cached(String text) {
        return new GenerationResult(text, CACHE, null, true, 0);
    }

    static GenerationResult served(String text, ProviderDescriptor model, int attempts) {
        return new GenerationResult(text, model.providerId(), model.modelId(), false, attempts);
    }

    static GenerationResult template(String text, int attempts) {
        return new GenerationResult(text, TEMPLATE, null, false, attempts);
    }

    public boolean fromTemplate() {
        return TEMPLATE.equals(source);
    }
}
