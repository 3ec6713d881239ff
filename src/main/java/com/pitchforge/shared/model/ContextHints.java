package com.pitchforge.shared.model;

/**
 * Routing hints supplied with a request. Overrides are null when absent.
 */
public record ContextHints(
    int contentLength,
    String modelOverride,
    String providerOverride
) {
    public static ContextHints none() {
        return new ContextHints(0, null, null);
    }

    public static ContextHints ofLength(int contentLength) {
        return new ContextHints(contentLength, null, null);
    }

    public static ContextHints override(String providerId, String modelId) {
        return new ContextHints(0, modelId, providerId);
    }

    public boolean hasOverride() {
        return !isBlank(modelOverride) || !isBlank(providerOverride);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
