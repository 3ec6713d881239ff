package com.pitchforge.shared.config;

/**
 * Preferred provider per routing class, plus the local generator that closes the chain.
 */
public record RoutingConfig(
    String longFormProvider,
    String structuredProvider,
    String localProvider
) {
    public static RoutingConfig defaults() {
        return new RoutingConfig("anthropic", "openai", "ollama");
    }
}
