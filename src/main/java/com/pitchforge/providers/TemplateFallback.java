package com.pitchforge.providers;

import com.pitchforge.shared.model.GenerationRequest;

/**
 * Caller-supplied deterministic text used once every provider has failed.
 */
@FunctionalInterface
public interface TemplateFallback {
    String render(GenerationRequest request);
}
