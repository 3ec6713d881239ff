package com.pitchforge.providers;

import java.util.Optional;

/**
 * One backing generation service. Implementations are safe for concurrent use.
 */
public interface ProviderAdapter {

    String id();

    /**
     * Runs a single generation call.
     *
     * @throws ProviderException classified failure of the call
     * @throws java.util.concurrent.CancellationException if the calling thread was interrupted
     */
    String generate(String prompt, ProviderDescriptor model, String systemPrompt);

    /**
     * Alternate model of this provider to retry with after {@code kind}, if any.
     * Never returns the failed model itself.
     */
    Optional<ProviderDescriptor> fallbackFor(ProviderDescriptor failed, ErrorKind kind);
}
