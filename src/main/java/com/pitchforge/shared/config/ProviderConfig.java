package com.pitchforge.shared.config;

import com.pitchforge.providers.ModelCatalog;

/**
 * Startup view of one provider. A provider without a credential is loaded as
 * {@link Status#DISABLED}, never dropped, so the doctor report can list it.
 */
public record ProviderConfig(
    String id,
    String type,
    Status status,
    String apiKey,
    String baseUrl,
    int timeoutSeconds,
    ModelCatalog catalog
) {
    public enum Status { ENABLED, DISABLED }

    public boolean enabled() {
        return status == Status.ENABLED;
    }
}
