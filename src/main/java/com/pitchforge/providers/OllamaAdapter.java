package com.pitchforge.providers;

import com.pitchforge.shared.config.ProviderConfig;

import java.net.http.HttpClient;

/**
 * Local generator served by an Ollama instance; last provider before the static template.
 */
public class OllamaAdapter extends OpenAiCompatibleAdapter {

    public OllamaAdapter(ProviderConfig config) {
        this(config, defaultClient());
    }

    public OllamaAdapter(ProviderConfig config, HttpClient httpClient) {
        super(config, httpClient);
    }

    /** Ollama answers an unknown model with 404 and a "not found" message, never with auth errors. */
    @Override
    protected ErrorKind classify(int status, String body) {
        if (status == 404 || (body != null && body.contains("not found"))) {
            return ErrorKind.MODEL_NOT_FOUND;
        }
        return ErrorKind.TRANSIENT;
    }
}
