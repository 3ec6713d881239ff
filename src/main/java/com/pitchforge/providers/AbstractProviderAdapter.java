package com.pitchforge.providers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pitchforge.shared.config.ProviderConfig;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * HTTP plumbing and in-provider fallback policy shared by the adapters.
 */
public abstract class AbstractProviderAdapter implements ProviderAdapter {

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    protected final ProviderConfig config;
    protected final ModelCatalog catalog;
    protected final String baseUrl;
    protected final Duration timeout;
    private final HttpClient httpClient;

    protected AbstractProviderAdapter(ProviderConfig config, HttpClient httpClient) {
        this.config = config;
        this.catalog = config.catalog();
        this.baseUrl = config.baseUrl().replaceAll("/+$", "");
        this.timeout = Duration.ofSeconds(config.timeoutSeconds());
        this.httpClient = httpClient;
    }

    protected static HttpClient defaultClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String id() {
        return config.id();
    }

    @Override
    public Optional<ProviderDescriptor> fallbackFor(ProviderDescriptor failed, ErrorKind kind) {
        Optional<ProviderDescriptor> candidate;
        if (kind == ErrorKind.RATE_LIMITED) {
            candidate = catalog.smallestExcept(failed.modelId());
        } else if (kind == ErrorKind.MODEL_NOT_FOUND) {
            candidate = modelNotFoundFallback(failed);
        } else {
            candidate = Optional.empty();
        }
        return candidate.filter(d -> !d.modelId().equals(failed.modelId()));
    }

    /** Replacement for a model the service does not know. */
    protected Optional<ProviderDescriptor> modelNotFoundFallback(ProviderDescriptor failed) {
        return catalog.fallbackDescriptor();
    }

    /** Provider-specific classification; the default relies on status and message text. */
    protected ErrorKind classify(int status, String body) {
        return ErrorClassifier.classify(status, body);
    }

    protected HttpResponse<String> send(HttpRequest request, ProviderDescriptor model) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderException(ErrorKind.TRANSIENT, id(), model.modelId(), 0,
                    "timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new ProviderException(ErrorKind.TRANSIENT, id(), model.modelId(), 0,
                    "I/O error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            var cancelled = new CancellationException("Call to " + model.label() + " interrupted");
            cancelled.initCause(e);
            throw cancelled;
        }
    }

    protected ProviderException failure(HttpResponse<String> response, ProviderDescriptor model) {
        var body = response.body();
        var kind = classify(response.statusCode(), body);
        return new ProviderException(kind, id(), model.modelId(), response.statusCode(),
                "HTTP " + response.statusCode() + ": " + truncate(body, 300));
    }

    protected ProviderException malformed(ProviderDescriptor model, String detail, Throwable cause) {
        return new ProviderException(ErrorKind.TRANSIENT, id(), model.modelId(), 200, detail, cause);
    }

    protected static String truncate(String value, int max) {
        if (value == null) return "";
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }
}
