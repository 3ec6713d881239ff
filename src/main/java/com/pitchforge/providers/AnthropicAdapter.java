package com.pitchforge.providers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.pitchforge.shared.config.ProviderConfig;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the Anthropic Messages API.
 */
public class AnthropicAdapter extends AbstractProviderAdapter {

    private static final String ANTHROPIC_VERSION = "2023-06-01";

    public AnthropicAdapter(ProviderConfig config) {
        this(config, defaultClient());
    }

    public AnthropicAdapter(ProviderConfig config, HttpClient httpClient) {
        super(config, httpClient);
    }

    @Override
    public String generate(String prompt, ProviderDescriptor model, String systemPrompt) {
        var body = new LinkedHashMap<String, Object>();
        body.put("model", model.modelId());
        body.put("max_tokens", model.maxOutputTokens());
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        body.put("temperature", model.temperature());
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            body.put("system", systemPrompt);
        }

        String json;
        try {
            json = MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable request for " + model.label(), e);
        }

        var request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v1/messages"))
                .header("Content-Type", "application/json")
                .header("x-api-key", config.apiKey())
                .header("anthropic-version", ANTHROPIC_VERSION)
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();

        var resp = send(request, model);
        if (resp.statusCode() != 200) {
            throw failure(resp, model);
        }
        return parseContent(resp.body(), model);
    }

    private String parseContent(String body, ProviderDescriptor model) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw malformed(model, "unparseable message body", e);
        }
        var text = new StringBuilder();
        for (var block : root.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText(""));
            }
        }
        if (text.toString().isBlank()) {
            throw malformed(model, "message without text content", null);
        }
        return text.toString().trim();
    }

    /**
     * Error bodies look like {@code {"type":"error","error":{"type":"rate_limit_error",...}}}.
     * 529 (overloaded) stays transient: a smaller model on the same saturated service rarely helps.
     */
    @Override
    protected ErrorKind classify(int status, String body) {
        var type = errorType(body);
        if (type != null) {
            if ("not_found_error".equals(type)) return ErrorKind.MODEL_NOT_FOUND;
            if ("rate_limit_error".equals(type)) return ErrorKind.RATE_LIMITED;
            if ("authentication_error".equals(type) || "permission_error".equals(type)) {
                return ErrorKind.AUTH_INVALID;
            }
            if ("overloaded_error".equals(type) || "api_error".equals(type)) return ErrorKind.TRANSIENT;
        }
        return super.classify(status, body);
    }

    /** A dated model id falls back to the "-latest" alias of its family when catalogued. */
    @Override
    protected Optional<ProviderDescriptor> modelNotFoundFallback(ProviderDescriptor failed) {
        var model = failed.modelId();
        int dated = model.indexOf("-20");
        if (dated > 0) {
            var alias = catalog.find(model.substring(0, dated) + "-latest");
            if (alias.isPresent()) return alias;
        }
        return catalog.fallbackDescriptor();
    }

    private static String errorType(String body) {
        if (body == null || !body.trim().startsWith("{")) return null;
        try {
            return MAPPER.readTree(body).path("error").path("type").asText(null);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
