package com.pitchforge.providers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.pitchforge.shared.config.ProviderConfig;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client for services speaking the OpenAI wire format.
 */
public abstract class OpenAiCompatibleAdapter extends AbstractProviderAdapter {

    private static final double TOP_P = 0.9;

    protected OpenAiCompatibleAdapter(ProviderConfig config, HttpClient httpClient) {
        super(config, httpClient);
    }

    @Override
    public String generate(String prompt, ProviderDescriptor model, String systemPrompt) {
        String json;
        try {
            json = MAPPER.writeValueAsString(requestBody(prompt, model, systemPrompt));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable request for " + model.label(), e);
        }

        var builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .header("Content-Type", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(json));
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + config.apiKey());
        }

        var resp = send(builder.build(), model);
        if (resp.statusCode() != 200) {
            throw failure(resp, model);
        }
        return parseContent(resp.body(), model);
    }

    private Map<String, Object> requestBody(String prompt, ProviderDescriptor model, String systemPrompt) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(Map.of("role", "system", "content", systemPrompt));
        }
        messages.add(Map.of("role", "user", "content", prompt));

        var body = new LinkedHashMap<String, Object>();
        body.put("model", model.modelId());
        body.put("messages", messages);
        body.put("temperature", model.temperature());
        body.put("max_tokens", model.maxOutputTokens());
        body.put("top_p", TOP_P);
        return body;
    }

    private String parseContent(String body, ProviderDescriptor model) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw malformed(model, "unparseable completion body", e);
        }
        var content = root.path("choices").path(0).path("message").path("content").asText("");
        if (content.isBlank()) {
            throw malformed(model, "completion without content", null);
        }
        return content.trim();
    }

    @Override
    protected ErrorKind classify(int status, String body) {
        var code = errorCode(body);
        if ("model_not_found".equals(code)) return ErrorKind.MODEL_NOT_FOUND;
        if ("rate_limit_exceeded".equals(code) || "insufficient_quota".equals(code)) return ErrorKind.RATE_LIMITED;
        if ("invalid_api_key".equals(code)) return ErrorKind.AUTH_INVALID;
        return super.classify(status, body);
    }

    /** {@code error.code}, or {@code error.type} when the code is absent; null for non-JSON bodies. */
    private static String errorCode(String body) {
        if (body == null || !body.trim().startsWith("{")) return null;
        try {
            var error = MAPPER.readTree(body).path("error");
            var code = error.path("code").asText(null);
            return code != null ? code : error.path("type").asText(null);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
