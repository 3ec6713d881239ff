package com.pitchforge.observability;

import com.pitchforge.shared.config.PitchForgeConfig;
import com.pitchforge.shared.config.ProviderConfig;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;

public class DoctorCommand {

    private final PitchForgeConfig config;
    private final HttpClient client;

    public DoctorCommand(PitchForgeConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build());
    }

    public DoctorCommand(PitchForgeConfig config, HttpClient client) {
        this.config = config;
        this.client = client;
    }

    public String run() {
        var results = new ArrayList<String>();
        for (var provider : config.providers().values()) {
            results.add(checkProvider(provider));
        }
        results.add(checkMetricsFile());
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private String checkProvider(ProviderConfig provider) {
        var label = provider.id() + " (" + provider.catalog().defaultModel() + ")";
        if (!provider.enabled()) {
            return "[WARN] " + label + ": disabled";
        }
        // local endpoints can be probed without spending tokens
        if ("ollama".equals(provider.type())) {
            return checkEndpoint(label, provider.baseUrl());
        }
        return "[OK] " + label + ": credential configured";
    }

    private String checkEndpoint(String label, String baseUrl) {
        try {
            var req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/models"))
                    .timeout(Duration.ofSeconds(5))
                    .GET().build();
            var resp = client.send(req, HttpResponse.BodyHandlers.discarding());
            return resp.statusCode() < 500
                    ? "[OK] " + label + ": endpoint reachable"
                    : "[FAIL] " + label + ": HTTP " + resp.statusCode();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "[FAIL] " + label + ": interrupted";
        } catch (Exception e) {
            return "[FAIL] " + label + ": " + e.getMessage();
        }
    }

    private String checkMetricsFile() {
        var file = config.metricsFile().toAbsolutePath();
        if (Files.exists(file)) {
            return Files.isWritable(file)
                    ? "[OK] Usage metrics file " + file
                    : "[FAIL] Usage metrics file not writable: " + file;
        }
        return "[WARN] Usage metrics file not found (will be created on first request): " + file;
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
