package com.pitchforge.observability;

import com.pitchforge.providers.Fixtures;
import com.pitchforge.shared.config.CacheConfig;
import com.pitchforge.shared.config.InvokerConfig;
import com.pitchforge.shared.config.PitchForgeConfig;
import com.pitchforge.shared.config.ProviderConfig;
import com.pitchforge.shared.config.RoutingConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DoctorCommandTest {

    @TempDir
    Path tempDir;

    private PitchForgeConfig config(ProviderConfig... providers) {
        var map = new LinkedHashMap<String, ProviderConfig>();
        for (var p : providers) map.put(p.id(), p);
        return new PitchForgeConfig(map, RoutingConfig.defaults(), CacheConfig.defaults(),
                InvokerConfig.defaults(), tempDir.resolve("usage.json"));
    }

    @Test
    void reportsEnabledAndDisabledProviders() {
        var anthropicOff = Fixtures.provider("anthropic", "anthropic", false,
                Fixtures.model("anthropic", "claude-3-opus-20240229", 4000));
        var client = mock(HttpClient.class);

        var result = new DoctorCommand(config(anthropicOff, Fixtures.openai()), client).run();

        assertTrue(result.contains("[WARN] anthropic (claude-3-opus-20240229): disabled"));
        assertTrue(result.contains("[OK] openai (gpt-4o-mini): credential configured"));
        assertTrue(result.contains("[OK] Java"));
        verifyNoInteractions(client);
    }

    @Test
    @SuppressWarnings("unchecked")
    void probesEnabledLocalProvider() throws Exception {
        HttpResponse<Void> resp = mock(HttpResponse.class);
        when(resp.statusCode()).thenReturn(200);
        var client = mock(HttpClient.class);
        doReturn(resp).when(client).send(any(HttpRequest.class), any());

        var result = new DoctorCommand(config(Fixtures.ollama(true)), client).run();

        assertTrue(result.contains("[OK] ollama (qwen3:4b): endpoint reachable"));
    }

    @Test
    void reportsUnreachableLocalProvider() throws Exception {
        var client = mock(HttpClient.class);
        doThrow(new ConnectException("Connection refused")).when(client).send(any(HttpRequest.class), any());

        var result = new DoctorCommand(config(Fixtures.ollama(true)), client).run();

        assertTrue(result.contains("[FAIL] ollama (qwen3:4b): Connection refused"));
    }

    @Test
    void reportsMetricsFileState() throws IOException {
        var client = mock(HttpClient.class);
        var doctor = new DoctorCommand(config(Fixtures.openai()), client);

        assertTrue(doctor.run().contains("[WARN] Usage metrics file not found"));

        Files.writeString(tempDir.resolve("usage.json"), "{}");
        assertTrue(doctor.run().contains("[OK] Usage metrics file"));
    }
}
