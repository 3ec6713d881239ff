package com.pitchforge.content;

import com.pitchforge.cache.GenerationCache;
import com.pitchforge.observability.UsageMetricsRecorder;
import com.pitchforge.providers.ErrorKind;
import com.pitchforge.providers.Fixtures;
import com.pitchforge.providers.ProviderAdapter;
import com.pitchforge.providers.ProviderDescriptor;
import com.pitchforge.providers.ProviderException;
import com.pitchforge.providers.ProviderSelector;
import com.pitchforge.providers.ResilientInvoker;
import com.pitchforge.providers.TerminalGenerationException;
import com.pitchforge.shared.config.InvokerConfig;
import com.pitchforge.shared.config.RoutingConfig;
import com.pitchforge.shared.model.ContextHints;
import com.pitchforge.shared.model.TaskKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ContentGenerationServiceTest {

    private static final String PROFILE_TEXT =
            "Dana, your talk on platform reliability at KubeCon stuck with me long after the session ended.";

    @TempDir
    Path tempDir;

    private ContentGenerationService service;

    @AfterEach
    void tearDown() {
        if (service != null) service.close();
    }

    private ContentGenerationService service(ProviderAdapter anthropic) {
        return service(anthropic, 1);
    }

    private ContentGenerationService service(ProviderAdapter anthropic, int workers) {
        var cache = new GenerationCache(Duration.ofHours(24));
        var metrics = new UsageMetricsRecorder(tempDir.resolve("usage.json"));
        var selector = new ProviderSelector(List.of(Fixtures.anthropic()), RoutingConfig.defaults(), 2000);
        var invoker = new ResilientInvoker(selector, Map.of("anthropic", anthropic), cache, metrics,
                InvokerConfig.defaults());
        service = new ContentGenerationService(invoker, cache, metrics, workers);
        return service;
    }

    private static ProviderAdapter adapter() {
        var adapter = mock(ProviderAdapter.class);
        when(adapter.id()).thenReturn("anthropic");
        when(adapter.fallbackFor(any(), any())).thenReturn(Optional.empty());
        return adapter;
    }

    @Test
    void generateReturnsProviderText() {
        var anthropic = adapter();
        when(anthropic.generate(anyString(), any(ProviderDescriptor.class), any())).thenReturn(PROFILE_TEXT);
        var svc = service(anthropic);

        var text = svc.generate("Profile: Dana", TaskKind.PROFILE_CONTENT, ContextHints.none(), r -> "template");

        assertEquals(PROFILE_TEXT, text);
        assertEquals(1, svc.usage().totalRequests());
        assertEquals(1, svc.cacheStats().saves());
    }

    @Test
    void clearCacheForcesANewProviderCall() {
        var anthropic = adapter();
        when(anthropic.generate(anyString(), any(ProviderDescriptor.class), any())).thenReturn(PROFILE_TEXT);
        var svc = service(anthropic);

        svc.generate("Profile: Dana", TaskKind.PROFILE_CONTENT, ContextHints.none(), r -> "template");
        svc.generate("Profile: Dana", TaskKind.PROFILE_CONTENT, ContextHints.none(), r -> "template");
        verify(anthropic, times(1)).generate(anyString(), any(ProviderDescriptor.class), any());

        svc.clearCache();
        svc.generate("Profile: Dana", TaskKind.PROFILE_CONTENT, ContextHints.none(), r -> "template");

        verify(anthropic, times(2)).generate(anyString(), any(ProviderDescriptor.class), any());
        assertEquals(1, svc.cacheStats().hits());
    }

    @Test
    void providerErrorsNeverReachTheCaller() {
        var anthropic = adapter();
        when(anthropic.generate(anyString(), any(ProviderDescriptor.class), any()))
                .thenThrow(new ProviderException(ErrorKind.AUTH_INVALID, "anthropic", "claude-3-opus-20240229",
                        401, "invalid x-api-key"));
        var svc = service(anthropic);

        var text = svc.generate("Profile: Dana", TaskKind.PROFILE_CONTENT, ContextHints.none(),
                r -> "Hi " + r.taskKind().id());

        assertEquals("Hi profileContent", text);
    }

    @Test
    void submittedRequestRunsOnWorker() throws Exception {
        var anthropic = adapter();
        when(anthropic.generate(anyString(), any(ProviderDescriptor.class), any())).thenReturn(PROFILE_TEXT);
        var svc = service(anthropic);

        var future = svc.submit("Profile: Dana", TaskKind.WARM_FOLLOWUP, ContextHints.none(), r -> "template");

        assertEquals(PROFILE_TEXT, future.get(5, TimeUnit.SECONDS));
    }

    @Test
    void submittedRequestsNeverExceedWorkerCount() throws Exception {
        var active = new AtomicInteger();
        var peak = new AtomicInteger();
        var anthropic = adapter();
        when(anthropic.generate(anyString(), any(ProviderDescriptor.class), any())).thenAnswer(inv -> {
            peak.accumulateAndGet(active.incrementAndGet(), Math::max);
            Thread.sleep(50);
            active.decrementAndGet();
            return PROFILE_TEXT;
        });
        var svc = service(anthropic, 2);

        var futures = new ArrayList<Future<String>>();
        for (int i = 0; i < 6; i++) {
            futures.add(svc.submit("Profile " + i + ": Dana", TaskKind.WARM_FOLLOWUP, ContextHints.none(),
                    r -> "template"));
        }
        for (var future : futures) {
            assertEquals(PROFILE_TEXT, future.get(5, TimeUnit.SECONDS));
        }

        assertTrue(peak.get() <= 2, "peak concurrency " + peak.get());
    }

    @Test
    void cancellingInterruptsTheProviderCall() throws Exception {
        var started = new CountDownLatch(1);
        var templateUsed = new CountDownLatch(1);
        var anthropic = adapter();
        when(anthropic.generate(anyString(), any(ProviderDescriptor.class), any())).thenAnswer(inv -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("interrupted");
            }
            return PROFILE_TEXT;
        });
        var svc = service(anthropic);

        var future = svc.submit("Profile: Dana", TaskKind.PROFILE_CONTENT, ContextHints.none(), r -> {
            templateUsed.countDown();
            return "template";
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        future.cancel(true);

        assertTrue(templateUsed.await(5, TimeUnit.SECONDS));
        assertTrue(future.isCancelled());
        verify(anthropic, times(1)).generate(anyString(), eq(Fixtures.anthropic().catalog().defaultDescriptor()), any());
    }

    @Test
    void terminalFailureSurfacesThroughFuture() {
        var anthropic = adapter();
        when(anthropic.generate(anyString(), any(ProviderDescriptor.class), any()))
                .thenThrow(new ProviderException(ErrorKind.TRANSIENT, "anthropic", "m", 503, "unavailable"));
        var svc = service(anthropic);

        var future = svc.submit("Profile: Dana", TaskKind.PROFILE_CONTENT, ContextHints.none(), null);

        var ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TerminalGenerationException.class, ex.getCause());
    }
}
