package com.pitchforge.providers;

import com.pitchforge.cache.GenerationCache;
import com.pitchforge.observability.UsageMetricsRecorder;
import com.pitchforge.shared.config.InvokerConfig;
import com.pitchforge.shared.model.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

/**
 * Runs one request through the fallback chain: cache, then each ranked provider
 * (with at most one alternate-model retry inside a provider), then the caller's
 * template. Provider errors never escape; only {@link TerminalGenerationException} does.
 *
 * <p>Metrics: a provider that is given up on records one failure under its id,
 * and every request ends with exactly one outcome record labeled "cache", the
 * serving provider id, or "template". Each record carries only the time spent
 * in its own step, so recorded latencies never overlap.
 */
public class ResilientInvoker {

    private static final Logger log = LoggerFactory.getLogger(ResilientInvoker.class);

    private final ProviderSelector selector;
    private final Map<String, ProviderAdapter> adapters;
    private final GenerationCache cache;
    private final UsageMetricsRecorder metrics;
    private final InvokerConfig config;

    public ResilientInvoker(ProviderSelector selector, Map<String, ProviderAdapter> adapters,
                            GenerationCache cache, UsageMetricsRecorder metrics, InvokerConfig config) {
        this.selector = selector;
        this.adapters = Map.copyOf(adapters);
        this.cache = cache;
        this.metrics = metrics;
        this.config = config;
    }

    public GenerationResult invoke(GenerationRequest request, TemplateFallback template) {
        long start = System.nanoTime();
        var task = request.taskKind().id();
        var candidates = selector.selectCandidates(request.taskKind(), request.hints());
        if (candidates.isEmpty()) {
            return fallbackToTemplate(request, template, 0, "no provider configured");
        }

        var partition = candidates.get(0).providerId();
        var cached = cache.get(request.promptText(), partition, task);
        if (cached.isPresent()) {
            log.debug("Cache hit for task {} in partition {}", task, partition);
            metrics.record(GenerationResult.CACHE, task, elapsedMs(start), true);
            return GenerationResult.cached(cached.get());
        }

        int attempts = 0;
        for (int i = 0; i < candidates.size(); i++) {
            var candidate = candidates.get(i);
            if (Thread.currentThread().isInterrupted()) {
                return fallbackToTemplate(request, template, attempts, "cancelled");
            }
            var adapter = adapters.get(candidate.providerId());
            if (adapter == null) {
                log.warn("No adapter for provider {}, skipping", candidate.providerId());
                continue;
            }

            long providerStart = System.nanoTime();
            ProviderOutcome outcome;
            try {
                outcome = callProvider(adapter, candidate, request);
            } catch (CancellationException e) {
                metrics.record(candidate.providerId(), task, elapsedMs(providerStart), false);
                return fallbackToTemplate(request, template, attempts + 1,
                        "cancelled during " + candidate.label());
            }
            attempts += outcome.calls();

            if (outcome.text() != null && outcome.text().length() > config.minOutputLength()) {
                cache.set(request.promptText(), partition, task, outcome.text());
                metrics.record(candidate.providerId(), task, elapsedMs(providerStart), true);
                if (i > 0 || outcome.calls() > 1) {
                    log.info("Recovered via provider={} model={} for task {}",
                            candidate.providerId(), outcome.model().modelId(), task);
                }
                return GenerationResult.served(outcome.text(), outcome.model(), attempts);
            }
            if (outcome.text() != null) {
                log.warn("Provider {} returned {} chars for task {}, not above the {} char minimum",
                        outcome.model().label(), outcome.text().length(), task, config.minOutputLength());
            }
            metrics.record(candidate.providerId(), task, elapsedMs(providerStart), false);
            if (i + 1 < candidates.size()) {
                log.warn("Provider {} failed for task {}, trying {}",
                        candidate.providerId(), task, candidates.get(i + 1).providerId());
            }
        }
        return fallbackToTemplate(request, template, attempts, "all providers failed");
    }

    /**
     * Calls one provider, retrying once with the adapter's alternate model when the
     * error kind allows it. Returns a null text when the provider is exhausted.
     */
    private ProviderOutcome callProvider(ProviderAdapter adapter, ProviderDescriptor model,
                                         GenerationRequest request) {
        ProviderException failure;
        try {
            return new ProviderOutcome(generate(adapter, model, request), model, 1);
        } catch (ProviderException e) {
            failure = e;
        }
        log.warn("Provider {} failed with {}: {}", model.label(), failure.kind(), failure.getMessage());
        if (!failure.kind().retriesInProvider()) {
            return new ProviderOutcome(null, model, 1);
        }

        var alternate = adapter.fallbackFor(model, failure.kind());
        if (alternate.isEmpty()) {
            log.info("Provider {} has no alternate model after {}", adapter.id(), failure.kind());
            return new ProviderOutcome(null, model, 1);
        }
        if (failure.kind() == ErrorKind.RATE_LIMITED) {
            backoff();
        }
        metrics.recordRetry(adapter.id(), failure.kind());
        log.info("Retrying {} with model {} after {}", adapter.id(), alternate.get().modelId(), failure.kind());
        try {
            return new ProviderOutcome(generate(adapter, alternate.get(), request), alternate.get(), 2);
        } catch (ProviderException retryFailure) {
            log.warn("Retry on {} failed with {}: {}", alternate.get().label(),
                    retryFailure.kind(), retryFailure.getMessage());
            return new ProviderOutcome(null, alternate.get(), 2);
        }
    }

    private static String generate(ProviderAdapter adapter, ProviderDescriptor model, GenerationRequest request) {
        return adapter.generate(request.promptText(), model, request.systemPrompt());
    }

    private GenerationResult fallbackToTemplate(GenerationRequest request, TemplateFallback template,
                                                int attempts, String reason) {
        long templateStart = System.nanoTime();
        var task = request.taskKind().id();
        log.warn("Using template for task {}: {}", task, reason);
        try {
            if (template == null) {
                throw new TerminalGenerationException(
                        "No template fallback for task " + task + " (" + reason + ")");
            }
            String text;
            try {
                text = template.render(request);
            } catch (RuntimeException e) {
                throw new TerminalGenerationException("Template fallback failed for task " + task, e);
            }
            if (text == null || text.isBlank()) {
                throw new TerminalGenerationException("Template fallback produced no text for task " + task);
            }
            return GenerationResult.template(text, attempts);
        } finally {
            metrics.record(GenerationResult.TEMPLATE, task, elapsedMs(templateStart), false);
        }
    }

    private void backoff() {
        try {
            Thread.sleep(config.rateLimitBackoffMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            var cancelled = new CancellationException("Interrupted during rate-limit backoff");
            cancelled.initCause(e);
            throw cancelled;
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private record ProviderOutcome(String text, ProviderDescriptor model, int calls) {}
}
