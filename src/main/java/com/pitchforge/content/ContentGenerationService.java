package com.pitchforge.content;

import com.pitchforge.cache.CacheStats;
import com.pitchforge.cache.GenerationCache;
import com.pitchforge.observability.UsageMetric;
import com.pitchforge.observability.UsageMetricsRecorder;
import com.pitchforge.providers.GenerationResult;
import com.pitchforge.providers.ResilientInvoker;
import com.pitchforge.providers.TemplateFallback;
import com.pitchforge.shared.model.ContextHints;
import com.pitchforge.shared.model.GenerationRequest;
import com.pitchforge.shared.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for content producers. Every call returns usable text or throws
 * {@link com.pitchforge.providers.TerminalGenerationException}.
 *
 * <p>{@link #submit} runs the generation on one of a fixed number of worker
 * threads, queueing beyond that; cancelling the
 * returned future interrupts the in-flight provider call and the request
 * finishes on its template.
 */
public class ContentGenerationService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ContentGenerationService.class);

    private final ResilientInvoker invoker;
    private final GenerationCache cache;
    private final UsageMetricsRecorder metrics;
    private final ExecutorService executor;

    public ContentGenerationService(ResilientInvoker invoker, GenerationCache cache,
                                    UsageMetricsRecorder metrics, int workerThreads) {
        this.invoker = invoker;
        this.cache = cache;
        this.metrics = metrics;
        this.executor = Executors.newFixedThreadPool(workerThreads, new WorkerFactory());
    }

    public String generate(String prompt, TaskKind task, ContextHints hints, TemplateFallback template) {
        return generateDetailed(new GenerationRequest(prompt, task, hints), template).text();
    }

    public GenerationResult generateDetailed(GenerationRequest request, TemplateFallback template) {
        var result = invoker.invoke(request, template);
        log.debug("Task {} served by {} ({} provider calls)",
                request.taskKind().id(), result.source(), result.attempts());
        return result;
    }

    public Future<String> submit(String prompt, TaskKind task, ContextHints hints, TemplateFallback template) {
        return executor.submit(() -> generate(prompt, task, hints, template));
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public void clearCache() {
        log.info("Clearing generation cache ({} entries)", cache.size());
        cache.clear();
    }

    public UsageMetric usage() {
        return metrics.currentSnapshot();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static final class WorkerFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            var t = new Thread(r, "generation-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
