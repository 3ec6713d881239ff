package com.pitchforge.gateway;

import com.pitchforge.cache.GenerationCache;
import com.pitchforge.content.ContentGenerationService;
import com.pitchforge.observability.DoctorCommand;
import com.pitchforge.observability.MetricsConfig;
import com.pitchforge.observability.UsageMetricsRecorder;
import com.pitchforge.providers.ProviderAdapters;
import com.pitchforge.providers.ProviderSelector;
import com.pitchforge.providers.ResilientInvoker;
import com.pitchforge.shared.config.ConfigLoader;
import com.pitchforge.shared.config.PitchForgeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the generation core from {@code ~/.pitchforge/config.yaml}. Every
 * collaborator is a single instance shared by all requests.
 */
@Configuration
public class CoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CoreConfiguration.class);

    @Bean
    public PitchForgeConfig pitchForgeConfig() {
        var config = ConfigLoader.load();
        if (config.enabledProviders().isEmpty()) {
            log.warn("No provider enabled. Set ANTHROPIC_API_KEY or OPENAI_API_KEY, "
                    + "or enable ollama in ~/.pitchforge/config.yaml; every request will use its template");
        }
        return config;
    }

    @Bean
    public MetricsConfig metricsConfig() {
        return new MetricsConfig();
    }

    @Bean
    public GenerationCache generationCache(PitchForgeConfig config) {
        return new GenerationCache(config.cache().ttl());
    }

    @Bean
    public UsageMetricsRecorder usageMetricsRecorder(PitchForgeConfig config, MetricsConfig meters) {
        return new UsageMetricsRecorder(config.metricsFile(), meters);
    }

    @Bean
    public ProviderSelector providerSelector(PitchForgeConfig config) {
        return new ProviderSelector(config.providers().values(), config.routing(),
                config.generation().longFormThreshold());
    }

    @Bean
    public ResilientInvoker resilientInvoker(PitchForgeConfig config, ProviderSelector selector,
                                             GenerationCache cache, UsageMetricsRecorder recorder) {
        return new ResilientInvoker(selector, ProviderAdapters.fromConfig(config), cache, recorder,
                config.generation());
    }

    @Bean(destroyMethod = "close")
    public ContentGenerationService contentGenerationService(PitchForgeConfig config, ResilientInvoker invoker,
                                                             GenerationCache cache, UsageMetricsRecorder recorder) {
        return new ContentGenerationService(invoker, cache, recorder, config.generation().workerThreads());
    }

    @Bean
    public DoctorCommand doctorCommand(PitchForgeConfig config) {
        return new DoctorCommand(config);
    }
}
