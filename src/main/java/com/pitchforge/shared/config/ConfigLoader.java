package com.pitchforge.shared.config;

import com.pitchforge.providers.ModelCatalog;
import com.pitchforge.providers.ProviderDescriptor;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".pitchforge", "config.yaml"
    );
    private static final String DEFAULT_MODELS = "/default-models.yaml";
    private static final Set<String> KNOWN_TYPES = Set.of("anthropic", "openai", "ollama");

    public static PitchForgeConfig load() {
        var override = System.getenv("PITCHFORGE_CONFIG");
        return load(override != null && !override.isBlank() ? Path.of(override) : DEFAULT_PATH);
    }

    public static PitchForgeConfig load(Path path) {
        return load(path, System.getenv());
    }

    public static PitchForgeConfig load(Path path, Map<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = parse(in, path.toString());
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }
        Map<String, Object> defaults;
        try (var in = ConfigLoader.class.getResourceAsStream(DEFAULT_MODELS)) {
            if (in == null) throw new IllegalStateException("Missing classpath resource " + DEFAULT_MODELS);
            defaults = parse(in, DEFAULT_MODELS);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + DEFAULT_MODELS, e);
        }

        var keys = section(raw, "api-keys", "api-keys");
        var providers = parseProviders(section(defaults, "providers", "providers"),
                section(raw, "providers", "providers"), keys, env);
        var routing = parseRouting(section(raw, "routing", "routing"), providers);
        var cache = section(raw, "cache", "cache");
        var generation = section(raw, "generation", "generation");
        var metrics = section(raw, "metrics", "metrics");

        var genDefaults = InvokerConfig.defaults();
        var ttlHours = Double.parseDouble(String.valueOf(
                cache.getOrDefault("ttl-hours", CacheConfig.defaults().ttl().toHours())));
        if (ttlHours <= 0) throw new IllegalStateException("cache.ttl-hours must be positive: " + ttlHours);

        return new PitchForgeConfig(
            providers,
            routing,
            new CacheConfig(Duration.ofMillis((long) (ttlHours * 3_600_000))),
            new InvokerConfig(
                intValue(generation, "min-output-length", genDefaults.minOutputLength()),
                Long.parseLong(String.valueOf(
                        generation.getOrDefault("rate-limit-backoff-ms", genDefaults.rateLimitBackoffMs()))),
                intValue(generation, "long-form-threshold", genDefaults.longFormThreshold()),
                intValue(generation, "worker-threads", genDefaults.workerThreads())
            ),
            Path.of(envOrDefault(env, "PITCHFORGE_METRICS_FILE",
                String.valueOf(metrics.getOrDefault("file", "logs/llm_usage_metrics.json"))))
        );
    }

    private static Map<String, ProviderConfig> parseProviders(Map<String, Object> defaults,
                                                              Map<String, Object> overrides,
                                                              Map<String, Object> keys,
                                                              Map<String, String> env) {
        var ids = new LinkedHashSet<>(defaults.keySet());
        ids.addAll(overrides.keySet());
        var result = new LinkedHashMap<String, ProviderConfig>();
        for (var id : ids) {
            var merged = new LinkedHashMap<>(section(defaults, id, "providers." + id));
            merged.putAll(section(overrides, id, "providers." + id));
            result.put(id, parseProvider(id, merged, keys, env));
        }
        return Collections.unmodifiableMap(result);
    }

    private static ProviderConfig parseProvider(String id, Map<String, Object> p,
                                                Map<String, Object> keys, Map<String, String> env) {
        var type = String.valueOf(p.getOrDefault("type", id));
        if (!KNOWN_TYPES.contains(type)) {
            throw new IllegalStateException("providers." + id + ".type must be one of " + KNOWN_TYPES + ": " + type);
        }
        var envPrefix = id.toUpperCase(Locale.ROOT).replace('-', '_');

        var apiKey = envOrDefault(env, envPrefix + "_API_KEY", null);
        if (apiKey == null && "openai".equals(id)) {
            apiKey = env.get("OPENAPI_KEY");
        }
        if (apiKey == null) {
            var configured = keys.containsKey(id) ? keys.get(id) : p.get("api-key");
            apiKey = configured != null ? String.valueOf(configured) : "";
        }

        var envModel = envOrDefault(env, envPrefix + "_MODEL", null);
        var defaultModel = envModel != null ? envModel : (String) p.get("default-model");
        if (defaultModel == null || defaultModel.isBlank()) {
            throw new IllegalStateException("providers." + id + ".default-model is required");
        }
        var models = parseModels(id, p.get("models"));
        if (envModel != null && !models.isEmpty()
                && models.stream().noneMatch(m -> m.modelId().equals(envModel))) {
            // a model picked through the environment inherits the first model's settings
            models.add(models.get(0).withModel(envModel));
        }
        var catalog = new ModelCatalog(id, defaultModel, (String) p.get("fallback-model"), models);

        var explicit = p.get("enabled");
        boolean enabled;
        if ("ollama".equals(type)) {
            enabled = Boolean.TRUE.equals(explicit);
        } else {
            enabled = !Boolean.FALSE.equals(explicit) && !apiKey.isBlank();
        }

        return new ProviderConfig(
            id,
            type,
            enabled ? ProviderConfig.Status.ENABLED : ProviderConfig.Status.DISABLED,
            apiKey,
            String.valueOf(p.getOrDefault("base-url", "")),
            intValue(p, "timeout", 30),
            catalog
        );
    }

    @SuppressWarnings("unchecked")
    private static List<ProviderDescriptor> parseModels(String providerId, Object raw) {
        var models = new ArrayList<ProviderDescriptor>();
        if (raw == null) return models;
        if (!(raw instanceof List)) {
            throw new IllegalStateException("providers." + providerId + ".models must be a list");
        }
        for (var item : (List<Object>) raw) {
            if (!(item instanceof Map)) {
                throw new IllegalStateException("providers." + providerId + ".models entries must be mappings");
            }
            var m = (Map<String, Object>) item;
            var modelId = m.get("id");
            if (modelId == null) {
                throw new IllegalStateException("providers." + providerId + ".models entry without id");
            }
            var rawTags = m.getOrDefault("tags", List.of());
            if (!(rawTags instanceof List)) {
                throw new IllegalStateException("providers." + providerId + ".models[].tags must be a list");
            }
            var tags = new LinkedHashSet<String>();
            for (var tag : (List<Object>) rawTags) {
                tags.add(String.valueOf(tag));
            }
            models.add(new ProviderDescriptor(
                providerId,
                String.valueOf(modelId),
                intValue(m, "max-tokens", 2000),
                Double.parseDouble(String.valueOf(m.getOrDefault("temperature", 0.7))),
                tags
            ));
        }
        return models;
    }

    private static RoutingConfig parseRouting(Map<String, Object> routing, Map<String, ProviderConfig> providers) {
        var defaults = RoutingConfig.defaults();
        var longForm = String.valueOf(routing.getOrDefault("long-form", defaults.longFormProvider()));
        var structured = String.valueOf(routing.getOrDefault("structured", defaults.structuredProvider()));
        var local = routing.containsKey("local")
                ? (String) routing.get("local")
                : defaults.localProvider();
        for (var ref : List.of(longForm, structured)) {
            if (!providers.containsKey(ref)) {
                throw new IllegalStateException("routing refers to unknown provider: " + ref);
            }
        }
        if (local != null && !local.isBlank() && !providers.containsKey(local)) {
            throw new IllegalStateException("routing.local refers to unknown provider: " + local);
        }
        return new RoutingConfig(longForm, structured, local);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(InputStream in, String source) {
        Object loaded = new Yaml().load(in);
        if (loaded == null) return Map.of();
        if (!(loaded instanceof Map)) {
            throw new IllegalStateException("Config root must be a mapping: " + source);
        }
        return (Map<String, Object>) loaded;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> parent, String key, String path) {
        var value = parent.get(key);
        if (value == null) return Map.of();
        if (!(value instanceof Map)) {
            throw new IllegalStateException("Expected a mapping at " + path);
        }
        return (Map<String, Object>) value;
    }

    private static int intValue(Map<String, Object> map, String key, int fallback) {
        return Integer.parseInt(String.valueOf(map.getOrDefault(key, fallback)));
    }

    private static String envOrDefault(Map<String, String> env, String name, String fallback) {
        var val = env.get(name);
        return val != null && !val.isBlank() ? val : fallback;
    }
}
