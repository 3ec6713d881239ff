package com.pitchforge.providers;

import com.pitchforge.shared.config.ProviderConfig;
import com.pitchforge.shared.config.RoutingConfig;
import com.pitchforge.shared.model.ContextHints;
import com.pitchforge.shared.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks the enabled providers for a task. Each candidate carries the model to
 * use; an empty result means no provider is configured at all.
 */
public class ProviderSelector {

    private static final Logger log = LoggerFactory.getLogger(ProviderSelector.class);

    private final Map<String, ProviderConfig> providers = new LinkedHashMap<>();
    private final RoutingConfig routing;
    private final int longFormThreshold;

    public ProviderSelector(Collection<ProviderConfig> providers, RoutingConfig routing, int longFormThreshold) {
        for (var provider : providers) {
            this.providers.put(provider.id(), provider);
        }
        this.routing = routing;
        this.longFormThreshold = longFormThreshold;
    }

    public List<ProviderDescriptor> selectCandidates(TaskKind task, ContextHints hints) {
        if (hints == null) hints = ContextHints.none();
        if (hints.hasOverride()) {
            var forced = resolveOverride(task, hints);
            if (forced != null) return List.of(forced);
        }

        var longForm = hints.contentLength() > longFormThreshold;
        var routingClass = longForm ? RoutingClass.LONG_FORM : RoutingClass.of(task);
        var tag = preferredTag(task, longForm);

        var candidates = new ArrayList<ProviderDescriptor>();
        for (var id : rankedProviderIds(routingClass)) {
            var provider = providers.get(id);
            if (provider == null || !provider.enabled()) continue;
            candidates.add(modelFor(provider, tag));
        }
        if (candidates.isEmpty()) {
            log.warn("No provider configured for task {}", task.id());
        } else {
            log.debug("Task {} routed {} -> {}", task.id(), routingClass, candidates.get(0).label());
        }
        return candidates;
    }

    /** Preferred provider of the class, other remote providers, then the local generator. */
    private List<String> rankedProviderIds(RoutingClass routingClass) {
        var preferred = routingClass == RoutingClass.LONG_FORM
                ? routing.longFormProvider()
                : routing.structuredProvider();
        var local = routing.localProvider();
        var ids = new ArrayList<String>();
        ids.add(preferred);
        for (var id : providers.keySet()) {
            if (!id.equals(preferred) && !id.equals(local)) ids.add(id);
        }
        if (local != null && !local.isBlank() && !local.equals(preferred)) ids.add(local);
        return ids;
    }

    private static String preferredTag(TaskKind task, boolean longForm) {
        if (longForm) return ModelCatalog.TAG_COMPLEX;
        if (task == TaskKind.MESSAGE_ANALYSIS) return ModelCatalog.TAG_FAST;
        return null;
    }

    private static ProviderDescriptor modelFor(ProviderConfig provider, String tag) {
        var catalog = provider.catalog();
        if (tag == null) return catalog.defaultDescriptor();
        return catalog.bestFor(tag).orElseGet(catalog::defaultDescriptor);
    }

    private ProviderDescriptor resolveOverride(TaskKind task, ContextHints hints) {
        var providerId = hints.providerOverride();
        var modelId = hints.modelOverride();
        var hasModel = modelId != null && !modelId.isBlank();

        if (providerId != null && !providerId.isBlank()) {
            var provider = providers.get(providerId);
            if (provider == null || !provider.enabled()) {
                log.warn("Ignoring override for unavailable provider {}", providerId);
                return null;
            }
            return hasModel ? provider.catalog().resolve(modelId) : provider.catalog().defaultDescriptor();
        }

        for (var provider : providers.values()) {
            if (!provider.enabled()) continue;
            var match = provider.catalog().find(modelId);
            if (match.isPresent()) return match.get();
        }
        // uncatalogued model: run it on the first enabled provider of the task's class
        for (var id : rankedProviderIds(RoutingClass.of(task))) {
            var provider = providers.get(id);
            if (provider != null && provider.enabled()) return provider.catalog().resolve(modelId);
        }
        log.warn("Ignoring model override {}: no provider enabled", modelId);
        return null;
    }
}
