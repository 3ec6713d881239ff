package com.pitchforge.providers;

import com.pitchforge.shared.config.ProviderConfig;
import com.pitchforge.shared.config.RoutingConfig;
import com.pitchforge.shared.model.ContextHints;
import com.pitchforge.shared.model.TaskKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProviderSelectorTest {

    private ProviderSelector selector(ProviderConfig... providers) {
        return new ProviderSelector(List.of(providers), RoutingConfig.defaults(), 2000);
    }

    private static List<String> ids(List<ProviderDescriptor> candidates) {
        return candidates.stream().map(ProviderDescriptor::providerId).toList();
    }

    @Test
    void longFormTasksPreferAnthropic() {
        var selector = selector(Fixtures.openai(), Fixtures.anthropic(), Fixtures.ollama(true));

        for (var task : List.of(TaskKind.PROFILE_CONTENT, TaskKind.WARM_FOLLOWUP, TaskKind.MESSAGE_RESPONSE)) {
            assertEquals(List.of("anthropic", "openai", "ollama"),
                    ids(selector.selectCandidates(task, ContextHints.none())), task.id());
        }
    }

    @Test
    void structuredTasksPreferOpenAi() {
        var selector = selector(Fixtures.anthropic(), Fixtures.openai(), Fixtures.ollama(true));

        assertEquals(List.of("openai", "anthropic", "ollama"),
                ids(selector.selectCandidates(TaskKind.COMPANY_CONTENT, ContextHints.none())));
        assertEquals(List.of("openai", "anthropic", "ollama"),
                ids(selector.selectCandidates(TaskKind.MESSAGE_ANALYSIS, ContextHints.none())));
    }

    @Test
    void longContentEscalatesToLongFormWithComplexModel() {
        var selector = selector(Fixtures.anthropic(), Fixtures.openai());

        var candidates = selector.selectCandidates(TaskKind.MESSAGE_ANALYSIS, ContextHints.ofLength(2001));

        assertEquals(List.of("anthropic", "openai"), ids(candidates));
        assertEquals("gpt-4o", candidates.get(1).modelId());
    }

    @Test
    void contentAtThresholdDoesNotEscalate() {
        var selector = selector(Fixtures.anthropic(), Fixtures.openai());

        var candidates = selector.selectCandidates(TaskKind.COMPANY_CONTENT, ContextHints.ofLength(2000));

        assertEquals("openai", candidates.get(0).providerId());
    }

    @Test
    void analysisPrefersFastModels() {
        var selector = selector(Fixtures.anthropic(), Fixtures.openai());

        var candidates = selector.selectCandidates(TaskKind.MESSAGE_ANALYSIS, ContextHints.none());

        assertEquals("gpt-4o-mini", candidates.get(0).modelId());
        assertEquals("claude-3-haiku-20240307", candidates.get(1).modelId());
    }

    @Test
    void otherTasksUseTheDefaultModel() {
        var selector = selector(Fixtures.anthropic(), Fixtures.openai());

        var candidates = selector.selectCandidates(TaskKind.PROFILE_CONTENT, ContextHints.none());

        assertEquals("claude-3-opus-20240229", candidates.get(0).modelId());
    }

    @Test
    void disabledPreferredProviderStillLeavesOthers() {
        var anthropicOff = Fixtures.provider("anthropic", "anthropic", false,
                Fixtures.model("anthropic", "claude-3-opus-20240229", 4000, "complex"));
        var selector = selector(anthropicOff, Fixtures.openai());

        assertEquals(List.of("openai"), ids(selector.selectCandidates(TaskKind.PROFILE_CONTENT, ContextHints.none())));
    }

    @Test
    void nothingEnabledMeansNoCandidates() {
        var selector = selector(Fixtures.ollama(false));

        assertTrue(selector.selectCandidates(TaskKind.PROFILE_CONTENT, ContextHints.none()).isEmpty());
    }

    @Test
    void providerOverrideIsSoleCandidate() {
        var selector = selector(Fixtures.anthropic(), Fixtures.openai());

        var candidates = selector.selectCandidates(TaskKind.PROFILE_CONTENT,
                ContextHints.override("openai", "gpt-4o"));

        assertEquals(1, candidates.size());
        assertEquals("openai/gpt-4o", candidates.get(0).label());
    }

    @Test
    void modelOverrideFindsItsProvider() {
        var selector = selector(Fixtures.anthropic(), Fixtures.openai());

        var candidates = selector.selectCandidates(TaskKind.PROFILE_CONTENT,
                new ContextHints(0, "gpt-3.5-turbo", null));

        assertEquals(List.of("openai/gpt-3.5-turbo"), candidates.stream().map(ProviderDescriptor::label).toList());
    }

    @Test
    void uncataloguedModelRunsOnPreferredProvider() {
        var selector = selector(Fixtures.anthropic(), Fixtures.openai());

        var candidates = selector.selectCandidates(TaskKind.COMPANY_CONTENT,
                new ContextHints(0, "gpt-4.1", null));

        assertEquals("openai/gpt-4.1", candidates.get(0).label());
        assertEquals(4000, candidates.get(0).maxOutputTokens());
    }

    @Test
    void overrideOfDisabledProviderFallsBackToRouting() {
        var selector = selector(Fixtures.anthropic(), Fixtures.openai(), Fixtures.ollama(false));

        var candidates = selector.selectCandidates(TaskKind.PROFILE_CONTENT,
                ContextHints.override("ollama", "qwen3:4b"));

        assertEquals(List.of("anthropic", "openai"), ids(candidates));
    }
}
