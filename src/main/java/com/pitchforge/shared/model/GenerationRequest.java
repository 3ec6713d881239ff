package com.pitchforge.shared.model;

import java.util.Objects;

public record GenerationRequest(
    String promptText,
    TaskKind taskKind,
    ContextHints hints,
    String systemPrompt
) {
    public GenerationRequest {
        Objects.requireNonNull(promptText, "promptText");
        Objects.requireNonNull(taskKind, "taskKind");
        if (hints == null) hints = ContextHints.none();
    }

    public GenerationRequest(String promptText, TaskKind taskKind, ContextHints hints) {
        this(promptText, taskKind, hints, null);
    }

    public GenerationRequest(String promptText, TaskKind taskKind) {
        this(promptText, taskKind, ContextHints.none(), null);
    }
}
