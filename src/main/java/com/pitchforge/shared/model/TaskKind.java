package com.pitchforge.shared.model;

/**
 * Category of outreach content being generated. The id is the wire/config label
 * and is part of every cache key and metrics entry.
 */
public enum TaskKind {
    PROFILE_CONTENT("profileContent"),
    COMPANY_CONTENT("companyContent"),
    WARM_FOLLOWUP("warmFollowup"),
    MESSAGE_ANALYSIS("messageAnalysis"),
    MESSAGE_RESPONSE("messageResponse");

    private final String id;

    TaskKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static TaskKind fromId(String id) {
        for (var kind : values()) {
            if (kind.id.equals(id)) return kind;
        }
        throw new IllegalArgumentException("Unknown task kind: " + id);
    }
}
