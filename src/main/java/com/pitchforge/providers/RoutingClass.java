package com.pitchforge.providers;

import com.pitchforge.shared.model.TaskKind;

public enum RoutingClass {
    /** Extended, nuanced prose. */
    LONG_FORM,
    /** Fast, constrained output such as JSON extraction. */
    STRUCTURED;

    public static RoutingClass of(TaskKind task) {
        if (task == TaskKind.PROFILE_CONTENT
                || task == TaskKind.WARM_FOLLOWUP
                || task == TaskKind.MESSAGE_RESPONSE) {
            return LONG_FORM;
        }
        return STRUCTURED;
    }
}
