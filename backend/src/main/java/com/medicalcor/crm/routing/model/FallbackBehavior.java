package com.medicalcor.crm.routing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Action taken when no worker qualifies for a request.
 */
public enum FallbackBehavior {
    QUEUE("queue"),
    /** Retry once with relaxed constraints, then queue. */
    REASSIGN("reassign"),
    ESCALATE("escalate");

    private final String key;

    FallbackBehavior(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static FallbackBehavior fromKey(String raw) {
        if (raw == null || raw.isBlank()) return null;
        var key = raw.trim().toLowerCase();
        for (var f : values()) {
            if (f.key.equals(key)) return f;
        }
        throw new IllegalArgumentException("invalid_fallback_behavior");
    }
}
