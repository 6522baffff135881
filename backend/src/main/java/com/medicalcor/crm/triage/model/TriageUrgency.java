package com.medicalcor.crm.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Urgency as classified by triage. {@code high_priority} means reported discomfort, not a medical emergency.
 */
public enum TriageUrgency {
    HIGH_PRIORITY("high_priority"),
    HIGH("high"),
    NORMAL("normal"),
    LOW("low");

    private final String key;

    TriageUrgency(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static TriageUrgency fromKey(String raw) {
        if (raw == null || raw.isBlank()) return null;
        var key = raw.trim().toLowerCase();
        for (var u : values()) {
            if (u.key.equals(key)) return u;
        }
        throw new IllegalArgumentException("invalid_triage_urgency");
    }
}
