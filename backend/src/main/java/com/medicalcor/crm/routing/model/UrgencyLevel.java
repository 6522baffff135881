package com.medicalcor.crm.routing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum UrgencyLevel {
    LOW("low"),
    NORMAL("normal"),
    HIGH("high"),
    CRITICAL("critical");

    private final String key;

    UrgencyLevel(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public boolean isElevated() {
        return this == HIGH || this == CRITICAL;
    }

    @JsonCreator
    public static UrgencyLevel fromKey(String raw) {
        if (raw == null || raw.isBlank()) return null;
        var key = raw.trim().toLowerCase();
        for (var u : values()) {
            if (u.key.equals(key)) return u;
        }
        throw new IllegalArgumentException("invalid_urgency_level");
    }
}
