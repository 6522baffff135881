package com.medicalcor.crm.routing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentAvailability {
    AVAILABLE("available"),
    BUSY("busy"),
    OFFLINE("offline");

    private final String key;

    AgentAvailability(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static AgentAvailability fromKey(String raw) {
        if (raw == null || raw.isBlank()) return null;
        var key = raw.trim().toLowerCase();
        for (var a : values()) {
            if (a.key.equals(key)) return a;
        }
        throw new IllegalArgumentException("invalid_availability");
    }
}
