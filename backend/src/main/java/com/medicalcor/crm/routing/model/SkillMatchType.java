package com.medicalcor.crm.routing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SkillMatchType {
    REQUIRED("required"),
    PREFERRED("preferred");

    private final String key;

    SkillMatchType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static SkillMatchType fromKey(String raw) {
        if (raw == null || raw.isBlank()) return null;
        return "preferred".equalsIgnoreCase(raw.trim()) ? PREFERRED : REQUIRED;
    }
}
