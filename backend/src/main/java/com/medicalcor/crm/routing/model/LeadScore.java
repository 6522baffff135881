package com.medicalcor.crm.routing.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum LeadScore {
    HOT,
    WARM,
    COLD,
    UNQUALIFIED;

    @JsonCreator
    public static LeadScore fromKey(String raw) {
        if (raw == null || raw.isBlank()) return null;
        var key = raw.trim().toUpperCase();
        for (var s : values()) {
            if (s.name().equals(key)) return s;
        }
        throw new IllegalArgumentException("invalid_lead_score");
    }
}
