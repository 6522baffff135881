package com.medicalcor.crm.routing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordinal skill strength: basic &lt; intermediate &lt; advanced &lt; expert.
 */
public enum Proficiency {
    BASIC(1, "basic"),
    INTERMEDIATE(2, "intermediate"),
    ADVANCED(3, "advanced"),
    EXPERT(4, "expert");

    private final int weight;
    private final String key;

    Proficiency(int weight, String key) {
        this.weight = weight;
        this.key = key;
    }

    public int weight() {
        return weight;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public boolean atLeast(Proficiency other) {
        return other == null || weight >= other.weight;
    }

    /**
     * One level lower, never below {@link #BASIC}.
     */
    public Proficiency downgrade() {
        return this == BASIC ? BASIC : values()[ordinal() - 1];
    }

    @JsonCreator
    public static Proficiency fromKey(String raw) {
        if (raw == null || raw.isBlank()) return null;
        var key = raw.trim().toLowerCase();
        for (var p : values()) {
            if (p.key.equals(key)) return p;
        }
        throw new IllegalArgumentException("invalid_proficiency");
    }
}
