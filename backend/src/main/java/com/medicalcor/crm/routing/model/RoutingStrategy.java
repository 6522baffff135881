package com.medicalcor.crm.routing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How qualified candidates are ordered before capacity is reserved.
 * The key doubles as the bean name of the matching selection strategy.
 */
public enum RoutingStrategy {
    BEST_MATCH("best_match"),
    LEAST_OCCUPIED("least_occupied"),
    SKILLS_FIRST("skills_first"),
    ROUND_ROBIN("round_robin");

    private final String key;

    RoutingStrategy(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static RoutingStrategy fromKey(String raw) {
        if (raw == null || raw.isBlank()) return null;
        var key = raw.trim().toLowerCase().replace('-', '_');
        for (var s : values()) {
            if (s.key.equals(key)) return s;
        }
        throw new IllegalArgumentException("invalid_routing_strategy");
    }
}
