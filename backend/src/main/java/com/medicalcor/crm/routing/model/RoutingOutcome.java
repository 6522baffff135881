package com.medicalcor.crm.routing.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RoutingOutcome {
    ASSIGNED("assigned"),
    QUEUED("queued"),
    ESCALATED("escalated");

    private final String key;

    RoutingOutcome(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }
}
