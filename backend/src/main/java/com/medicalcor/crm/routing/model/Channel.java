package com.medicalcor.crm.routing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Channel {
    VOICE("voice"),
    WHATSAPP("whatsapp"),
    WEB("web");

    private final String key;

    Channel(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static Channel fromKey(String raw) {
        if (raw == null || raw.isBlank()) return null;
        var key = raw.trim().toLowerCase();
        for (var c : values()) {
            if (c.key.equals(key)) return c;
        }
        throw new IllegalArgumentException("invalid_channel");
    }
}
