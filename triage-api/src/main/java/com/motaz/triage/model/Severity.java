package com.motaz.triage.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Severity parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("severity is missing");
        }
        return Severity.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
