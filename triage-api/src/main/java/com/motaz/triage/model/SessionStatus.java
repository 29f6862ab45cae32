package com.motaz.triage.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionStatus {
    PROCESSING("processing"),
    COMPLETED("completed"),
    ERROR("error");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
