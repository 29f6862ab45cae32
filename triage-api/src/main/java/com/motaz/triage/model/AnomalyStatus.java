package com.motaz.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Analyst workflow state of a single anomaly, independent of the dataset status. */
public enum AnomalyStatus {
    DETECTED("detected"),
    INVESTIGATING("investigating"),
    RESOLVED("resolved"),
    FALSE_POSITIVE("false_positive");

    private final String value;

    AnomalyStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AnomalyStatus fromValue(String value) {
        for (AnomalyStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown anomaly status: " + value);
    }
}
