package com.motaz.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of an uploaded dataset, in legal order:
 * uploaded, analyzing, analyzed, triaging, completed.
 * {@link #ERROR} is reachable from every non-terminal state. Reading and
 * parsing the file is part of the analyzing stage.
 */
public enum DatasetStatus {
    UPLOADED("uploaded"),
    ANALYZING("analyzing"),
    ANALYZED("analyzed"),
    TRIAGING("triaging"),
    COMPLETED("completed"),
    ERROR("error");

    private final String value;

    DatasetStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DatasetStatus fromValue(String value) {
        for (DatasetStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown dataset status: " + value);
    }

    /** Anomalies are readable once the autoencoder pass has been committed. */
    public boolean hasAnomalies() {
        return this == ANALYZED || this == TRIAGING || this == COMPLETED;
    }
}
