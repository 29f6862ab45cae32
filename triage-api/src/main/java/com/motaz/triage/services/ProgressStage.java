package com.motaz.triage.services;

public enum ProgressStage {
    QUEUED("queued"),
    LOADING("loading"),
    SCORING("scoring"),
    PERSISTING("persisting"),
    TRIAGING("triaging"),
    COMPLETED("completed"),
    ERROR("error");

    private final String value;

    ProgressStage(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
