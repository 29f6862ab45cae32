package com.motaz.triage.model;

/**
 * Priority bucket of an anomaly relative to the other anomalies of the same
 * detection pass (quartiles of their scores).
 */
public enum AnomalyPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public static AnomalyPriority of(double score, double q1, double median, double q3) {
        if (score >= q3) return CRITICAL;
        if (score >= median) return HIGH;
        if (score >= q1) return MEDIUM;
        return LOW;
    }
}
