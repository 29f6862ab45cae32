package com.motaz.triage.scoring;

public enum FeatureType {
    NUMERIC,
    CATEGORICAL
}
