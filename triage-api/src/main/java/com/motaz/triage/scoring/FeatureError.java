package com.motaz.triage.scoring;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class FeatureError {
    private final String featureName;
    private final String actualValue;
    private final double encodedValue;
    private final double reconstructionError;
}
