package com.motaz.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One feature of an anomalous row, stored as JSON on the anomaly record. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalousFeature {
    private String featureName;
    private String actualValue;
    private double encodedValue;
    private double reconstructionError;
}
