package com.motaz.triage.scoring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Frozen preprocessing parameters of one model input column.
 * Numeric columns use {@code imputeValue} for blanks, categorical columns use
 * the index of the value in {@code categories}. Both are then standardized
 * with {@code (x - mean) / scale}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureSpec {
    private String name;
    private FeatureType type;
    private double mean;
    private double scale;
    private double imputeValue;
    private List<String> categories;
}
