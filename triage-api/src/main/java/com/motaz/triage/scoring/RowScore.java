package com.motaz.triage.scoring;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/** An anomalous row: features ranked by reconstruction error, highest first. */
@Getter
@AllArgsConstructor
public class RowScore {
    private final int rowIndex;
    private final double score;
    private final List<FeatureError> features;
    private final Map<String, String> rawData;
}
