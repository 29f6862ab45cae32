package com.motaz.triage.scoring;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class ScoringResult {
    private final int totalRows;
    private final double threshold;
    private final List<RowScore> anomalies;
}
