package com.motaz.triage.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class StatisticsDto {
    private long totalDatasets;
    private Map<String, Long> datasetsByStatus;
    private long totalAnomalies;
    private Map<String, Long> anomaliesByPriority;
    private Map<String, Long> anomaliesByStatus;
    private long totalExplanations;
    private Map<String, Long> explanationsBySeverity;
}
