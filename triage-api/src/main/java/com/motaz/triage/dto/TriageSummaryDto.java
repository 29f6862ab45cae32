package com.motaz.triage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriageSummaryDto {
    private Long datasetId;
    private int totalAnomaliesDetected;
    private int anomaliesAnalyzedByLlm;
    private int explanationsCreated;
    private int explanationsSkipped;
    private List<TriageErrorDto> errors;
    private String note;
}
