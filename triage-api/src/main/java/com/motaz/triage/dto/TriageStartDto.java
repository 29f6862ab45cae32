package com.motaz.triage.dto;

import com.motaz.triage.model.DatasetStatus;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TriageStartDto {
    private Long datasetId;
    private DatasetStatus status;
    private String runId;
    private String progressId;
    private int maxAnomalies;
    private int totalAnomaliesDetected;
}
