package com.motaz.triage.dto;

import com.motaz.triage.model.AnomalousFeature;
import com.motaz.triage.model.AnomalyPriority;
import com.motaz.triage.model.AnomalyStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class AnomalyDto {
    private Long id;
    private Long datasetId;
    private Integer detectionPass;
    private Integer rowIndex;
    private Double anomalyScore;
    private AnomalyPriority priority;
    private List<AnomalousFeature> anomalousFeatures;
    private Map<String, String> rawData;
    private AnomalyStatus status;
    private Instant detectedAt;
}
