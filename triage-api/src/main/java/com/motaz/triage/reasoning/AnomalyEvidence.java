package com.motaz.triage.reasoning;

import com.motaz.triage.model.AnomalousFeature;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class AnomalyEvidence {
    private Long datasetId;
    private String datasetName;
    private Long anomalyId;
    private String runId;
    private Integer rowIndex;
    private Double anomalyScore;
    private String priority;
    private List<AnomalousFeature> topFeatures;
    private Map<String, String> rawData;
}
