package com.motaz.triage.dto;

import com.motaz.triage.model.Severity;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class ExplanationDto {
    private Long id;
    private Long anomalyId;
    private Long datasetId;
    private String sessionId;
    private Severity severity;
    private String category;
    private String verdict;
    private String recommendation;
    private String notes;
    private List<String> keyIndicators;
    private Double confidenceScore;
    private String modelName;
    private Long latencyMs;
    private Instant createdAt;
}
