package com.motaz.triage.dto;

import com.motaz.triage.model.SessionStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class AnalysisSessionDto {
    private Long sessionId;
    private Long datasetId;
    private SessionStatus status;
    private String progressId;
    private Integer rowsAnalyzed;
    private Integer anomaliesDetected;
    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;
}
