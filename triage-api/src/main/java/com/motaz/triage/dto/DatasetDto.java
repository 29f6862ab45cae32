package com.motaz.triage.dto;

import com.motaz.triage.model.DatasetStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class DatasetDto {
    private Long id;
    private String filename;
    private String originalFilename;
    private Long fileSize;
    private String contentType;
    private DatasetStatus status;
    private Integer anomalyCount;
    private Integer totalRows;
    private Integer detectionPass;
    private String progressId;
    private String errorMessage;
    private Instant uploadedAt;
    private Instant updatedAt;
    private Instant analyzedAt;
    private Instant triagedAt;
}
