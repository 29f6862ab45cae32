package com.motaz.triage.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ProgressDto {
    private String progressId;
    private String status;
    private Integer progress;
    private String message;
    private String error;
    private Instant updatedAt;
}
