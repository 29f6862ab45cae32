package com.motaz.triage.dto;

import com.motaz.triage.model.DatasetStatus;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DatasetStatusDto {
    private Long datasetId;
    private DatasetStatus status;
    private Integer anomalyCount;
    private Integer totalRows;
    private String errorMessage;
    private ProgressDto progress;
}
