package com.motaz.triage.dto;

import com.motaz.triage.model.DatasetStatus;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AutoencoderStartDto {
    private Long datasetId;
    private DatasetStatus status;
    private AnalysisSessionDto session;
    private boolean reused;
    private String progressId;
}
