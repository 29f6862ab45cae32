package com.motaz.triage.reasoning;

import com.motaz.triage.model.Severity;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ReasoningVerdict {
    private Severity severity;
    private String category;
    private String verdict;
    private String recommendation;
    private String notes;
    private Double confidence;
    private List<String> keyIndicators;
    private String modelName;
}
