package com.motaz.triage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriageErrorDto {
    private Long anomalyId;
    private Integer rowIndex;
    private String error;
}
