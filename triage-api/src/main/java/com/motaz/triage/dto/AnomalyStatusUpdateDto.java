package com.motaz.triage.dto;

import com.motaz.triage.model.AnomalyStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyStatusUpdateDto {
    @NotNull
    private AnomalyStatus status;
}
