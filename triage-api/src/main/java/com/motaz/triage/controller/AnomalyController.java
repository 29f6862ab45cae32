package com.motaz.triage.controller;

import com.motaz.triage.dto.AnomalyDto;
import com.motaz.triage.dto.AnomalyStatusUpdateDto;
import com.motaz.triage.dto.ExplanationDto;
import com.motaz.triage.dto.TriageStartDto;
import com.motaz.triage.dto.TriageSummaryDto;
import com.motaz.triage.exception.InvalidRequestException;
import com.motaz.triage.model.AnomalyStatus;
import com.motaz.triage.services.AnomalyService;
import com.motaz.triage.services.ExplanationService;
import com.motaz.triage.services.TriageOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;


import java.util.List;

@RestController
@RequestMapping("/api/v1/anomaly")
@RequiredArgsConstructor
public class AnomalyController {
    private final TriageOrchestrator triageOrchestrator;
    private final AnomalyService anomalyService;
    private final ExplanationService explanationService;

    @Operation(summary = "Queue a triage run that sends the top scoring anomalies to the reasoning service")
    @PostMapping("/datasets/{datasetId}/triage")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public TriageStartDto startTriage(
            @Parameter(description = "The unique identifier of the dataset", required = true, example = "1")
            @PathVariable(name = "datasetId") Long datasetId,
            @Parameter(description = "How many anomalies to explain, clamped to [1, 500]", example = "2")
            @RequestParam(name = "maxAnomalies", required = false) Integer maxAnomalies) {
        return triageOrchestrator.startTriage(datasetId, maxAnomalies);
    }

    @Operation(summary = "Outcome of the latest finished triage run")
    @GetMapping("/datasets/{datasetId}/triage")
    public TriageSummaryDto getTriageSummary(@PathVariable(name = "datasetId") Long datasetId) {
        return triageOrchestrator.getSummary(datasetId);
    }

    @GetMapping("/datasets/{datasetId}/anomalies")
    public List<AnomalyDto> listAnomalies(
            @PathVariable(name = "datasetId") Long datasetId,
            @Parameter(description = "Only anomalies in this workflow status", example = "detected")
            @RequestParam(name = "status", required = false) String status,
            @Parameter(description = "Only anomalies scoring at least this much", example = "0.5")
            @RequestParam(name = "minScore", required = false) Double minScore) {
        return anomalyService.listAnomalies(datasetId, status == null ? null : parseStatus(status), minScore);
    }

    @GetMapping("/anomalies/{anomalyId}")
    public AnomalyDto getAnomaly(@PathVariable(name = "anomalyId") Long anomalyId) {
        return anomalyService.getAnomaly(anomalyId);
    }

    @PatchMapping("/anomalies/{anomalyId}")
    public AnomalyDto updateAnomalyStatus(@PathVariable(name = "anomalyId") Long anomalyId,
                                          @Valid @RequestBody AnomalyStatusUpdateDto request) {
        return anomalyService.updateStatus(anomalyId, request.getStatus());
    }

    @GetMapping("/datasets/{datasetId}/explanations")
    public List<ExplanationDto> listExplanations(@PathVariable(name = "datasetId") Long datasetId) {
        return explanationService.listExplanations(datasetId);
    }

    private static AnomalyStatus parseStatus(String status) {
        try {
            return AnomalyStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }
    }
}
