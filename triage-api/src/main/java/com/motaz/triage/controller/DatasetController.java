package com.motaz.triage.controller;

import com.motaz.triage.dto.AnalysisSessionDto;
import com.motaz.triage.dto.AutoencoderStartDto;
import com.motaz.triage.dto.DatasetDto;
import com.motaz.triage.dto.DatasetStatusDto;
import com.motaz.triage.dto.ProgressDto;
import com.motaz.triage.dto.StatisticsDto;
import com.motaz.triage.exception.InvalidRequestException;
import com.motaz.triage.exception.NotFoundException;
import com.motaz.triage.model.DatasetStatus;
import com.motaz.triage.services.AutoencoderPipelineService;
import com.motaz.triage.services.DatasetService;
import com.motaz.triage.services.ProgressReporter;
import com.motaz.triage.services.StatisticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/api/v1/anomaly")
@RequiredArgsConstructor
public class DatasetController {
    private final DatasetService datasetService;
    private final AutoencoderPipelineService autoencoderPipelineService;
    private final ProgressReporter progressReporter;
    private final StatisticsService statisticsService;

    @Operation(summary = "Upload a CSV dataset")
    @PostMapping(value = "/datasets", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public DatasetDto upload(@RequestPart("file") MultipartFile file) throws IOException {
        return datasetService.uploadDataset(file);
    }

    @GetMapping("/datasets")
    public List<DatasetDto> listDatasets(
            @Parameter(description = "Only datasets in this status", example = "analyzed")
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "limit", defaultValue = "100") int limit) {
        return datasetService.listDatasets(status == null ? null : parseStatus(status), limit);
    }

    @GetMapping("/datasets/{datasetId}")
    public DatasetDto getDataset(
            @Parameter(description = "The unique identifier of the dataset", required = true, example = "1")
            @PathVariable(name = "datasetId") Long datasetId) {
        return datasetService.getDataset(datasetId);
    }

    @GetMapping("/datasets/{datasetId}/status")
    public DatasetStatusDto getStatus(@PathVariable(name = "datasetId") Long datasetId) {
        return datasetService.getStatus(datasetId);
    }

    @Operation(summary = "Start autoencoder anomaly detection", description = "Returns immediately; poll the progress id")
    @PostMapping("/datasets/{datasetId}/autoencoder")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public AutoencoderStartDto startAutoencoder(
            @Parameter(description = "The unique identifier of the dataset", required = true, example = "1")
            @PathVariable(name = "datasetId") Long datasetId) {
        return autoencoderPipelineService.startAutoencoder(datasetId);
    }

    @GetMapping("/datasets/{datasetId}/session")
    public AnalysisSessionDto getLatestSession(@PathVariable(name = "datasetId") Long datasetId) {
        return datasetService.getLatestSession(datasetId);
    }

    @GetMapping("/sessions/{sessionId}")
    public AnalysisSessionDto getSession(@PathVariable(name = "sessionId") Long sessionId) {
        return datasetService.getSession(sessionId);
    }

    @GetMapping("/progress/{progressId}")
    public ProgressDto getProgress(@PathVariable(name = "progressId") String progressId) {
        return progressReporter.get(progressId)
                .orElseThrow(() -> new NotFoundException("Progress " + progressId + " not found"));
    }

    @GetMapping("/statistics")
    public StatisticsDto getStatistics() {
        return statisticsService.getStatistics();
    }

    private static DatasetStatus parseStatus(String status) {
        try {
            return DatasetStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }
    }
}
