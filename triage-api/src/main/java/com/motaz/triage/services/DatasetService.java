package com.motaz.triage.services;

import com.motaz.triage.dto.AnalysisSessionDto;
import com.motaz.triage.dto.DatasetDto;
import com.motaz.triage.dto.DatasetStatusDto;
import com.motaz.triage.exception.InvalidRequestException;
import com.motaz.triage.model.DatasetStatus;
import com.motaz.triage.model.entities.DatasetEntity;
import com.motaz.triage.repositories.DatasetRepository;
import com.motaz.triage.storage.ObjectStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetService {

    static final int MAX_LIST_LIMIT = 500;

    private final DatasetRepository datasetRepository;
    private final DatasetStateMachine datasetStateMachine;
    private final AnalysisSessionManager analysisSessionManager;
    private final ObjectStorage objectStorage;
    private final ProgressReporter progressReporter;

    public DatasetDto uploadDataset(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new InvalidRequestException("Uploaded file is empty");
        }
        String originalFilename = file.getOriginalFilename() == null ? "dataset.csv"
                : file.getOriginalFilename().replaceAll("[\\\\/]", "_");
        if (!isCsv(originalFilename, file.getContentType())) {
            throw new InvalidRequestException("Only CSV datasets are supported, got " + originalFilename
                    + " (" + file.getContentType() + ")");
        }

        String filename = UUID.randomUUID() + ".csv";
        String storageKey = objectStorage.put("datasets/" + filename, file.getBytes());

        DatasetEntity dataset = new DatasetEntity();
        dataset.setFilename(filename);
        dataset.setOriginalFilename(originalFilename);
        dataset.setStorageKey(storageKey);
        dataset.setFileSize(file.getSize());
        dataset.setContentType(file.getContentType());
        dataset.setStatus(DatasetStatus.UPLOADED);
        DatasetEntity saved = datasetRepository.save(dataset);
        log.info("Uploaded dataset {} ({}, {} bytes)", saved.getId(), originalFilename, file.getSize());
        return toDto(saved);
    }

    @Transactional(readOnly = true)
    public List<DatasetDto> listDatasets(DatasetStatus status, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(MAX_LIST_LIMIT, limit)));
        List<DatasetEntity> datasets = status == null
                ? datasetRepository.findAllByOrderByUploadedAtDesc(page)
                : datasetRepository.findAllByStatusOrderByUploadedAtDesc(status, page);
        return datasets.stream().map(DatasetService::toDto).toList();
    }

    public DatasetDto getDataset(Long datasetId) {
        return toDto(datasetStateMachine.require(datasetId));
    }

    public DatasetStatusDto getStatus(Long datasetId) {
        DatasetEntity dataset = datasetStateMachine.require(datasetId);
        return DatasetStatusDto.builder()
                .datasetId(dataset.getId())
                .status(dataset.getStatus())
                .anomalyCount(dataset.getAnomalyCount())
                .totalRows(dataset.getTotalRows())
                .errorMessage(dataset.getErrorMessage())
                .progress(progressReporter.get(dataset.getProgressId()).orElse(null))
                .build();
    }

    public AnalysisSessionDto getLatestSession(Long datasetId) {
        return AutoencoderPipelineService.toDto(analysisSessionManager.getLatestSession(datasetId));
    }

    public AnalysisSessionDto getSession(Long sessionId) {
        return AutoencoderPipelineService.toDto(analysisSessionManager.getSession(sessionId));
    }

    private static boolean isCsv(String filename, String contentType) {
        if (filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            return true;
        }
        return contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("text/csv");
    }

    static DatasetDto toDto(DatasetEntity dataset) {
        return DatasetDto.builder()
                .id(dataset.getId())
                .filename(dataset.getFilename())
                .originalFilename(dataset.getOriginalFilename())
                .fileSize(dataset.getFileSize())
                .contentType(dataset.getContentType())
                .status(dataset.getStatus())
                .anomalyCount(dataset.getAnomalyCount())
                .totalRows(dataset.getTotalRows())
                .detectionPass(dataset.getDetectionPass())
                .progressId(dataset.getProgressId())
                .errorMessage(dataset.getErrorMessage())
                .uploadedAt(dataset.getUploadedAt())
                .updatedAt(dataset.getUpdatedAt())
                .analyzedAt(dataset.getAnalyzedAt())
                .triagedAt(dataset.getTriagedAt())
                .build();
    }
}
