package com.motaz.triage.services;

import com.motaz.triage.dto.ProgressDto;
import com.motaz.triage.model.documents.ProgressRecordDocument;
import com.motaz.triage.repositories.ProgressRecordDocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Publishes stage progress to Redis for polling clients. Writes are best
 * effort: a failing progress store is logged and never fails the pipeline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProgressReporter {

    private final ProgressRecordDocumentRepository progressRecordDocumentRepository;

    public void report(String progressId, ProgressStage stage, Integer progress, String message) {
        save(ProgressRecordDocument.builder()
                .id(progressId)
                .status(stage.getValue())
                .progress(progress)
                .message(message)
                .updatedAt(Instant.now().toEpochMilli())
                .build());
    }

    public void fail(String progressId, String error) {
        save(ProgressRecordDocument.builder()
                .id(progressId)
                .status(ProgressStage.ERROR.getValue())
                .progress(100)
                .error(error)
                .updatedAt(Instant.now().toEpochMilli())
                .build());
    }

    public Optional<ProgressDto> get(String progressId) {
        if (progressId == null) {
            return Optional.empty();
        }
        try {
            return progressRecordDocumentRepository.findById(progressId).map(ProgressReporter::toDto);
        } catch (RuntimeException e) {
            log.warn("Could not read progress record {}: {}", progressId, e.getMessage());
            return Optional.empty();
        }
    }

    private void save(ProgressRecordDocument document) {
        if (document.getId() == null) {
            return;
        }
        try {
            progressRecordDocumentRepository.save(document);
        } catch (RuntimeException e) {
            log.warn("Could not write progress record {} ({}): {}", document.getId(), document.getStatus(), e.getMessage());
        }
    }

    private static ProgressDto toDto(ProgressRecordDocument document) {
        return ProgressDto.builder()
                .progressId(document.getId())
                .status(document.getStatus())
                .progress(document.getProgress())
                .message(document.getMessage())
                .error(document.getError())
                .updatedAt(document.getUpdatedAt() == null ? null : Instant.ofEpochMilli(document.getUpdatedAt()))
                .build();
    }
}
