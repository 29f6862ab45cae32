package com.motaz.triage.services;

import com.motaz.triage.dto.AnalysisSessionDto;
import com.motaz.triage.dto.AutoencoderStartDto;
import com.motaz.triage.exception.InvalidStateException;
import com.motaz.triage.exception.PipelineBusyException;
import com.motaz.triage.model.DatasetStatus;
import com.motaz.triage.model.SessionStatus;
import com.motaz.triage.model.entities.AnalysisSessionEntity;
import com.motaz.triage.model.entities.DatasetEntity;
import com.motaz.triage.scoring.AutoencoderScorer;
import com.motaz.triage.scoring.ScoringResult;
import com.motaz.triage.scoring.TabularData;
import com.motaz.triage.storage.ObjectStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Starts the autoencoder stage for a dataset and runs it in the background.
 * The HTTP caller gets the session right away and polls progress.
 */
@Slf4j
@Service
public class AutoencoderPipelineService {

    private final DatasetStateMachine datasetStateMachine;
    private final AnalysisSessionManager analysisSessionManager;
    private final ModelRegistryService modelRegistryService;
    private final ObjectStorage objectStorage;
    private final TabularFileParser tabularFileParser;
    private final AnomalyService anomalyService;
    private final ProgressReporter progressReporter;
    private final TaskExecutor analysisExecutor;

    public AutoencoderPipelineService(DatasetStateMachine datasetStateMachine,
                                      AnalysisSessionManager analysisSessionManager,
                                      ModelRegistryService modelRegistryService,
                                      ObjectStorage objectStorage,
                                      TabularFileParser tabularFileParser,
                                      AnomalyService anomalyService,
                                      ProgressReporter progressReporter,
                                      @Qualifier("analysisExecutor") TaskExecutor analysisExecutor) {
        this.datasetStateMachine = datasetStateMachine;
        this.analysisSessionManager = analysisSessionManager;
        this.modelRegistryService = modelRegistryService;
        this.objectStorage = objectStorage;
        this.tabularFileParser = tabularFileParser;
        this.anomalyService = anomalyService;
        this.progressReporter = progressReporter;
        this.analysisExecutor = analysisExecutor;
    }

    public AutoencoderStartDto startAutoencoder(Long datasetId) {
        DatasetEntity dataset = datasetStateMachine.require(datasetId);

        Optional<AnalysisSessionEntity> running = analysisSessionManager.findInFlight(datasetId);
        if (running.isPresent()) {
            return response(datasetId, DatasetStatus.ANALYZING, running.get(), true);
        }
        if (!DatasetStateMachine.canStartAutoencoder(dataset.getStatus())) {
            throw new InvalidStateException("Autoencoder cannot start on dataset " + datasetId + " in status "
                    + dataset.getStatus().getValue());
        }
        AutoencoderScorer scorer = modelRegistryService.requireScorer();

        String progressId = UUID.randomUUID().toString();
        SessionHandle handle = analysisSessionManager.begin(datasetId, progressId);
        AnalysisSessionEntity session = handle.getSession();
        if (handle.isReused()) {
            return response(datasetId, DatasetStatus.ANALYZING, session, true);
        }

        try {
            datasetStateMachine.beginAutoencoder(datasetId, progressId);
        } catch (InvalidStateException e) {
            analysisSessionManager.complete(session.getId(), SessionStatus.ERROR, null, null, e.getMessage());
            throw e;
        }

        progressReporter.report(progressId, ProgressStage.QUEUED, 0, "Autoencoder analysis queued");
        try {
            analysisExecutor.execute(() -> runDetection(datasetId, session.getId(), progressId, scorer));
        } catch (TaskRejectedException e) {
            String message = "Autoencoder analysis could not be queued: " + e.getMessage();
            log.warn("Dataset {}: {}", datasetId, message);
            analysisSessionManager.complete(session.getId(), SessionStatus.ERROR, null, null, message);
            datasetStateMachine.fail(datasetId, DatasetStatus.ANALYZING, message);
            progressReporter.fail(progressId, message);
            throw new PipelineBusyException(message, e);
        }
        log.info("---Start autoencoder analysis of dataset {} (session {})", datasetId, session.getId());
        return response(datasetId, DatasetStatus.ANALYZING, session, false);
    }

    void runDetection(Long datasetId, Long sessionId, String progressId, AutoencoderScorer scorer) {
        try {
            DatasetEntity dataset = datasetStateMachine.require(datasetId);
            progressReporter.report(progressId, ProgressStage.LOADING, 10, "Loading " + dataset.getOriginalFilename());
            TabularData table = tabularFileParser.parse(objectStorage.get(dataset.getStorageKey()));

            progressReporter.report(progressId, ProgressStage.SCORING, 30, "Scoring " + table.rowCount() + " rows");
            ScoringResult result = scorer.score(table);

            progressReporter.report(progressId, ProgressStage.PERSISTING, 80,
                    "Saving " + result.getAnomalies().size() + " anomalies");
            anomalyService.replaceDetectionPass(dataset, sessionId, result);

            progressReporter.report(progressId, ProgressStage.COMPLETED, 100,
                    "Detected " + result.getAnomalies().size() + " anomalies in " + result.getTotalRows() + " rows");
            log.info("--- Autoencoder analysis of dataset {} completed: {} anomalies in {} rows", datasetId,
                    result.getAnomalies().size(), result.getTotalRows());
        } catch (Exception e) {
            String message = "Autoencoder analysis failed: " + e.getMessage();
            log.error("Autoencoder analysis of dataset {} failed", datasetId, e);
            // a session closed elsewhere means the dataset no longer belongs to this worker
            if (analysisSessionManager.complete(sessionId, SessionStatus.ERROR, null, null, message)) {
                datasetStateMachine.fail(datasetId, DatasetStatus.ANALYZING, message);
            }
            progressReporter.fail(progressId, message);
        }
    }

    private static AutoencoderStartDto response(Long datasetId, DatasetStatus status, AnalysisSessionEntity session,
                                                boolean reused) {
        return AutoencoderStartDto.builder()
                .datasetId(datasetId)
                .status(status)
                .session(toDto(session))
                .reused(reused)
                .progressId(session.getProgressId())
                .build();
    }

    static AnalysisSessionDto toDto(AnalysisSessionEntity session) {
        return AnalysisSessionDto.builder()
                .sessionId(session.getId())
                .datasetId(session.getDatasetId())
                .status(session.getStatus())
                .progressId(session.getProgressId())
                .rowsAnalyzed(session.getRowsAnalyzed())
                .anomaliesDetected(session.getAnomaliesDetected())
                .errorMessage(session.getErrorMessage())
                .startedAt(session.getStartedAt())
                .completedAt(session.getCompletedAt())
                .build();
    }
}
