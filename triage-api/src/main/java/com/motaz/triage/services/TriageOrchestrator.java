package com.motaz.triage.services;

import com.motaz.triage.dto.TriageErrorDto;
import com.motaz.triage.dto.TriageStartDto;
import com.motaz.triage.dto.TriageSummaryDto;
import com.motaz.triage.exception.ExternalServiceFailureException;
import com.motaz.triage.exception.InvalidStateException;
import com.motaz.triage.exception.NoAnomaliesException;
import com.motaz.triage.exception.NotFoundException;
import com.motaz.triage.exception.PipelineBusyException;
import com.motaz.triage.model.DatasetStatus;
import com.motaz.triage.model.entities.AnomalyEntity;
import com.motaz.triage.model.entities.DatasetEntity;
import com.motaz.triage.model.entities.LlmExplanationEntity;
import com.motaz.triage.reasoning.AnomalyEvidence;
import com.motaz.triage.reasoning.ReasoningClient;
import com.motaz.triage.reasoning.ReasoningVerdict;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the triage stage: ranks the anomalies of the current detection pass,
 * sends the top ones to the reasoning service and stores one explanation per
 * anomaly. Individual call failures are recorded and do not stop the run.
 * <p>
 * Runs are queued on {@code triageExecutor}; each run keeps at most
 * {@link PipelineSettings#triageParallelism()} reasoning calls in flight on
 * the shared {@code reasoningCallExecutor} and heartbeats the dataset after
 * every batch so the sweeper can tell a live run from a dead one.
 */
@Slf4j
@Service
public class TriageOrchestrator {

    private static final int TOP_FEATURES = 5;

    private final DatasetStateMachine datasetStateMachine;
    private final AnomalyService anomalyService;
    private final ExplanationService explanationService;
    private final TriageSelector triageSelector;
    private final ReasoningClient reasoningClient;
    private final ProgressReporter progressReporter;
    private final PipelineSettings pipelineSettings;
    private final TaskExecutor triageExecutor;
    private final AsyncTaskExecutor reasoningCallExecutor;

    public TriageOrchestrator(DatasetStateMachine datasetStateMachine,
                              AnomalyService anomalyService,
                              ExplanationService explanationService,
                              TriageSelector triageSelector,
                              ReasoningClient reasoningClient,
                              ProgressReporter progressReporter,
                              PipelineSettings pipelineSettings,
                              @Qualifier("triageExecutor") TaskExecutor triageExecutor,
                              @Qualifier("reasoningCallExecutor") AsyncTaskExecutor reasoningCallExecutor) {
        this.datasetStateMachine = datasetStateMachine;
        this.anomalyService = anomalyService;
        this.explanationService = explanationService;
        this.triageSelector = triageSelector;
        this.reasoningClient = reasoningClient;
        this.progressReporter = progressReporter;
        this.pipelineSettings = pipelineSettings;
        this.triageExecutor = triageExecutor;
        this.reasoningCallExecutor = reasoningCallExecutor;
    }

    /**
     * Validates the request, moves the dataset to triaging and queues the run.
     * The outcome is read later from the progress record or {@link #getSummary(Long)}.
     */
    public TriageStartDto startTriage(Long datasetId, Integer maxAnomalies) {
        int limit = triageSelector.clamp(maxAnomalies == null ? pipelineSettings.defaultMaxAnomalies() : maxAnomalies);
        DatasetEntity dataset = datasetStateMachine.require(datasetId);
        if (dataset.getStatus() != DatasetStatus.ANALYZED) {
            throw new InvalidStateException("Triage needs an analyzed dataset, dataset " + datasetId + " is "
                    + dataset.getStatus().getValue());
        }
        List<AnomalyEntity> anomalies = anomalyService.currentPass(dataset);
        if (anomalies.isEmpty()) {
            throw new NoAnomaliesException(datasetId);
        }

        String runId = UUID.randomUUID().toString();
        datasetStateMachine.beginTriage(datasetId, runId);
        progressReporter.report(runId, ProgressStage.QUEUED, 0, "Triage queued");
        try {
            triageExecutor.execute(() -> runInBackground(datasetId, runId, limit));
        } catch (TaskRejectedException e) {
            String message = "Triage could not be queued: " + e.getMessage();
            log.warn("Dataset {}: {}", datasetId, message);
            datasetStateMachine.fail(datasetId, DatasetStatus.TRIAGING, message);
            progressReporter.fail(runId, message);
            throw new PipelineBusyException(message, e);
        }
        log.info("Queued triage of dataset {} (run {}, top {} of {})", datasetId, runId,
                Math.min(limit, anomalies.size()), anomalies.size());

        return TriageStartDto.builder()
                .datasetId(datasetId)
                .status(DatasetStatus.TRIAGING)
                .runId(runId)
                .progressId(runId)
                .maxAnomalies(limit)
                .totalAnomaliesDetected(anomalies.size())
                .build();
    }

    public TriageSummaryDto getSummary(Long datasetId) {
        DatasetEntity dataset = datasetStateMachine.require(datasetId);
        if (dataset.getTriageSummary() == null) {
            throw new NotFoundException("Dataset " + datasetId + " has no finished triage run");
        }
        return dataset.getTriageSummary();
    }

    /**
     * Fails triaging datasets whose run stopped heartbeating. The update is
     * conditional on the cutoff, so a run that touched the dataset after the
     * lookup keeps going.
     *
     * @return number of datasets reclaimed
     */
    public int reclaimStaleRuns() {
        Instant cutoff = Instant.now().minus(pipelineSettings.triageStaleAfter());
        int reclaimed = 0;
        for (DatasetEntity dataset : datasetStateMachine.findStale(DatasetStatus.TRIAGING, cutoff)) {
            String message = "Triage run " + dataset.getProgressId() + " stopped reporting progress";
            if (datasetStateMachine.failStale(dataset.getId(), DatasetStatus.TRIAGING, cutoff, message)) {
                if (dataset.getProgressId() != null) {
                    progressReporter.fail(dataset.getProgressId(), message);
                }
                reclaimed++;
            }
        }
        if (reclaimed > 0) {
            log.warn("Reclaimed {} stale triage run(s)", reclaimed);
        }
        return reclaimed;
    }

    private void runInBackground(Long datasetId, String runId, int limit) {
        try {
            runTriage(datasetId, runId, limit);
        } catch (RuntimeException e) {
            // already recorded on the dataset and the progress record
            log.debug("Triage run {} of dataset {} ended with {}", runId, datasetId, e.toString());
        }
    }

    TriageSummaryDto runTriage(Long datasetId, String runId, int limit) {
        log.info("---Start triage of dataset {} (run {})", datasetId, runId);
        TriageSummaryDto summary;
        try {
            DatasetEntity dataset = datasetStateMachine.require(datasetId);
            List<AnomalyEntity> anomalies = anomalyService.currentPass(dataset);
            progressReporter.report(runId, ProgressStage.TRIAGING, 0, "Selecting anomalies");
            summary = explain(dataset, anomalies, limit, runId);
        } catch (RuntimeException e) {
            fail(datasetId, runId, e);
            throw e;
        }

        if (!summary.getErrors().isEmpty() && summary.getErrors().size() == summary.getAnomaliesAnalyzedByLlm()) {
            String message = "All " + summary.getErrors().size() + " reasoning calls failed; first error: "
                    + summary.getErrors().get(0).getError();
            datasetStateMachine.failTriage(datasetId, message, summary);
            progressReporter.fail(runId, message);
            log.error("Triage of dataset {} failed: {}", datasetId, message);
            throw new ExternalServiceFailureException(message, summary);
        }

        try {
            datasetStateMachine.completeTriage(datasetId, summary);
        } catch (RuntimeException e) {
            fail(datasetId, runId, e);
            throw e;
        }
        progressReporter.report(runId, ProgressStage.COMPLETED, 100, summary.getNote());
        log.info("--- Triage of dataset {} completed: {} created, {} skipped, {} errors", datasetId,
                summary.getExplanationsCreated(), summary.getExplanationsSkipped(), summary.getErrors().size());
        return summary;
    }

    private void fail(Long datasetId, String runId, RuntimeException e) {
        log.error("Triage of dataset {} failed", datasetId, e);
        datasetStateMachine.fail(datasetId, DatasetStatus.TRIAGING, "Triage failed: " + e.getMessage());
        progressReporter.fail(runId, e.getMessage());
    }

    private TriageSummaryDto explain(DatasetEntity dataset, List<AnomalyEntity> anomalies, int limit, String runId) {
        List<AnomalyEntity> selected = triageSelector.select(anomalies, limit);
        Set<Long> explained = explanationService.explainedAmong(selected.stream().map(AnomalyEntity::getId).toList());
        List<AnomalyEntity> pending = selected.stream().filter(anomaly -> !explained.contains(anomaly.getId())).toList();

        int skipped = selected.size() - pending.size();
        int created = 0;
        List<TriageErrorDto> errors = new ArrayList<>();
        int chunkSize = pipelineSettings.triageParallelism();

        for (int start = 0; start < pending.size(); start += chunkSize) {
            List<AnomalyEntity> chunk = pending.subList(start, Math.min(start + chunkSize, pending.size()));
            List<ReasoningCall> calls = new ArrayList<>(chunk.size());
            for (AnomalyEntity anomaly : chunk) {
                calls.add(submit(evidence(dataset, anomaly, runId)));
            }

            // results are consumed in rank order so explanations are stored in rank order
            for (int i = 0; i < chunk.size(); i++) {
                AnomalyEntity anomaly = chunk.get(i);
                ReasoningCall call = calls.get(i);
                String failure = call.getRejection();
                TimedVerdict result = null;
                if (failure == null) {
                    try {
                        result = await(call);
                    } catch (TimeoutException e) {
                        call.getFuture().cancel(true);
                        failure = e.getMessage();
                    } catch (ExecutionException e) {
                        Throwable cause = e.getCause() == null ? e : e.getCause();
                        failure = cause.getMessage();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        call.getFuture().cancel(true);
                        failure = "Interrupted";
                    }
                }
                if (failure != null) {
                    errors.add(error(anomaly, failure));
                } else if (explanationService.save(toExplanation(dataset, anomaly, runId, result))) {
                    created++;
                } else {
                    skipped++;
                }
            }

            if (!datasetStateMachine.touch(dataset.getId(), DatasetStatus.TRIAGING)) {
                throw new InvalidStateException("Triage run " + runId + " lost dataset " + dataset.getId()
                        + ", it is no longer triaging");
            }
            int done = Math.min(start + chunkSize, pending.size());
            progressReporter.report(runId, ProgressStage.TRIAGING, done * 100 / pending.size(),
                    "Analyzed " + done + " of " + pending.size() + " anomalies");
        }

        return TriageSummaryDto.builder()
                .datasetId(dataset.getId())
                .totalAnomaliesDetected(anomalies.size())
                .anomaliesAnalyzedByLlm(selected.size())
                .explanationsCreated(created)
                .explanationsSkipped(skipped)
                .errors(errors)
                .note("Analyzed top " + selected.size() + " of " + anomalies.size() + " total anomalies")
                .build();
    }

    private ReasoningCall submit(AnomalyEvidence evidence) {
        CompletableFuture<Long> started = new CompletableFuture<>();
        try {
            Future<TimedVerdict> future = reasoningCallExecutor.submit(() -> {
                long began = System.nanoTime();
                started.complete(began);
                ReasoningVerdict verdict = reasoningClient.analyze(evidence);
                return new TimedVerdict(verdict, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - began));
            });
            return new ReasoningCall(started, future, null);
        } catch (TaskRejectedException e) {
            return new ReasoningCall(started, null, "Could not be scheduled: " + e.getMessage());
        }
    }

    /**
     * Waits for the call to reach a worker, then gives it the full call timeout
     * counted from the moment it started.
     */
    private TimedVerdict await(ReasoningCall call) throws InterruptedException, ExecutionException, TimeoutException {
        long queueTimeoutMillis = pipelineSettings.triageQueueTimeout().toMillis();
        long callTimeoutMillis = pipelineSettings.triageCallTimeout().toMillis();
        long startedAt;
        try {
            startedAt = call.getStarted().get(queueTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TimeoutException("Not started within " + queueTimeoutMillis + " ms");
        }
        long remaining = startedAt + TimeUnit.MILLISECONDS.toNanos(callTimeoutMillis) - System.nanoTime();
        try {
            return call.getFuture().get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new TimeoutException("Timed out after " + callTimeoutMillis + " ms");
        }
    }

    private static AnomalyEvidence evidence(DatasetEntity dataset, AnomalyEntity anomaly, String runId) {
        return AnomalyEvidence.builder()
                .datasetId(dataset.getId())
                .datasetName(dataset.getOriginalFilename())
                .anomalyId(anomaly.getId())
                .runId(runId)
                .rowIndex(anomaly.getRowIndex())
                .anomalyScore(anomaly.getAnomalyScore())
                .priority(anomaly.getPriority() == null ? null : anomaly.getPriority().name())
                .topFeatures(anomaly.getAnomalousFeatures() == null ? List.of()
                        : anomaly.getAnomalousFeatures().stream().limit(TOP_FEATURES).toList())
                .rawData(anomaly.getRawData())
                .build();
    }

    private static LlmExplanationEntity toExplanation(DatasetEntity dataset, AnomalyEntity anomaly, String runId,
                                                      TimedVerdict result) {
        ReasoningVerdict verdict = result.getVerdict();
        LlmExplanationEntity explanation = new LlmExplanationEntity();
        explanation.setAnomalyId(anomaly.getId());
        explanation.setDatasetId(dataset.getId());
        explanation.setSessionId(runId);
        explanation.setSeverity(verdict.getSeverity());
        explanation.setCategory(verdict.getCategory());
        explanation.setVerdict(verdict.getVerdict());
        explanation.setRecommendation(verdict.getRecommendation());
        explanation.setNotes(verdict.getNotes());
        explanation.setKeyIndicators(verdict.getKeyIndicators());
        explanation.setConfidenceScore(verdict.getConfidence());
        explanation.setModelName(verdict.getModelName());
        explanation.setLatencyMs(result.getLatencyMs());
        return explanation;
    }

    private static TriageErrorDto error(AnomalyEntity anomaly, String message) {
        log.warn("Reasoning call for anomaly {} (row {}) failed: {}", anomaly.getId(), anomaly.getRowIndex(), message);
        return new TriageErrorDto(anomaly.getId(), anomaly.getRowIndex(), message);
    }

    @Getter
    @RequiredArgsConstructor
    private static final class ReasoningCall {
        private final CompletableFuture<Long> started;
        private final Future<TimedVerdict> future;
        private final String rejection;
    }

    @Getter
    @RequiredArgsConstructor
    private static final class TimedVerdict {
        private final ReasoningVerdict verdict;
        private final long latencyMs;
    }
}
