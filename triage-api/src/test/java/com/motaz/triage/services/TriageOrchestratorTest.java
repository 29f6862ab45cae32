package com.motaz.triage.services;

import com.motaz.triage.dto.TriageErrorDto;
import com.motaz.triage.dto.TriageStartDto;
import com.motaz.triage.dto.TriageSummaryDto;
import com.motaz.triage.exception.ErrorCode;
import com.motaz.triage.exception.ExternalServiceFailureException;
import com.motaz.triage.exception.InvalidStateException;
import com.motaz.triage.exception.NoAnomaliesException;
import com.motaz.triage.exception.NotFoundException;
import com.motaz.triage.exception.PipelineBusyException;
import com.motaz.triage.model.DatasetStatus;
import com.motaz.triage.model.Severity;
import com.motaz.triage.model.entities.AnomalyEntity;
import com.motaz.triage.model.entities.DatasetEntity;
import com.motaz.triage.model.entities.LlmExplanationEntity;
import com.motaz.triage.reasoning.AnomalyEvidence;
import com.motaz.triage.reasoning.ReasoningClient;
import com.motaz.triage.reasoning.ReasoningException;
import com.motaz.triage.reasoning.ReasoningVerdict;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.motaz.triage.services.TriageSelectorTest.anomaly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TriageOrchestratorTest {

    @Mock
    private DatasetStateMachine datasetStateMachine;
    @Mock
    private AnomalyService anomalyService;
    @Mock
    private ExplanationService explanationService;
    @Mock
    private ReasoningClient reasoningClient;
    @Mock
    private ProgressReporter progressReporter;

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(2);
        lenient().when(datasetStateMachine.touch(anyLong(), eq(DatasetStatus.TRIAGING))).thenReturn(true);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("Should record one failed call and still complete the dataset")
    void shouldContinueAfterOneFailure() {
        DatasetEntity dataset = dataset(DatasetStatus.TRIAGING);
        when(datasetStateMachine.require(1L)).thenReturn(dataset);
        when(anomalyService.currentPass(dataset)).thenReturn(List.of(
                anomaly(1L, 0, 3.0), anomaly(2L, 1, 2.0), anomaly(3L, 2, 1.0)));
        when(reasoningClient.analyze(any())).thenAnswer(invocation -> {
            AnomalyEvidence evidence = invocation.getArgument(0);
            if (evidence.getAnomalyId() == 2L) {
                throw new ReasoningException("upstream 500");
            }
            return verdict();
        });
        when(explanationService.save(any())).thenReturn(true);

        TriageSummaryDto summary = orchestrator(2, Duration.ofSeconds(5)).runTriage(1L, "run-1", 3);

        assertThat(summary.getAnomaliesAnalyzedByLlm()).isEqualTo(3);
        assertThat(summary.getExplanationsCreated()).isEqualTo(2);
        assertThat(summary.getErrors()).hasSize(1);
        assertThat(summary.getErrors().get(0).getAnomalyId()).isEqualTo(2L);
        assertThat(summary.getErrors().get(0).getRowIndex()).isEqualTo(1);
        assertThat(summary.getErrors().get(0).getError()).contains("upstream 500");
        verify(datasetStateMachine).completeTriage(1L, summary);
        verify(datasetStateMachine, never()).fail(any(), any(), any());
    }

    @Test
    @DisplayName("Should persist explanations in rank order")
    void shouldPersistInRankOrder() {
        DatasetEntity dataset = dataset(DatasetStatus.TRIAGING);
        when(datasetStateMachine.require(1L)).thenReturn(dataset);
        when(anomalyService.currentPass(dataset)).thenReturn(List.of(
                anomaly(1L, 5, 1.0), anomaly(2L, 3, 4.0), anomaly(3L, 1, 4.0), anomaly(4L, 0, 2.0)));
        when(reasoningClient.analyze(any())).thenReturn(verdict());
        when(explanationService.save(any())).thenReturn(true);

        orchestrator(2, Duration.ofSeconds(5)).runTriage(1L, "run-1", 4);

        ArgumentCaptor<LlmExplanationEntity> saved = ArgumentCaptor.forClass(LlmExplanationEntity.class);
        verify(explanationService, times(4)).save(saved.capture());
        assertThat(saved.getAllValues()).extracting(LlmExplanationEntity::getAnomalyId).containsExactly(3L, 2L, 4L, 1L);
        assertThat(saved.getAllValues().get(0).getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(saved.getAllValues().get(0).getDatasetId()).isEqualTo(1L);
        assertThat(saved.getAllValues().get(0).getSessionId()).isEqualTo("run-1");
    }

    @Test
    @DisplayName("Should fail the dataset with the partial summary when every selected call fails")
    void shouldFailWhenAllCallsFail() {
        DatasetEntity dataset = dataset(DatasetStatus.TRIAGING);
        when(datasetStateMachine.require(1L)).thenReturn(dataset);
        when(anomalyService.currentPass(dataset)).thenReturn(List.of(anomaly(1L, 0, 3.0), anomaly(2L, 1, 2.0)));
        when(reasoningClient.analyze(any())).thenThrow(new ReasoningException("service down"));

        assertThatThrownBy(() -> orchestrator(1, Duration.ofSeconds(5)).runTriage(1L, "run-1", 2))
                .isInstanceOf(ExternalServiceFailureException.class)
                .hasMessageContaining("service down")
                .satisfies(e -> assertThat(((ExternalServiceFailureException) e).getSummary().getErrors()).hasSize(2));

        ArgumentCaptor<TriageSummaryDto> stored = ArgumentCaptor.forClass(TriageSummaryDto.class);
        verify(datasetStateMachine).failTriage(eq(1L), contains("All 2 reasoning calls failed"), stored.capture());
        assertThat(stored.getValue().getErrors()).hasSize(2);
        verify(datasetStateMachine, never()).completeTriage(any(), any());
        verify(progressReporter).fail(eq("run-1"), contains("service down"));
        verify(explanationService, never()).save(any());
    }

    @Test
    @DisplayName("Should analyze only the top two of 150 anomalies")
    void shouldBoundCallsToTopN() {
        DatasetEntity dataset = dataset(DatasetStatus.TRIAGING);
        List<AnomalyEntity> anomalies = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            anomalies.add(anomaly((long) i + 1, i, 1.0 + i * 0.01));
        }
        when(datasetStateMachine.require(1L)).thenReturn(dataset);
        when(anomalyService.currentPass(dataset)).thenReturn(anomalies);
        when(reasoningClient.analyze(any())).thenReturn(verdict());
        when(explanationService.save(any())).thenReturn(true);

        TriageSummaryDto summary = orchestrator(1, Duration.ofSeconds(5)).runTriage(1L, "run-1", 2);

        assertThat(summary.getTotalAnomaliesDetected()).isEqualTo(150);
        assertThat(summary.getAnomaliesAnalyzedByLlm()).isEqualTo(2);
        assertThat(summary.getExplanationsCreated()).isEqualTo(2);
        assertThat(summary.getNote()).isEqualTo("Analyzed top 2 of 150 total anomalies");
        ArgumentCaptor<AnomalyEvidence> evidence = ArgumentCaptor.forClass(AnomalyEvidence.class);
        verify(reasoningClient, times(2)).analyze(evidence.capture());
        assertThat(evidence.getAllValues()).extracting(AnomalyEvidence::getAnomalyId).containsExactlyInAnyOrder(150L, 149L);
    }

    @Test
    @DisplayName("Should skip anomalies that already have an explanation")
    void shouldSkipExplainedAnomalies() {
        DatasetEntity dataset = dataset(DatasetStatus.TRIAGING);
        when(datasetStateMachine.require(1L)).thenReturn(dataset);
        when(anomalyService.currentPass(dataset)).thenReturn(List.of(anomaly(1L, 0, 3.0), anomaly(2L, 1, 2.0)));
        when(explanationService.explainedAmong(any())).thenReturn(Set.of(1L));
        when(reasoningClient.analyze(any())).thenReturn(verdict());
        when(explanationService.save(any())).thenReturn(true);

        TriageSummaryDto summary = orchestrator(1, Duration.ofSeconds(5)).runTriage(1L, "run-1", 2);

        assertThat(summary.getExplanationsSkipped()).isEqualTo(1);
        assertThat(summary.getExplanationsCreated()).isEqualTo(1);
        assertThat(summary.getErrors()).isEmpty();
        verify(reasoningClient, times(1)).analyze(any());
        verify(datasetStateMachine).completeTriage(1L, summary);
    }

    @Test
    @DisplayName("Should count an explanation written concurrently by another run as skipped")
    void shouldCountDuplicateInsertAsSkipped() {
        DatasetEntity dataset = dataset(DatasetStatus.TRIAGING);
        when(datasetStateMachine.require(1L)).thenReturn(dataset);
        when(anomalyService.currentPass(dataset)).thenReturn(List.of(anomaly(1L, 0, 3.0)));
        when(reasoningClient.analyze(any())).thenReturn(verdict());
        when(explanationService.save(any())).thenReturn(false);

        TriageSummaryDto summary = orchestrator(1, Duration.ofSeconds(5)).runTriage(1L, "run-1", 1);

        assertThat(summary.getExplanationsCreated()).isZero();
        assertThat(summary.getExplanationsSkipped()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should record a call that exceeds the timeout as an error")
    void shouldRecordTimeout() {
        DatasetEntity dataset = dataset(DatasetStatus.TRIAGING);
        when(datasetStateMachine.require(1L)).thenReturn(dataset);
        when(anomalyService.currentPass(dataset)).thenReturn(List.of(anomaly(1L, 0, 3.0), anomaly(2L, 1, 2.0)));
        when(reasoningClient.analyze(any())).thenAnswer(invocation -> {
            AnomalyEvidence evidence = invocation.getArgument(0);
            if (evidence.getAnomalyId() == 1L) {
                Thread.sleep(5_000);
            }
            return verdict();
        });
        when(explanationService.save(any())).thenReturn(true);

        TriageSummaryDto summary = orchestrator(1, Duration.ofMillis(200)).runTriage(1L, "run-1", 2);

        assertThat(summary.getErrors()).hasSize(1);
        assertThat(summary.getErrors().get(0).getAnomalyId()).isEqualTo(1L);
        assertThat(summary.getErrors().get(0).getError()).isEqualTo("Timed out after 200 ms");
        assertThat(summary.getExplanationsCreated()).isEqualTo(1);
        verify(datasetStateMachine).completeTriage(1L, summary);
    }

    @Test
    @DisplayName("Should time each call from its start so two runs sharing one worker both succeed")
    void shouldTimeCallsFromStartAcrossConcurrentRuns() throws Exception {
        DatasetEntity first = dataset(1L, DatasetStatus.TRIAGING);
        DatasetEntity second = dataset(2L, DatasetStatus.TRIAGING);
        when(datasetStateMachine.require(1L)).thenReturn(first);
        when(datasetStateMachine.require(2L)).thenReturn(second);
        when(anomalyService.currentPass(first)).thenReturn(List.of(anomaly(11L, 0, 3.0)));
        when(anomalyService.currentPass(second)).thenReturn(List.of(anomaly(21L, 0, 3.0)));
        when(reasoningClient.analyze(any())).thenAnswer(invocation -> {
            Thread.sleep(500);
            return verdict();
        });
        when(explanationService.save(any())).thenReturn(true);

        ExecutorService singleWorker = Executors.newSingleThreadExecutor();
        ExecutorService runs = Executors.newFixedThreadPool(2);
        try {
            TriageOrchestrator orchestrator = orchestrator(1, Duration.ofMillis(800), Duration.ofSeconds(5),
                    Runnable::run, new TaskExecutorAdapter(singleWorker));

            CompletableFuture<TriageSummaryDto> runA =
                    CompletableFuture.supplyAsync(() -> orchestrator.runTriage(1L, "run-a", 1), runs);
            CompletableFuture<TriageSummaryDto> runB =
                    CompletableFuture.supplyAsync(() -> orchestrator.runTriage(2L, "run-b", 1), runs);

            TriageSummaryDto a = runA.get(10, TimeUnit.SECONDS);
            TriageSummaryDto b = runB.get(10, TimeUnit.SECONDS);
            assertThat(a.getErrors()).isEmpty();
            assertThat(b.getErrors()).isEmpty();
            assertThat(a.getExplanationsCreated() + b.getExplanationsCreated()).isEqualTo(2);
            verify(datasetStateMachine).completeTriage(1L, a);
            verify(datasetStateMachine).completeTriage(2L, b);
        } finally {
            runs.shutdownNow();
            singleWorker.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should record a call that never reaches a worker within the queue timeout")
    void shouldRecordCallThatNeverStarted() {
        DatasetEntity dataset = dataset(DatasetStatus.TRIAGING);
        when(datasetStateMachine.require(1L)).thenReturn(dataset);
        when(anomalyService.currentPass(dataset)).thenReturn(List.of(anomaly(1L, 0, 3.0)));

        ExecutorService singleWorker = Executors.newSingleThreadExecutor();
        CountDownLatch release = new CountDownLatch(1);
        singleWorker.execute(() -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        try {
            TriageOrchestrator orchestrator = orchestrator(1, Duration.ofSeconds(5), Duration.ofMillis(200),
                    Runnable::run, new TaskExecutorAdapter(singleWorker));

            assertThatThrownBy(() -> orchestrator.runTriage(1L, "run-1", 1))
                    .isInstanceOf(ExternalServiceFailureException.class)
                    .satisfies(e -> assertThat(((ExternalServiceFailureException) e).getSummary().getErrors())
                            .extracting(TriageErrorDto::getError)
                            .containsExactly("Not started within 200 ms"));
            verifyNoInteractions(reasoningClient);
        } finally {
            release.countDown();
            singleWorker.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should record a rejected reasoning call as a per-anomaly error and keep going")
    void shouldRecordRejectedCall() {
        DatasetEntity dataset = dataset(DatasetStatus.TRIAGING);
        when(datasetStateMachine.require(1L)).thenReturn(dataset);
        when(anomalyService.currentPass(dataset)).thenReturn(List.of(anomaly(1L, 0, 3.0), anomaly(2L, 1, 2.0)));
        when(reasoningClient.analyze(any())).thenReturn(verdict());
        when(explanationService.save(any())).thenReturn(true);

        AtomicInteger submitted = new AtomicInteger();
        Executor rejectsSecond = task -> {
            if (submitted.getAndIncrement() == 1) {
                throw new RejectedExecutionException("queue full");
            }
            pool.execute(task);
        };

        TriageSummaryDto summary = orchestrator(2, Duration.ofSeconds(5), Duration.ofSeconds(5),
                Runnable::run, new TaskExecutorAdapter(rejectsSecond)).runTriage(1L, "run-1", 2);

        assertThat(summary.getExplanationsCreated()).isEqualTo(1);
        assertThat(summary.getErrors()).hasSize(1);
        assertThat(summary.getErrors().get(0).getAnomalyId()).isEqualTo(2L);
        assertThat(summary.getErrors().get(0).getError()).startsWith("Could not be scheduled");
        verify(datasetStateMachine).completeTriage(1L, summary);
    }

    @Test
    @DisplayName("Should stop the run when the dataset was reclaimed while it was working")
    void shouldAbortWhenHeartbeatIsLost() {
        DatasetEntity dataset = dataset(DatasetStatus.TRIAGING);
        when(datasetStateMachine.require(1L)).thenReturn(dataset);
        when(anomalyService.currentPass(dataset)).thenReturn(List.of(
                anomaly(1L, 0, 3.0), anomaly(2L, 1, 2.0), anomaly(3L, 2, 1.0)));
        when(reasoningClient.analyze(any())).thenReturn(verdict());
        when(explanationService.save(any())).thenReturn(true);
        when(datasetStateMachine.touch(1L, DatasetStatus.TRIAGING)).thenReturn(false);

        assertThatThrownBy(() -> orchestrator(1, Duration.ofSeconds(5)).runTriage(1L, "run-1", 3))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("no longer triaging");

        verify(reasoningClient, times(1)).analyze(any());
        verify(datasetStateMachine, never()).completeTriage(any(), any());
        verify(progressReporter).fail(eq("run-1"), contains("no longer triaging"));
    }

    @Test
    @DisplayName("Should move the dataset to error when persistence breaks mid-run")
    void shouldFailDatasetOnUnexpectedError() {
        DatasetEntity dataset = dataset(DatasetStatus.TRIAGING);
        when(datasetStateMachine.require(1L)).thenReturn(dataset);
        when(anomalyService.currentPass(dataset)).thenReturn(List.of(anomaly(1L, 0, 3.0)));
        when(reasoningClient.analyze(any())).thenReturn(verdict());
        when(explanationService.save(any())).thenThrow(new IllegalStateException("database gone"));

        assertThatThrownBy(() -> orchestrator(1, Duration.ofSeconds(5)).runTriage(1L, "run-1", 1))
                .isInstanceOf(IllegalStateException.class);

        verify(datasetStateMachine).fail(eq(1L), eq(DatasetStatus.TRIAGING), contains("database gone"));
        verify(progressReporter).fail(eq("run-1"), contains("database gone"));
        verify(progressReporter, never()).report(anyString(), eq(ProgressStage.COMPLETED), anyInt(), any());
    }

    @Test
    @DisplayName("Should queue a run and answer with its progress id")
    void shouldQueueRun() {
        DatasetEntity dataset = dataset(DatasetStatus.ANALYZED);
        when(datasetStateMachine.require(1L)).thenReturn(dataset);
        when(anomalyService.currentPass(dataset)).thenReturn(List.of(
                anomaly(1L, 0, 3.0), anomaly(2L, 1, 2.0), anomaly(3L, 2, 1.0)));
        List<Runnable> queued = new ArrayList<>();

        TriageStartDto started = orchestrator(1, Duration.ofSeconds(5), Duration.ofSeconds(5),
                queued::add, new TaskExecutorAdapter(pool)).startTriage(1L, null);

        assertThat(started.getStatus()).isEqualTo(DatasetStatus.TRIAGING);
        assertThat(started.getMaxAnomalies()).isEqualTo(2);
        assertThat(started.getTotalAnomaliesDetected()).isEqualTo(3);
        assertThat(started.getProgressId()).isEqualTo(started.getRunId());
        assertThat(queued).hasSize(1);
        verify(datasetStateMachine).beginTriage(1L, started.getRunId());
        verify(progressReporter).report(started.getRunId(), ProgressStage.QUEUED, 0, "Triage queued");
        verifyNoInteractions(reasoningClient);
    }

    @Test
    @DisplayName("Should record a background failure without surfacing it to the caller")
    void shouldRecordBackgroundFailure() {
        DatasetEntity dataset = dataset(DatasetStatus.ANALYZED);
        when(datasetStateMachine.require(1L)).thenReturn(dataset);
        when(anomalyService.currentPass(dataset)).thenReturn(List.of(anomaly(1L, 0, 3.0)));
        when(reasoningClient.analyze(any())).thenThrow(new ReasoningException("service down"));

        TriageStartDto started = orchestrator(1, Duration.ofSeconds(5)).startTriage(1L, 1);

        verify(datasetStateMachine).failTriage(eq(1L), contains("service down"), any());
        verify(progressReporter).fail(eq(started.getRunId()), contains("service down"));
    }

    @Test
    @DisplayName("Should answer busy and release the dataset when the run queue is full")
    void shouldReportBusyWhenRunIsRejected() {
        DatasetEntity dataset = dataset(DatasetStatus.ANALYZED);
        when(datasetStateMachine.require(1L)).thenReturn(dataset);
        when(anomalyService.currentPass(dataset)).thenReturn(List.of(anomaly(1L, 0, 3.0)));
        TaskExecutor full = task -> {
            throw new TaskRejectedException("run queue full");
        };

        assertThatThrownBy(() -> orchestrator(1, Duration.ofSeconds(5), Duration.ofSeconds(5), full,
                new TaskExecutorAdapter(pool)).startTriage(1L, 1))
                .isInstanceOf(PipelineBusyException.class)
                .satisfies(e -> assertThat(((PipelineBusyException) e).getErrorCode()).isEqualTo(ErrorCode.BUSY));

        verify(datasetStateMachine).fail(eq(1L), eq(DatasetStatus.TRIAGING), contains("could not be queued"));
        verify(progressReporter).fail(anyString(), contains("run queue full"));
        verifyNoInteractions(reasoningClient);
    }

    @Test
    @DisplayName("Should reject triage of a completed dataset without calling the reasoning service")
    void shouldRejectCompletedDataset() {
        when(datasetStateMachine.require(1L)).thenReturn(dataset(DatasetStatus.COMPLETED));

        assertThatThrownBy(() -> orchestrator(1, Duration.ofSeconds(5)).startTriage(1L, 2))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("completed");

        verify(datasetStateMachine, never()).beginTriage(any(), any());
        verifyNoInteractions(reasoningClient, explanationService);
    }

    @Test
    @DisplayName("Should raise NoAnomalies and leave the dataset analyzed when nothing was detected")
    void shouldRejectDatasetWithoutAnomalies() {
        DatasetEntity dataset = dataset(DatasetStatus.ANALYZED);
        when(datasetStateMachine.require(1L)).thenReturn(dataset);
        when(anomalyService.currentPass(dataset)).thenReturn(List.of());

        assertThatThrownBy(() -> orchestrator(1, Duration.ofSeconds(5)).startTriage(1L, 2))
                .isInstanceOf(NoAnomaliesException.class);

        verify(datasetStateMachine, never()).beginTriage(any(), any());
        verify(datasetStateMachine, never()).fail(any(), any(), any());
    }

    @Test
    @DisplayName("Should reclaim only triage runs the conditional update still considers stale")
    void shouldReclaimStaleRuns() {
        DatasetEntity dead = dataset(1L, DatasetStatus.TRIAGING);
        dead.setProgressId("run-dead");
        DatasetEntity revived = dataset(2L, DatasetStatus.TRIAGING);
        revived.setProgressId("run-revived");
        when(datasetStateMachine.findStale(eq(DatasetStatus.TRIAGING), any())).thenReturn(List.of(dead, revived));
        when(datasetStateMachine.failStale(eq(1L), eq(DatasetStatus.TRIAGING), any(), anyString())).thenReturn(true);
        when(datasetStateMachine.failStale(eq(2L), eq(DatasetStatus.TRIAGING), any(), anyString())).thenReturn(false);

        Instant before = Instant.now();
        int reclaimed = orchestrator(1, Duration.ofSeconds(5)).reclaimStaleRuns();

        assertThat(reclaimed).isEqualTo(1);
        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        verify(datasetStateMachine).findStale(eq(DatasetStatus.TRIAGING), cutoff.capture());
        assertThat(cutoff.getValue()).isBeforeOrEqualTo(Instant.now().minus(Duration.ofMinutes(15)))
                .isAfterOrEqualTo(before.minus(Duration.ofMinutes(15)));
        verify(progressReporter).fail(eq("run-dead"), contains("stopped reporting progress"));
        verify(progressReporter, never()).fail(eq("run-revived"), any());
    }

    @Test
    @DisplayName("Should return the stored summary or NotFound before any run finished")
    void shouldReadStoredSummary() {
        DatasetEntity finished = dataset(1L, DatasetStatus.COMPLETED);
        finished.setTriageSummary(TriageSummaryDto.builder().datasetId(1L).explanationsCreated(2).build());
        when(datasetStateMachine.require(1L)).thenReturn(finished);
        when(datasetStateMachine.require(2L)).thenReturn(dataset(2L, DatasetStatus.ANALYZED));

        TriageOrchestrator orchestrator = orchestrator(1, Duration.ofSeconds(5));

        assertThat(orchestrator.getSummary(1L).getExplanationsCreated()).isEqualTo(2);
        assertThatThrownBy(() -> orchestrator.getSummary(2L)).isInstanceOf(NotFoundException.class);
    }

    // ---- Helpers

    private TriageOrchestrator orchestrator(int parallelism, Duration callTimeout) {
        return orchestrator(parallelism, callTimeout, Duration.ofSeconds(5), Runnable::run, new TaskExecutorAdapter(pool));
    }

    private TriageOrchestrator orchestrator(int parallelism, Duration callTimeout, Duration queueTimeout,
                                            TaskExecutor runExecutor, AsyncTaskExecutor callExecutor) {
        PipelineSettings settings = new PipelineSettings(Duration.ofMinutes(30), parallelism, callTimeout, 2,
                queueTimeout, Duration.ofMinutes(15));
        return new TriageOrchestrator(datasetStateMachine, anomalyService, explanationService, new TriageSelector(),
                reasoningClient, progressReporter, settings, runExecutor, callExecutor);
    }

    private static DatasetEntity dataset(DatasetStatus status) {
        return dataset(1L, status);
    }

    private static DatasetEntity dataset(Long id, DatasetStatus status) {
        DatasetEntity dataset = new DatasetEntity();
        dataset.setId(id);
        dataset.setOriginalFilename("events.csv");
        dataset.setStatus(status);
        dataset.setDetectionPass(1);
        return dataset;
    }

    private static ReasoningVerdict verdict() {
        return ReasoningVerdict.builder()
                .severity(Severity.HIGH)
                .category("T1059")
                .verdict("suspicious")
                .recommendation("Isolate the host")
                .notes("Unusual process arguments")
                .confidence(0.8)
                .keyIndicators(List.of("args"))
                .modelName("test-model")
                .build();
    }
}
