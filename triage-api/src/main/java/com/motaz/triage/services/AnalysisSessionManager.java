package com.motaz.triage.services;

import com.motaz.triage.exception.InvalidStateException;
import com.motaz.triage.exception.NotFoundException;
import com.motaz.triage.model.DatasetStatus;
import com.motaz.triage.model.SessionStatus;
import com.motaz.triage.model.entities.AnalysisSessionEntity;
import com.motaz.triage.repositories.AnalysisSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Keeps at most one processing session per dataset. The insert of a session
 * claims the unique {@code active_dataset_id} slot; whoever loses that insert
 * joins the winner's session instead of starting a second run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisSessionManager {

    private final AnalysisSessionRepository analysisSessionRepository;
    private final DatasetStateMachine datasetStateMachine;
    private final PipelineSettings pipelineSettings;

    public SessionHandle begin(Long datasetId, String progressId) {
        reclaimStaleSessions();

        Optional<AnalysisSessionEntity> running = findInFlight(datasetId);
        if (running.isPresent()) {
            log.info("Dataset {} already has processing session {}", datasetId, running.get().getId());
            return SessionHandle.reused(running.get());
        }

        AnalysisSessionEntity session = new AnalysisSessionEntity();
        session.setDatasetId(datasetId);
        session.setActiveDatasetId(datasetId);
        session.setStatus(SessionStatus.PROCESSING);
        session.setProgressId(progressId);
        try {
            AnalysisSessionEntity saved = analysisSessionRepository.saveAndFlush(session);
            log.info("Started analysis session {} for dataset {}", saved.getId(), datasetId);
            return SessionHandle.created(saved);
        } catch (DataIntegrityViolationException e) {
            log.info("Lost session race for dataset {}, joining the running session", datasetId);
            return findInFlight(datasetId)
                    .map(SessionHandle::reused)
                    .orElseThrow(() -> new InvalidStateException(
                            "Could not start a session for dataset " + datasetId + ", retry the request"));
        }
    }

    public Optional<AnalysisSessionEntity> findInFlight(Long datasetId) {
        return analysisSessionRepository.findFirstByDatasetIdAndStatus(datasetId, SessionStatus.PROCESSING);
    }

    /**
     * Closes a processing session. Applies at most once; later calls for the
     * same session return false.
     */
    public boolean complete(Long sessionId, SessionStatus outcome, Integer rowsAnalyzed, Integer anomaliesDetected,
                            String errorMessage) {
        if (outcome == SessionStatus.PROCESSING) {
            throw new IllegalArgumentException("A session cannot complete as processing");
        }
        int updated = analysisSessionRepository.finish(sessionId, outcome, rowsAnalyzed, anomaliesDetected,
                errorMessage, Instant.now());
        if (updated == 0) {
            log.warn("Session {} was already closed, ignoring {}", sessionId, outcome.getValue());
            return false;
        }
        log.info("Session {} -> {}", sessionId, outcome.getValue());
        return true;
    }

    /**
     * Fails sessions that have been processing longer than the stale window and
     * moves their datasets out of analyzing, so pollers see a terminal state.
     *
     * @return number of sessions reclaimed
     */
    public int reclaimStaleSessions() {
        Instant cutoff = Instant.now().minus(pipelineSettings.staleAfter());
        List<AnalysisSessionEntity> stale = analysisSessionRepository
                .findAllByStatusAndStartedAtBefore(SessionStatus.PROCESSING, cutoff);
        int reclaimed = 0;
        for (AnalysisSessionEntity session : stale) {
            String message = "Analysis session " + session.getId() + " timed out after "
                    + pipelineSettings.staleAfter().toMinutes() + " minutes";
            if (complete(session.getId(), SessionStatus.ERROR, null, null, message)) {
                datasetStateMachine.fail(session.getDatasetId(), DatasetStatus.ANALYZING, message);
                reclaimed++;
            }
        }
        if (reclaimed > 0) {
            log.warn("Reclaimed {} stale analysis session(s)", reclaimed);
        }
        return reclaimed;
    }

    public AnalysisSessionEntity getSession(Long sessionId) {
        return analysisSessionRepository.findById(sessionId)
                .orElseThrow(() -> new NotFoundException("Session " + sessionId + " not found"));
    }

    public AnalysisSessionEntity getLatestSession(Long datasetId) {
        datasetStateMachine.require(datasetId);
        return analysisSessionRepository.findFirstByDatasetIdOrderByStartedAtDescIdDesc(datasetId)
                .orElseThrow(() -> new NotFoundException("Dataset " + datasetId + " has no analysis session"));
    }
}
