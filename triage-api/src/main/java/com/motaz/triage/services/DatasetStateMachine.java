package com.motaz.triage.services;

import com.motaz.triage.dto.TriageSummaryDto;
import com.motaz.triage.exception.InvalidStateException;
import com.motaz.triage.exception.NotFoundException;
import com.motaz.triage.model.DatasetStatus;
import com.motaz.triage.model.entities.DatasetEntity;
import com.motaz.triage.repositories.DatasetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Owns every dataset status change. Transitions are conditional updates
 * ({@code WHERE status IN (...)}), so two workers racing on the same dataset
 * cannot both win; the loser gets {@link InvalidStateException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetStateMachine {

    private static final Map<DatasetStatus, Set<DatasetStatus>> TRANSITIONS = new EnumMap<>(DatasetStatus.class);

    static {
        TRANSITIONS.put(DatasetStatus.UPLOADED, EnumSet.of(DatasetStatus.ANALYZING, DatasetStatus.ERROR));
        TRANSITIONS.put(DatasetStatus.ANALYZING, EnumSet.of(DatasetStatus.ANALYZED, DatasetStatus.ERROR));
        TRANSITIONS.put(DatasetStatus.ANALYZED, EnumSet.of(DatasetStatus.TRIAGING, DatasetStatus.ERROR));
        TRANSITIONS.put(DatasetStatus.TRIAGING, EnumSet.of(DatasetStatus.COMPLETED, DatasetStatus.ERROR));
        TRANSITIONS.put(DatasetStatus.COMPLETED, EnumSet.noneOf(DatasetStatus.class));
        TRANSITIONS.put(DatasetStatus.ERROR, EnumSet.of(DatasetStatus.ANALYZING));
    }

    static final Set<DatasetStatus> AUTOENCODER_SOURCES = sourcesOf(DatasetStatus.ANALYZING);

    private final DatasetRepository datasetRepository;

    public static boolean canTransition(DatasetStatus from, DatasetStatus to) {
        return TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    /** Every status with a legal edge into {@code target}; the WHERE clause of each conditional update. */
    static Set<DatasetStatus> sourcesOf(DatasetStatus target) {
        Set<DatasetStatus> sources = EnumSet.noneOf(DatasetStatus.class);
        TRANSITIONS.forEach((from, targets) -> {
            if (targets.contains(target)) {
                sources.add(from);
            }
        });
        return Collections.unmodifiableSet(sources);
    }

    public static boolean canStartAutoencoder(DatasetStatus status) {
        return AUTOENCODER_SOURCES.contains(status);
    }

    public DatasetEntity require(Long datasetId) {
        return datasetRepository.findById(datasetId).orElseThrow(() -> NotFoundException.dataset(datasetId));
    }

    public void beginAutoencoder(Long datasetId, String progressId) {
        int updated = datasetRepository.beginStage(datasetId, AUTOENCODER_SOURCES, DatasetStatus.ANALYZING,
                progressId, Instant.now());
        if (updated == 0) {
            throw rejected(datasetId, DatasetStatus.ANALYZING);
        }
        log.info("Dataset {} -> {}", datasetId, DatasetStatus.ANALYZING.getValue());
    }

    /**
     * Commits a finished autoencoder pass. Runs inside the caller's transaction
     * so the status only advances together with the persisted anomalies.
     */
    public void commitAnalysis(Long datasetId, int anomalyCount, int totalRows, int detectionPass) {
        int updated = datasetRepository.commitAnalysis(datasetId, sourcesOf(DatasetStatus.ANALYZED), DatasetStatus.ANALYZED,
                anomalyCount, totalRows, detectionPass, Instant.now());
        if (updated == 0) {
            throw rejected(datasetId, DatasetStatus.ANALYZED);
        }
        log.info("Dataset {} -> {} ({} anomalies in {} rows, pass {})", datasetId,
                DatasetStatus.ANALYZED.getValue(), anomalyCount, totalRows, detectionPass);
    }

    public void beginTriage(Long datasetId, String progressId) {
        int updated = datasetRepository.beginStage(datasetId, sourcesOf(DatasetStatus.TRIAGING), DatasetStatus.TRIAGING,
                progressId, Instant.now());
        if (updated == 0) {
            throw rejected(datasetId, DatasetStatus.TRIAGING);
        }
        log.info("Dataset {} -> {}", datasetId, DatasetStatus.TRIAGING.getValue());
    }

    public void completeTriage(Long datasetId, TriageSummaryDto summary) {
        int updated = datasetRepository.commitTriage(datasetId, sourcesOf(DatasetStatus.COMPLETED), DatasetStatus.COMPLETED,
                summary, Instant.now());
        if (updated == 0) {
            throw rejected(datasetId, DatasetStatus.COMPLETED);
        }
        log.info("Dataset {} -> {}", datasetId, DatasetStatus.COMPLETED.getValue());
    }

    /**
     * Moves the dataset to error if it is still in {@code from}.
     *
     * @return false when the dataset had already left {@code from}
     */
    public boolean fail(Long datasetId, DatasetStatus from, String message) {
        requireErrorEdge(from);
        int updated = datasetRepository.failStage(datasetId, EnumSet.of(from), DatasetStatus.ERROR, message, Instant.now());
        return recordFailure(datasetId, from, message, updated);
    }

    /** Fails a triage run while keeping its partial summary readable. */
    public boolean failTriage(Long datasetId, String message, TriageSummaryDto summary) {
        int updated = datasetRepository.failTriage(datasetId, EnumSet.of(DatasetStatus.TRIAGING), DatasetStatus.ERROR,
                message, summary, Instant.now());
        return recordFailure(datasetId, DatasetStatus.TRIAGING, message, updated);
    }

    /**
     * Heartbeat for a long-running stage.
     *
     * @return false when the dataset is no longer in {@code status}, e.g. after the sweeper reclaimed it
     */
    public boolean touch(Long datasetId, DatasetStatus status) {
        return datasetRepository.touch(datasetId, status, Instant.now()) > 0;
    }

    public List<DatasetEntity> findStale(DatasetStatus status, Instant cutoff) {
        return datasetRepository.findAllByStatusAndUpdatedAtBefore(status, cutoff);
    }

    /**
     * Fails the dataset only if it is still in {@code from} and has not been touched since {@code cutoff}.
     */
    public boolean failStale(Long datasetId, DatasetStatus from, Instant cutoff, String message) {
        requireErrorEdge(from);
        int updated = datasetRepository.failStale(datasetId, EnumSet.of(from), DatasetStatus.ERROR, cutoff, message,
                Instant.now());
        return recordFailure(datasetId, from, message, updated);
    }

    private static void requireErrorEdge(DatasetStatus from) {
        if (!canTransition(from, DatasetStatus.ERROR)) {
            throw new IllegalArgumentException("No transition from " + from.getValue() + " to error");
        }
    }

    private boolean recordFailure(Long datasetId, DatasetStatus from, String message, int updated) {
        if (updated == 0) {
            log.warn("Dataset {} was no longer {} when recording failure: {}", datasetId, from.getValue(), message);
            return false;
        }
        log.info("Dataset {} -> {}: {}", datasetId, DatasetStatus.ERROR.getValue(), message);
        return true;
    }

    private InvalidStateException rejected(Long datasetId, DatasetStatus target) {
        DatasetEntity current = require(datasetId);
        return new InvalidStateException("Dataset " + datasetId + " cannot move from "
                + current.getStatus().getValue() + " to " + target.getValue());
    }
}
