package com.motaz.triage.repositories;


import com.motaz.triage.model.SessionStatus;
import com.motaz.triage.model.entities.AnalysisSessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface AnalysisSessionRepository extends JpaRepository<AnalysisSessionEntity, Long> {

    Optional<AnalysisSessionEntity> findFirstByDatasetIdAndStatus(Long datasetId, SessionStatus status);

    Optional<AnalysisSessionEntity> findFirstByDatasetIdOrderByStartedAtDescIdDesc(Long datasetId);

    List<AnalysisSessionEntity> findAllByStatusAndStartedAtBefore(SessionStatus status, Instant startedBefore);

    /**
     * Closes a processing session exactly once and frees the dataset's active slot.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE AnalysisSessionEntity s SET s.status = :outcome, s.activeDatasetId = NULL, s.rowsAnalyzed = :rows, "
            + "s.anomaliesDetected = :anomalies, s.errorMessage = :message, s.completedAt = :now "
            + "WHERE s.id = :id AND s.status = com.motaz.triage.model.SessionStatus.PROCESSING")
    int finish(@Param("id") Long id,
               @Param("outcome") SessionStatus outcome,
               @Param("rows") Integer rows,
               @Param("anomalies") Integer anomalies,
               @Param("message") String message,
               @Param("now") Instant now);
}
