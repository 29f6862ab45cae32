package com.motaz.triage.repositories;

import com.motaz.triage.dto.TriageSummaryDto;
import com.motaz.triage.model.DatasetStatus;
import com.motaz.triage.model.entities.DatasetEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Dataset status is only ever changed through the conditional updates below.
 * Each returns the number of rows updated; zero means the dataset was not in
 * one of the expected source states.
 */
@Repository
public interface DatasetRepository extends JpaRepository<DatasetEntity, Long> {

    List<DatasetEntity> findAllByOrderByUploadedAtDesc(Pageable pageable);

    List<DatasetEntity> findAllByStatusOrderByUploadedAtDesc(DatasetStatus status, Pageable pageable);

    long countByStatus(DatasetStatus status);

    List<DatasetEntity> findAllByStatusAndUpdatedAtBefore(DatasetStatus status, Instant updatedBefore);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DatasetEntity d SET d.status = :to, d.progressId = :progressId, d.errorMessage = NULL, d.updatedAt = :now "
            + "WHERE d.id = :id AND d.status IN :from")
    int beginStage(@Param("id") Long id,
                   @Param("from") Collection<DatasetStatus> from,
                   @Param("to") DatasetStatus to,
                   @Param("progressId") String progressId,
                   @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DatasetEntity d SET d.status = :to, d.anomalyCount = :anomalyCount, d.totalRows = :totalRows, "
            + "d.detectionPass = :detectionPass, d.triageSummary = NULL, d.analyzedAt = :now, d.updatedAt = :now "
            + "WHERE d.id = :id AND d.status IN :from")
    int commitAnalysis(@Param("id") Long id,
                       @Param("from") Collection<DatasetStatus> from,
                       @Param("to") DatasetStatus to,
                       @Param("anomalyCount") int anomalyCount,
                       @Param("totalRows") int totalRows,
                       @Param("detectionPass") int detectionPass,
                       @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DatasetEntity d SET d.status = :to, d.triageSummary = :summary, d.triagedAt = :now, d.updatedAt = :now "
            + "WHERE d.id = :id AND d.status IN :from")
    int commitTriage(@Param("id") Long id,
                     @Param("from") Collection<DatasetStatus> from,
                     @Param("to") DatasetStatus to,
                     @Param("summary") TriageSummaryDto summary,
                     @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DatasetEntity d SET d.status = :to, d.errorMessage = :message, d.updatedAt = :now "
            + "WHERE d.id = :id AND d.status IN :from")
    int failStage(@Param("id") Long id,
                  @Param("from") Collection<DatasetStatus> from,
                  @Param("to") DatasetStatus to,
                  @Param("message") String message,
                  @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DatasetEntity d SET d.status = :to, d.errorMessage = :message, d.triageSummary = :summary, "
            + "d.updatedAt = :now WHERE d.id = :id AND d.status IN :from")
    int failTriage(@Param("id") Long id,
                   @Param("from") Collection<DatasetStatus> from,
                   @Param("to") DatasetStatus to,
                   @Param("message") String message,
                   @Param("summary") TriageSummaryDto summary,
                   @Param("now") Instant now);

    /**
     * Fails a dataset only if it has not been touched since {@code cutoff}, so
     * a run that is still heartbeating is never reclaimed.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DatasetEntity d SET d.status = :to, d.errorMessage = :message, d.updatedAt = :now "
            + "WHERE d.id = :id AND d.status IN :from AND d.updatedAt < :cutoff")
    int failStale(@Param("id") Long id,
                  @Param("from") Collection<DatasetStatus> from,
                  @Param("to") DatasetStatus to,
                  @Param("cutoff") Instant cutoff,
                  @Param("message") String message,
                  @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DatasetEntity d SET d.updatedAt = :now WHERE d.id = :id AND d.status = :status")
    int touch(@Param("id") Long id,
              @Param("status") DatasetStatus status,
              @Param("now") Instant now);
}
