package com.motaz.triage.repositories;


import com.motaz.triage.model.Severity;
import com.motaz.triage.model.entities.LlmExplanationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface LlmExplanationRepository extends JpaRepository<LlmExplanationEntity, Long> {

    List<LlmExplanationEntity> findAllByDatasetIdOrderByIdAsc(Long datasetId);

    @Query("SELECT e.anomalyId FROM LlmExplanationEntity e WHERE e.anomalyId IN :anomalyIds")
    List<Long> findExplainedAnomalyIds(@Param("anomalyIds") Collection<Long> anomalyIds);

    boolean existsByAnomalyId(Long anomalyId);

    long countBySeverity(Severity severity);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM LlmExplanationEntity e WHERE e.datasetId = :datasetId")
    int deleteAllByDataset(@Param("datasetId") Long datasetId);
}
