package com.motaz.triage.repositories;


import com.motaz.triage.model.AnomalyStatus;
import com.motaz.triage.model.entities.AnomalyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AnomalyRepository extends JpaRepository<AnomalyEntity, Long> {

    List<AnomalyEntity> findAllByDatasetIdAndDetectionPass(Long datasetId, Integer detectionPass);

    List<AnomalyEntity> findAllByDatasetIdAndDetectionPassOrderByAnomalyScoreDescRowIndexAsc(Long datasetId, Integer detectionPass);

    long countByStatus(AnomalyStatus status);

    @Query("SELECT a.priority, COUNT(a) FROM AnomalyEntity a GROUP BY a.priority")
    List<Object[]> countGroupByPriority();

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM AnomalyEntity a WHERE a.datasetId = :datasetId")
    int deleteAllByDataset(@Param("datasetId") Long datasetId);
}
