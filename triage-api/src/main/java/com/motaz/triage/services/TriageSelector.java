package com.motaz.triage.services;

import com.motaz.triage.model.entities.AnomalyEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Picks the anomalies worth an external reasoning call: highest score first,
 * lower row index first among equal scores, at most {@value #MAX_ANOMALIES}.
 */
@Slf4j
@Component
public class TriageSelector {

    public static final int MIN_ANOMALIES = 1;
    public static final int MAX_ANOMALIES = 500;

    static final Comparator<AnomalyEntity> RANKING = Comparator
            .comparing(AnomalyEntity::getAnomalyScore, Comparator.reverseOrder())
            .thenComparing(AnomalyEntity::getRowIndex);

    public int clamp(int requested) {
        int limit = Math.max(MIN_ANOMALIES, Math.min(MAX_ANOMALIES, requested));
        if (limit != requested) {
            log.warn("maxAnomalies {} is outside [{}, {}], using {}", requested, MIN_ANOMALIES, MAX_ANOMALIES, limit);
        }
        return limit;
    }

    public List<AnomalyEntity> select(List<AnomalyEntity> anomalies, int limit) {
        return anomalies.stream()
                .sorted(RANKING)
                .limit(limit)
                .toList();
    }
}
