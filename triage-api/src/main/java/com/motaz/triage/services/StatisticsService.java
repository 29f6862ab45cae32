package com.motaz.triage.services;

import com.motaz.triage.dto.StatisticsDto;
import com.motaz.triage.model.AnomalyPriority;
import com.motaz.triage.model.AnomalyStatus;
import com.motaz.triage.model.DatasetStatus;
import com.motaz.triage.model.Severity;
import com.motaz.triage.repositories.AnomalyRepository;
import com.motaz.triage.repositories.DatasetRepository;
import com.motaz.triage.repositories.LlmExplanationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class StatisticsService {

    private final DatasetRepository datasetRepository;
    private final AnomalyRepository anomalyRepository;
    private final LlmExplanationRepository llmExplanationRepository;

    @Transactional(readOnly = true)
    public StatisticsDto getStatistics() {
        Map<String, Long> datasetsByStatus = new LinkedHashMap<>();
        for (DatasetStatus status : DatasetStatus.values()) {
            datasetsByStatus.put(status.getValue(), datasetRepository.countByStatus(status));
        }

        Map<String, Long> anomaliesByPriority = new LinkedHashMap<>();
        for (AnomalyPriority priority : AnomalyPriority.values()) {
            anomaliesByPriority.put(priority.name(), 0L);
        }
        for (Object[] row : anomalyRepository.countGroupByPriority()) {
            if (row[0] != null) {
                anomaliesByPriority.put(((AnomalyPriority) row[0]).name(), ((Number) row[1]).longValue());
            }
        }

        Map<String, Long> anomaliesByStatus = new LinkedHashMap<>();
        for (AnomalyStatus status : AnomalyStatus.values()) {
            anomaliesByStatus.put(status.getValue(), anomalyRepository.countByStatus(status));
        }

        Map<String, Long> explanationsBySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            explanationsBySeverity.put(severity.getValue(), llmExplanationRepository.countBySeverity(severity));
        }

        return StatisticsDto.builder()
                .totalDatasets(datasetRepository.count())
                .datasetsByStatus(datasetsByStatus)
                .totalAnomalies(anomalyRepository.count())
                .anomaliesByPriority(anomaliesByPriority)
                .anomaliesByStatus(anomaliesByStatus)
                .totalExplanations(llmExplanationRepository.count())
                .explanationsBySeverity(explanationsBySeverity)
                .build();
    }
}
