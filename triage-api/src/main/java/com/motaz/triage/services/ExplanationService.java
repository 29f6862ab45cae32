package com.motaz.triage.services;

import com.motaz.triage.dto.ExplanationDto;
import com.motaz.triage.exception.InvalidStateException;
import com.motaz.triage.model.DatasetStatus;
import com.motaz.triage.model.entities.DatasetEntity;
import com.motaz.triage.model.entities.LlmExplanationEntity;
import com.motaz.triage.repositories.LlmExplanationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExplanationService {

    private final LlmExplanationRepository llmExplanationRepository;
    private final DatasetStateMachine datasetStateMachine;

    @Transactional(readOnly = true)
    public List<ExplanationDto> listExplanations(Long datasetId) {
        DatasetEntity dataset = datasetStateMachine.require(datasetId);
        if (dataset.getStatus() != DatasetStatus.COMPLETED) {
            throw new InvalidStateException("Explanations for dataset " + datasetId + " are available once triage completes"
                    + " (status " + dataset.getStatus().getValue() + ")");
        }
        return llmExplanationRepository.findAllByDatasetIdOrderByIdAsc(datasetId).stream()
                .map(ExplanationService::toDto)
                .toList();
    }

    public Set<Long> explainedAmong(Collection<Long> anomalyIds) {
        if (anomalyIds.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(llmExplanationRepository.findExplainedAnomalyIds(anomalyIds));
    }

    /**
     * Stores an explanation unless the anomaly already has one.
     *
     * @return false when another run explained the anomaly first
     */
    public boolean save(LlmExplanationEntity explanation) {
        try {
            llmExplanationRepository.saveAndFlush(explanation);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.info("Anomaly {} already has an explanation, keeping the existing one", explanation.getAnomalyId());
            return false;
        }
    }

    static ExplanationDto toDto(LlmExplanationEntity explanation) {
        return ExplanationDto.builder()
                .id(explanation.getId())
                .anomalyId(explanation.getAnomalyId())
                .datasetId(explanation.getDatasetId())
                .sessionId(explanation.getSessionId())
                .severity(explanation.getSeverity())
                .category(explanation.getCategory())
                .verdict(explanation.getVerdict())
                .recommendation(explanation.getRecommendation())
                .notes(explanation.getNotes())
                .keyIndicators(explanation.getKeyIndicators())
                .confidenceScore(explanation.getConfidenceScore())
                .modelName(explanation.getModelName())
                .latencyMs(explanation.getLatencyMs())
                .createdAt(explanation.getCreatedAt())
                .build();
    }
}
