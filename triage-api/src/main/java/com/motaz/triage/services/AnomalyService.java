package com.motaz.triage.services;

import com.motaz.triage.dto.AnomalyDto;
import com.motaz.triage.exception.InvalidStateException;
import com.motaz.triage.exception.NotFoundException;
import com.motaz.triage.model.AnomalousFeature;
import com.motaz.triage.model.AnomalyPriority;
import com.motaz.triage.model.AnomalyStatus;
import com.motaz.triage.model.SessionStatus;
import com.motaz.triage.model.entities.AnomalyEntity;
import com.motaz.triage.model.entities.DatasetEntity;
import com.motaz.triage.repositories.AnomalyRepository;
import com.motaz.triage.repositories.LlmExplanationRepository;
import com.motaz.triage.scoring.FeatureError;
import com.motaz.triage.scoring.RowScore;
import com.motaz.triage.scoring.ScoringResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import smile.math.MathEx;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyService {

    private final AnomalyRepository anomalyRepository;
    private final LlmExplanationRepository llmExplanationRepository;
    private final DatasetStateMachine datasetStateMachine;
    private final AnalysisSessionManager analysisSessionManager;

    /**
     * Replaces the dataset's anomalies (and the explanations attached to them)
     * with the result of a new detection pass, then moves the dataset to
     * analyzed. All of it commits or none of it does.
     * <p>
     * The session is closed first: a worker whose session was reclaimed in the
     * meantime gets {@link InvalidStateException} and leaves nothing behind.
     *
     * @return the detection pass number that was committed
     */
    @Transactional
    public int replaceDetectionPass(DatasetEntity dataset, Long sessionId, ScoringResult result) {
        if (!analysisSessionManager.complete(sessionId, SessionStatus.COMPLETED, result.getTotalRows(),
                result.getAnomalies().size(), null)) {
            throw new InvalidStateException("Analysis session " + sessionId + " is no longer active, discarding its result");
        }
        int pass = (dataset.getDetectionPass() == null ? 0 : dataset.getDetectionPass()) + 1;
        int explanationsDropped = llmExplanationRepository.deleteAllByDataset(dataset.getId());
        int anomaliesDropped = anomalyRepository.deleteAllByDataset(dataset.getId());
        if (anomaliesDropped > 0) {
            log.info("Dataset {}: replacing {} anomalies and {} explanations of the previous pass",
                    dataset.getId(), anomaliesDropped, explanationsDropped);
        }

        List<RowScore> rows = result.getAnomalies();
        double[] scores = rows.stream().mapToDouble(RowScore::getScore).toArray();
        double q1 = 0;
        double median = 0;
        double q3 = 0;
        if (scores.length > 0) {
            q1 = MathEx.q1(scores.clone());
            median = MathEx.median(scores.clone());
            q3 = MathEx.q3(scores.clone());
        }

        List<AnomalyEntity> entities = new ArrayList<>(rows.size());
        for (RowScore row : rows) {
            AnomalyEntity entity = new AnomalyEntity();
            entity.setDatasetId(dataset.getId());
            entity.setDetectionPass(pass);
            entity.setRowIndex(row.getRowIndex());
            entity.setAnomalyScore(row.getScore());
            entity.setPriority(AnomalyPriority.of(row.getScore(), q1, median, q3));
            entity.setAnomalousFeatures(toFeatures(row.getFeatures()));
            entity.setRawData(row.getRawData());
            entity.setStatus(AnomalyStatus.DETECTED);
            entities.add(entity);
        }
        anomalyRepository.saveAll(entities);
        datasetStateMachine.commitAnalysis(dataset.getId(), entities.size(), result.getTotalRows(), pass);
        return pass;
    }

    @Transactional(readOnly = true)
    public List<AnomalyEntity> currentPass(DatasetEntity dataset) {
        return anomalyRepository.findAllByDatasetIdAndDetectionPass(dataset.getId(), dataset.getDetectionPass());
    }

    @Transactional(readOnly = true)
    public List<AnomalyDto> listAnomalies(Long datasetId, AnomalyStatus status, Double minScore) {
        DatasetEntity dataset = datasetStateMachine.require(datasetId);
        if (!dataset.getStatus().hasAnomalies()) {
            throw new InvalidStateException("Dataset " + datasetId + " has not been analyzed yet (status "
                    + dataset.getStatus().getValue() + ")");
        }
        return anomalyRepository
                .findAllByDatasetIdAndDetectionPassOrderByAnomalyScoreDescRowIndexAsc(datasetId, dataset.getDetectionPass())
                .stream()
                .filter(anomaly -> status == null || anomaly.getStatus() == status)
                .filter(anomaly -> minScore == null || anomaly.getAnomalyScore() >= minScore)
                .map(AnomalyService::toDto)
                .toList();
    }

    @Transactional(readOnly = true)
    public AnomalyDto getAnomaly(Long anomalyId) {
        return toDto(require(anomalyId));
    }

    @Transactional
    public AnomalyDto updateStatus(Long anomalyId, AnomalyStatus status) {
        AnomalyEntity anomaly = require(anomalyId);
        anomaly.setStatus(status);
        log.info("Anomaly {} marked {}", anomalyId, status.getValue());
        return toDto(anomalyRepository.save(anomaly));
    }

    private AnomalyEntity require(Long anomalyId) {
        return anomalyRepository.findById(anomalyId)
                .orElseThrow(() -> new NotFoundException("Anomaly " + anomalyId + " not found"));
    }

    private static List<AnomalousFeature> toFeatures(List<FeatureError> features) {
        return features.stream()
                .map(feature -> AnomalousFeature.builder()
                        .featureName(feature.getFeatureName())
                        .actualValue(feature.getActualValue())
                        .encodedValue(feature.getEncodedValue())
                        .reconstructionError(feature.getReconstructionError())
                        .build())
                .toList();
    }

    static AnomalyDto toDto(AnomalyEntity anomaly) {
        return AnomalyDto.builder()
                .id(anomaly.getId())
                .datasetId(anomaly.getDatasetId())
                .detectionPass(anomaly.getDetectionPass())
                .rowIndex(anomaly.getRowIndex())
                .anomalyScore(anomaly.getAnomalyScore())
                .priority(anomaly.getPriority())
                .anomalousFeatures(anomaly.getAnomalousFeatures())
                .rawData(anomaly.getRawData())
                .status(anomaly.getStatus())
                .detectedAt(anomaly.getDetectedAt())
                .build();
    }
}
