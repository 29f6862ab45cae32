package com.motaz.triage.model.entities;

import com.motaz.triage.model.AnomalousFeature;
import com.motaz.triage.model.AnomalyPriority;
import com.motaz.triage.model.AnomalyStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@Entity
@Table(name = "t_anomaly", schema = "public",
        indexes = @Index(name = "ix_anomaly_dataset_pass", columnList = "dataset_id, detection_pass"))
public class AnomalyEntity {

    @Id
    @Column(name = "id", nullable = false)
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "anomaly_entity_seq_generator")
    @SequenceGenerator(name = "anomaly_entity_seq_generator", sequenceName = "anomaly_id_seq", allocationSize = 100)
    private Long id;

    @Column(name = "dataset_id", nullable = false)
    private Long datasetId;

    @Column(name = "detection_pass", nullable = false)
    private Integer detectionPass;

    @Column(name = "row_index", nullable = false)
    private Integer rowIndex;

    @Column(name = "anomaly_score", nullable = false)
    private Double anomalyScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 8)
    private AnomalyPriority priority;

    @Column(name = "anomalous_features", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private List<AnomalousFeature> anomalousFeatures;

    @Column(name = "raw_data")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, String> rawData;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private AnomalyStatus status = AnomalyStatus.DETECTED;

    @ColumnDefault("now()")
    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @PrePersist
    private void setDetectedAt() {
        this.detectedAt = Instant.now();
    }
}
