package com.motaz.triage.model.entities;

import com.motaz.triage.model.Severity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;

@Getter
@Setter
@Entity
@Table(name = "t_llm_explanation", schema = "public",
        uniqueConstraints = @UniqueConstraint(name = "uq_llm_explanation_anomaly", columnNames = "anomaly_id"),
        indexes = @Index(name = "ix_llm_explanation_dataset", columnList = "dataset_id"))
public class LlmExplanationEntity {

    @Id
    @Column(name = "id", nullable = false)
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "llm_explanation_entity_seq_generator")
    @SequenceGenerator(name = "llm_explanation_entity_seq_generator", sequenceName = "llm_explanation_id_seq", allocationSize = 100)
    private Long id;

    @Column(name = "anomaly_id", nullable = false)
    private Long anomalyId;

    @Column(name = "dataset_id", nullable = false)
    private Long datasetId;

    @Column(name = "session_id", length = 64)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 8)
    private Severity severity;

    @Column(name = "category", length = 64)
    private String category;

    @Column(name = "verdict", length = 32)
    private String verdict;

    @Column(name = "recommendation", length = Integer.MAX_VALUE)
    private String recommendation;

    @Column(name = "notes", length = Integer.MAX_VALUE)
    private String notes;

    @Column(name = "key_indicators")
    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> keyIndicators;

    @Column(name = "confidence_score")
    private Double confidenceScore;

    @Column(name = "model_name", length = 128)
    private String modelName;

    @Column(name = "latency_ms")
    private Long latencyMs;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    private void setCreatedAt() {
        this.createdAt = Instant.now();
    }
}
