package com.motaz.triage.model.entities;

import com.motaz.triage.model.SessionStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;

import java.time.Instant;

/**
 * One autoencoder run over a dataset. While the session is processing,
 * {@code activeDatasetId} holds the dataset id; the unique constraint on that
 * column allows a single processing session per dataset.
 */
@Getter
@Setter
@Entity
@Table(name = "t_analysis_session", schema = "public",
        uniqueConstraints = @UniqueConstraint(name = "uq_analysis_session_active", columnNames = "active_dataset_id"),
        indexes = @Index(name = "ix_analysis_session_dataset", columnList = "dataset_id, started_at"))
public class AnalysisSessionEntity {

    @Id
    @Column(name = "id", nullable = false)
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "analysis_session_entity_seq_generator")
    @SequenceGenerator(name = "analysis_session_entity_seq_generator", sequenceName = "analysis_session_id_seq", allocationSize = 100)
    private Long id;

    @Column(name = "dataset_id", nullable = false)
    private Long datasetId;

    @Column(name = "active_dataset_id")
    private Long activeDatasetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private SessionStatus status;

    @Column(name = "progress_id", length = 64)
    private String progressId;

    @Column(name = "rows_analyzed")
    private Integer rowsAnalyzed;

    @Column(name = "anomalies_detected")
    private Integer anomaliesDetected;

    @Column(name = "error_message", length = Integer.MAX_VALUE)
    private String errorMessage;

    @ColumnDefault("now()")
    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @PrePersist
    private void setStartedAt() {
        if (this.startedAt == null) {
            this.startedAt = Instant.now();
        }
    }
}
