package com.motaz.triage.model.entities;

import com.motaz.triage.dto.TriageSummaryDto;
import com.motaz.triage.model.DatasetStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "t_dataset", schema = "public")
public class DatasetEntity {

    @Id
    @Column(name = "id", nullable = false)
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "dataset_entity_seq_generator")
    @SequenceGenerator(name = "dataset_entity_seq_generator", sequenceName = "dataset_id_seq", allocationSize = 100)
    private Long id;

    @Column(name = "filename", nullable = false)
    private String filename;

    @Column(name = "original_filename", nullable = false)
    private String originalFilename;

    @Column(name = "storage_key", nullable = false, length = 1024)
    private String storageKey;

    @Column(name = "file_size", nullable = false)
    private Long fileSize;

    @Column(name = "content_type", length = 128)
    private String contentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private DatasetStatus status;

    @ColumnDefault("0")
    @Column(name = "anomaly_count", nullable = false)
    private Integer anomalyCount = 0;

    @Column(name = "total_rows")
    private Integer totalRows;

    @Column(name = "progress_id", length = 64)
    private String progressId;

    @Column(name = "error_message", length = Integer.MAX_VALUE)
    private String errorMessage;

    @ColumnDefault("0")
    @Column(name = "detection_pass", nullable = false)
    private Integer detectionPass = 0;

    /** Outcome of the latest triage run, kept for callers polling after it finished. */
    @Column(name = "triage_summary")
    @JdbcTypeCode(SqlTypes.JSON)
    private TriageSummaryDto triageSummary;

    @ColumnDefault("now()")
    @Column(name = "uploaded_at", nullable = false)
    private Instant uploadedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "analyzed_at")
    private Instant analyzedAt;

    @Column(name = "triaged_at")
    private Instant triagedAt;

    @PrePersist
    private void setUploadedAt() {
        this.uploadedAt = Instant.now();
        this.updatedAt = this.uploadedAt;
    }

    @PreUpdate
    private void setUpdatedAt() {
        this.updatedAt = Instant.now();
    }
}
