package com.motaz.triage.model.documents;

import com.redis.om.spring.annotations.Document;
import com.redis.om.spring.annotations.Indexed;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;

/** Ephemeral progress of a long running stage, polled by clients. Expires after a day. */
@Data
@Builder
@Document(value = "triage:progress", indexName = "ProgressRecordIdx", timeToLive = 86400)
@NoArgsConstructor
@AllArgsConstructor
public class ProgressRecordDocument {

    @Id
    private String id;                 // progress id (UUID)

    @Indexed
    private String status;
    private Integer progress;
    private String message;
    private String error;
    private Long updatedAt;            // epoch millis
}
