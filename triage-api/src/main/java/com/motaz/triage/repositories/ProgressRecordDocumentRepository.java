package com.motaz.triage.repositories;

import com.motaz.triage.model.documents.ProgressRecordDocument;
import com.redis.om.spring.repository.RedisDocumentRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProgressRecordDocumentRepository extends RedisDocumentRepository<ProgressRecordDocument, String> {
}
