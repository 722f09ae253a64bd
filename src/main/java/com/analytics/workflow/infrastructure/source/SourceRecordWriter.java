package com.analytics.workflow.infrastructure.source;

import com.analytics.workflow.domain.model.SourceKey;
import com.analytics.workflow.infrastructure.persistence.entity.SourceRecordEntity;
import com.analytics.workflow.infrastructure.persistence.repository.SourceRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Upserts source records keyed by (tenant, source, externalId).
 * 
 * Shared by the day fetchers and the webhook handler; applying the same
 * record twice leaves one row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceRecordWriter {
    
    private final SourceRecordRepository recordRepository;
    private final ObjectMapper objectMapper;
    
    /**
     * @return number of records written; records without an id are skipped
     */
    @Transactional
    public int upsertAll(String tenantId,
                         SourceKey source,
                         LocalDate recordDate,
                         List<Map<String, Object>> records,
                         String idField,
                         UUID executionId) {
        int written = 0;
        for (Map<String, Object> record : records) {
            Object externalId = record.get(idField);
            if (externalId == null || externalId.toString().isBlank()) {
                log.debug("Skipping {} record without '{}' for tenant {}", source, idField, tenantId);
                continue;
            }
            upsert(tenantId, source, externalId.toString(), recordDate, record, executionId);
            written++;
        }
        return written;
    }
    
    @Transactional
    public SourceRecordEntity upsert(String tenantId,
                                     SourceKey source,
                                     String externalId,
                                     LocalDate recordDate,
                                     Map<String, Object> record,
                                     UUID executionId) {
        String payload = toJson(record);
        
        SourceRecordEntity entity = recordRepository
                .findByTenantIdAndSourceAndExternalId(tenantId, source, externalId)
                .orElseGet(() -> SourceRecordEntity.builder()
                        .tenantId(tenantId)
                        .source(source)
                        .externalId(externalId)
                        .build());
        
        entity.setPayload(payload);
        if (recordDate != null) {
            entity.setRecordDate(recordDate);
        }
        if (executionId != null) {
            entity.setLastExecutionId(executionId);
        }
        return recordRepository.save(entity);
    }
    
    private String toJson(Map<String, Object> record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
