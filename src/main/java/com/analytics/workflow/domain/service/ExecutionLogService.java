package com.analytics.workflow.domain.service;

import com.analytics.workflow.domain.model.ExecutionEvent;
import com.analytics.workflow.infrastructure.persistence.entity.ExecutionLogEntity;
import com.analytics.workflow.infrastructure.persistence.entity.ExecutionLogEntity.LogLevel;
import com.analytics.workflow.infrastructure.persistence.repository.ExecutionLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Per-execution log: one line for every published event.
 */
@Service
@RequiredArgsConstructor
public class ExecutionLogService implements ExecutionEventSink {
    
    static final int DEFAULT_LIMIT = 100;
    static final int MAX_LIMIT = 1000;
    private static final int MAX_MESSAGE_LENGTH = 2000;
    
    private final ExecutionLogRepository logRepository;
    
    @Override
    @Transactional
    public void accept(ExecutionEvent event) {
        ExecutionLogEntity line = ExecutionLogEntity.builder()
                .executionId(UUID.fromString(event.getExecutionId()))
                .tenantId(event.getTenantId())
                .level(levelOf(event))
                .event(event.getEventKind().getWireName())
                .message(truncate(describe(event)))
                .createdAt(event.getTimestamp())
                .build();
        logRepository.save(line);
    }
    
    /**
     * Most recent lines first.
     */
    @Transactional(readOnly = true)
    public List<ExecutionLogEntity> recent(UUID executionId, Integer limit) {
        int size = limit == null || limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        return logRepository.findByExecutionIdOrderByIdDesc(executionId, PageRequest.of(0, size));
    }
    
    static LogLevel levelOf(ExecutionEvent event) {
        switch (event.getEventKind()) {
            case ERROR:
            case FAILED:
                return LogLevel.ERROR;
            case COMPLETED_WITH_ERRORS:
            case CANCELLED:
                return LogLevel.WARN;
            default:
                return LogLevel.INFO;
        }
    }
    
    static String describe(ExecutionEvent event) {
        Map<String, Object> payload = event.getPayload() == null ? Map.of() : event.getPayload();
        switch (event.getEventKind()) {
            case STARTED:
                return String.format("Execution started for %s to %s (%s days)",
                        payload.get("since"), payload.get("until"), payload.get("totalDays"));
            case DATE_STARTED:
                return String.format("Processing %s (%s/%s)",
                        payload.get("date"), payload.get("dayIndex"), payload.get("totalDays"));
            case PROGRESS:
                return String.format("%s %s: fetched %s, processed %s",
                        payload.get("source"), payload.get("date"), payload.get("fetched"), payload.get("processed"));
            case ERROR:
                return String.format("%s %s failed: %s",
                        payload.get("source"), payload.get("date"), payload.get("message"));
            case DAY_COMPLETED:
                return String.format("Completed %s (%s/%s days)",
                        payload.get("date"), payload.get("daysProcessed"), payload.get("totalDays"));
            case COMPLETED:
            case COMPLETED_WITH_ERRORS:
                return String.format("Execution finished %s with %s errors in %s ms",
                        payload.get("statusLabel"), payload.get("errorCount"), payload.get("durationMs"));
            case FAILED:
                return "Execution failed: " + payload.get("message");
            case CANCELLED:
                return String.format("Execution cancelled after %s/%s days",
                        payload.get("daysProcessed"), payload.get("totalDays"));
            default:
                return event.getEventKind().getWireName();
        }
    }
    
    private static String truncate(String message) {
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH);
    }
}
