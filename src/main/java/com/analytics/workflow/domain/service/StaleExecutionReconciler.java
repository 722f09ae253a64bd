package com.analytics.workflow.domain.service;

import com.analytics.workflow.config.WorkflowEngineProperties;
import com.analytics.workflow.domain.model.ExecutionError;
import com.analytics.workflow.domain.model.ExecutionStatus;
import com.analytics.workflow.infrastructure.persistence.entity.WorkflowExecutionEntity;
import com.analytics.workflow.infrastructure.persistence.repository.WorkflowExecutionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fails PENDING/RUNNING executions left behind by a crashed process.
 * 
 * A row counts as orphaned when no live run in this process owns it and
 * it has not been updated for workflow-engine.reconciler.stale-minutes.
 * Runs owned here are never touched, however slow.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleExecutionReconciler {
    
    private final WorkflowExecutionRepository executionRepository;
    private final ExecutionRegistry executionRegistry;
    private final WorkflowEngineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    
    @Scheduled(fixedDelayString = "${workflow-engine.reconciler.interval-ms:300000}", initialDelay = 60_000)
    public void scheduledReconcile() {
        if (!properties.getReconciler().isEnabled()) {
            return;
        }
        try {
            reconcile();
        } catch (Exception e) {
            log.error("Stale execution reconcile failed: {}", e.getMessage(), e);
        }
    }
    
    /**
     * @return number of executions moved to FAILED
     */
    @Transactional
    public int reconcile() {
        long staleMinutes = properties.getReconciler().getStaleMinutes();
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofMinutes(staleMinutes));
        
        List<WorkflowExecutionEntity> candidates = executionRepository
                .findByStatusInAndUpdatedAtBefore(WorkflowScheduler.ACTIVE_STATUSES, cutoff);
        
        int failed = 0;
        for (WorkflowExecutionEntity execution : candidates) {
            if (executionRegistry.isActive(execution.getId().toString())) {
                continue;
            }
            
            List<ExecutionError> errors = execution.getErrors() == null
                    ? new ArrayList<>()
                    : new ArrayList<>(execution.getErrors());
            errors.add(ExecutionError.system(
                    "Execution abandoned: no progress for " + staleMinutes + " minutes", now));
            
            execution.setErrors(errors);
            execution.setStatus(execution.getStatus().transitionTo(ExecutionStatus.FAILED));
            execution.setCompletedAt(now);
            if (execution.getStartedAt() != null) {
                execution.setDurationMs(now.toEpochMilli() - execution.getStartedAt().toEpochMilli());
            }
            executionRepository.save(execution);
            failed++;
            
            log.warn("Marked stale execution {} of workflow {} as FAILED (last update: {})",
                    execution.getId(), execution.getWorkflowId(), execution.getUpdatedAt());
        }
        
        if (failed > 0) {
            Counter.builder("workflow.execution.reconciled")
                    .register(meterRegistry)
                    .increment(failed);
        }
        return failed;
    }
}
