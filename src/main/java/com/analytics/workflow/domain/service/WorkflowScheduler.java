package com.analytics.workflow.domain.service;

import com.analytics.workflow.config.WorkflowEngineProperties;
import com.analytics.workflow.domain.exception.ValidationException;
import com.analytics.workflow.domain.model.ExecutionStatus;
import com.analytics.workflow.domain.model.TenantContext;
import com.analytics.workflow.domain.model.TriggerType;
import com.analytics.workflow.infrastructure.persistence.entity.WorkflowDefinitionEntity;
import com.analytics.workflow.infrastructure.persistence.repository.WorkflowDefinitionRepository;
import com.analytics.workflow.infrastructure.persistence.repository.WorkflowExecutionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * One cron trigger per enabled, scheduled workflow.
 * 
 * Triggers are loaded when the application is ready and re-registered
 * whenever a definition is written. Crons fire in the operating timezone.
 * A fire is skipped while the workflow still has a PENDING or RUNNING
 * execution, so slow runs never pile up.
 * 
 * Accepts 5-field (minute-first) and 6-field (second-first) expressions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkflowScheduler {
    
    static final Set<ExecutionStatus> ACTIVE_STATUSES = EnumSet.of(ExecutionStatus.PENDING, ExecutionStatus.RUNNING);
    
    private final TaskScheduler taskScheduler;
    private final WorkflowDefinitionRepository definitionRepository;
    private final WorkflowExecutionRepository executionRepository;
    private final WorkflowOrchestrator orchestrator;
    private final WorkflowEngineProperties properties;
    private final MeterRegistry meterRegistry;
    
    private final Map<UUID, ScheduledFuture<?>> scheduled = new ConcurrentHashMap<>();
    
    @EventListener(ApplicationReadyEvent.class)
    public void registerAll() {
        if (!properties.getScheduler().isEnabled()) {
            log.info("Workflow scheduler disabled");
            return;
        }
        List<WorkflowDefinitionEntity> definitions = definitionRepository.findByEnabledTrueAndScheduleIsNotNull();
        for (WorkflowDefinitionEntity definition : definitions) {
            try {
                register(definition);
            } catch (ValidationException e) {
                log.error("Skipping schedule of workflow {}: {}", definition.getId(), e.getMessage());
            }
        }
        log.info("Workflow scheduler ready with {} scheduled workflows", scheduled.size());
    }
    
    /**
     * Replaces any existing trigger of the workflow.
     */
    public void register(WorkflowDefinitionEntity definition) {
        unregister(definition.getId());
        if (!properties.getScheduler().isEnabled() || !definition.isEnabled() || !definition.hasSchedule()) {
            return;
        }
        
        String cron = normalizeCron(definition.getSchedule());
        CronTrigger trigger = new CronTrigger(cron, ZoneId.of(properties.getZone()));
        UUID workflowId = definition.getId();
        
        ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(workflowId), trigger);
        if (future != null) {
            scheduled.put(workflowId, future);
        }
        log.info("Scheduled workflow {} with cron '{}' ({})", workflowId, cron, properties.getZone());
    }
    
    public void unregister(UUID workflowId) {
        ScheduledFuture<?> previous = scheduled.remove(workflowId);
        if (previous != null) {
            previous.cancel(false);
            log.info("Unscheduled workflow {}", workflowId);
        }
    }
    
    public boolean isScheduled(UUID workflowId) {
        return scheduled.containsKey(workflowId);
    }
    
    void fire(UUID workflowId) {
        WorkflowDefinitionEntity definition = definitionRepository.findById(workflowId).orElse(null);
        if (definition == null || !definition.isEnabled()) {
            log.info("Workflow {} no longer schedulable, removing trigger", workflowId);
            unregister(workflowId);
            return;
        }
        
        if (executionRepository.existsByWorkflowIdAndStatusIn(workflowId, ACTIVE_STATUSES)) {
            log.info("Skipping scheduled run of workflow {}: previous execution still active", workflowId);
            Counter.builder("workflow.schedule.skipped")
                    .register(meterRegistry)
                    .increment();
            return;
        }
        
        try {
            String executionId = orchestrator.start(
                    definition,
                    TriggerType.SCHEDULED,
                    TenantContext.of(definition.getTenantId(), definition.getTeamId()),
                    null);
            log.info("Scheduled run of workflow {} started as execution {}", workflowId, executionId);
        } catch (Exception e) {
            log.error("Scheduled run of workflow {} failed to start: {}", workflowId, e.getMessage(), e);
        }
    }
    
    /**
     * Turns a 5-field cron into Spring's 6-field form and validates it.
     *
     * @throws ValidationException for anything Spring cannot parse
     */
    public static String normalizeCron(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("Cron schedule is empty");
        }
        String trimmed = expression.trim();
        int fields = trimmed.split("\\s+").length;
        String normalized;
        if (fields == 5) {
            normalized = "0 " + trimmed;
        } else if (fields == 6) {
            normalized = trimmed;
        } else {
            throw new ValidationException("Cron schedule must have 5 or 6 fields: " + expression);
        }
        if (!CronExpression.isValidExpression(normalized)) {
            throw new ValidationException("Invalid cron schedule: " + expression);
        }
        return normalized;
    }
}
