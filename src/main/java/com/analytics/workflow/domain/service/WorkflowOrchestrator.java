package com.analytics.workflow.domain.service;

import com.analytics.workflow.config.WorkflowEngineProperties;
import com.analytics.workflow.domain.exception.SourceFetchException;
import com.analytics.workflow.domain.exception.SourceProcessException;
import com.analytics.workflow.domain.exception.ValidationException;
import com.analytics.workflow.domain.model.DateRangeSpec;
import com.analytics.workflow.domain.model.ExecutionContext;
import com.analytics.workflow.domain.model.ExecutionEvent;
import com.analytics.workflow.domain.model.ExecutionEventKind;
import com.analytics.workflow.domain.model.ExecutionProgress;
import com.analytics.workflow.domain.model.ExecutionSnapshot;
import com.analytics.workflow.domain.model.ExecutionStatus;
import com.analytics.workflow.domain.model.SourceKey;
import com.analytics.workflow.domain.model.SourcePlan;
import com.analytics.workflow.domain.model.TenantContext;
import com.analytics.workflow.domain.model.TriggerType;
import com.analytics.workflow.domain.model.WorkflowConfig;
import com.analytics.workflow.domain.service.ExecutionRegistry.ActiveExecution;
import com.analytics.workflow.infrastructure.cache.ExecutionProgressCache;
import com.analytics.workflow.infrastructure.persistence.entity.WorkflowDefinitionEntity;
import com.analytics.workflow.infrastructure.persistence.repository.WorkflowDefinitionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives one workflow execution from PENDING to a terminal state.
 * 
 * Flow:
 * 1. start() stores the PENDING record and returns its id right away;
 *    the run continues on the execution pool
 * 2. Config and date range are resolved; failure or no days ends the run
 *    FAILED with one "system" error
 * 3. PENDING -> RUNNING, "started" published
 * 4. Days in ascending order. Every enabled source covering the day runs
 *    as its own task on the source pool (limiter, fetch, process). Results
 *    are recorded in fixed order, ads then POS, so the event stream is
 *    deterministic. A failed (day, source) is recorded and the run goes on
 * 5. After all sources of a day: daysProcessed++, "day_completed"
 * 6. COMPLETED ("completed" or "completed_with_errors")
 * 
 * Cancellation is cooperative and checked at day and source boundaries.
 * In-flight fetches finish first and their results are discarded. An
 * explicit cancel ends CANCELLED; a definition deleted mid-run ends FAILED.
 */
@Slf4j
@Service
public class WorkflowOrchestrator {
    
    static final String DEFINITION_DELETED = "Workflow definition was deleted during execution";
    
    private final WorkflowConfigParser configParser;
    private final DateRangeResolver dateRangeResolver;
    private final SourceFetcherRegistry fetcherRegistry;
    private final ExecutionStore executionStore;
    private final ExecutionEventPublisher eventPublisher;
    private final ExecutionRegistry executionRegistry;
    private final WorkflowDefinitionRepository definitionRepository;
    private final ExecutionProgressCache progressCache;
    private final WorkflowEngineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Executor executionExecutor;
    private final Executor sourceExecutor;
    private final Sleeper sleeper;
    
    @Autowired
    public WorkflowOrchestrator(WorkflowConfigParser configParser,
                                DateRangeResolver dateRangeResolver,
                                SourceFetcherRegistry fetcherRegistry,
                                ExecutionStore executionStore,
                                ExecutionEventPublisher eventPublisher,
                                ExecutionRegistry executionRegistry,
                                WorkflowDefinitionRepository definitionRepository,
                                ExecutionProgressCache progressCache,
                                WorkflowEngineProperties properties,
                                MeterRegistry meterRegistry,
                                Clock clock,
                                @Qualifier("executionExecutor") Executor executionExecutor,
                                @Qualifier("sourceExecutor") Executor sourceExecutor) {
        this(configParser, dateRangeResolver, fetcherRegistry, executionStore, eventPublisher,
                executionRegistry, definitionRepository, progressCache, properties, meterRegistry,
                clock, executionExecutor, sourceExecutor, Sleeper.THREAD);
    }
    
    public WorkflowOrchestrator(WorkflowConfigParser configParser,
                                DateRangeResolver dateRangeResolver,
                                SourceFetcherRegistry fetcherRegistry,
                                ExecutionStore executionStore,
                                ExecutionEventPublisher eventPublisher,
                                ExecutionRegistry executionRegistry,
                                WorkflowDefinitionRepository definitionRepository,
                                ExecutionProgressCache progressCache,
                                WorkflowEngineProperties properties,
                                MeterRegistry meterRegistry,
                                Clock clock,
                                Executor executionExecutor,
                                Executor sourceExecutor,
                                Sleeper sleeper) {
        this.configParser = configParser;
        this.dateRangeResolver = dateRangeResolver;
        this.fetcherRegistry = fetcherRegistry;
        this.executionStore = executionStore;
        this.eventPublisher = eventPublisher;
        this.executionRegistry = executionRegistry;
        this.definitionRepository = definitionRepository;
        this.progressCache = progressCache;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.executionExecutor = executionExecutor;
        this.sourceExecutor = sourceExecutor;
        this.sleeper = sleeper;
    }
    
    /**
     * Creates the PENDING execution and hands the run to the execution pool.
     *
     * @param rangeOverride replaces every source's range for this run, or null
     * @return id of the new execution
     * @throws com.analytics.workflow.domain.exception.PersistenceException if the record cannot be created
     */
    public String start(WorkflowDefinitionEntity definition,
                        TriggerType triggerType,
                        TenantContext tenant,
                        DateRangeSpec rangeOverride) {
        String executionId = UUID.randomUUID().toString();
        String teamId = tenant.getTeamId() != null ? tenant.getTeamId() : definition.getTeamId();
        ExecutionContext context = new ExecutionContext(
                executionId,
                definition.getId().toString(),
                TenantContext.of(tenant.getTenantId(), teamId));
        
        ExecutionTracker tracker = new ExecutionTracker(
                context,
                triggerType,
                executionStore,
                clock,
                properties.getPersistence().getMaxAttempts(),
                properties.getPersistence().getRetryDelayMs(),
                sleeper);
        tracker.create();
        
        ActiveExecution active = executionRegistry.register(tracker);
        
        Counter.builder("workflow.execution.started")
                .tag("trigger", triggerType.name())
                .register(meterRegistry)
                .increment();
        
        log.info("Execution {} created for workflow {} (tenant: {}, trigger: {})",
                executionId, context.getWorkflowId(), context.getTenantId(), triggerType);
        
        String configJson = definition.getConfig();
        try {
            executionExecutor.execute(() -> run(active, configJson, rangeOverride));
        } catch (RejectedExecutionException e) {
            log.error("Execution {} could not be scheduled: {}", executionId, e.getMessage(), e);
            tracker.recordSystemError("Execution could not be scheduled: " + e.getMessage());
            ExecutionSnapshot failed = tracker.finish(ExecutionStatus.FAILED);
            executionRegistry.remove(executionId);
            publishTerminal(context, failed, null);
        }
        
        return executionId;
    }
    
    void run(ActiveExecution active, String configJson, DateRangeSpec rangeOverride) {
        ExecutionTracker tracker = active.getTracker();
        ExecutionContext context = tracker.getContext();
        Timer.Sample sample = Timer.start(meterRegistry);
        
        try {
            if (active.isCancelRequested()) {
                stop(tracker, StopReason.CANCELLED);
                return;
            }
            
            ExecutionPlan plan;
            try {
                plan = plan(configJson, rangeOverride);
            } catch (ValidationException e) {
                log.warn("Execution {} cannot start: {}", context.getExecutionId(), e.getMessage());
                tracker.recordSystemError(e.getMessage());
                publishTerminal(context, tracker.finish(ExecutionStatus.FAILED), null);
                return;
            }
            
            ExecutionSnapshot running = tracker.markRunning(
                    plan.days.get(0),
                    plan.days.get(plan.days.size() - 1),
                    plan.days.size(),
                    plan.sourceTotals());
            publish(context, ExecutionEventKind.STARTED, payload(
                    "since", running.getSince().toString(),
                    "until", running.getUntil().toString(),
                    "totalDays", running.getTotalDays(),
                    "sources", plan.sourceKeys(),
                    "triggerType", running.getTriggerType().name()));
            cacheProgress(running);
            
            log.info("Execution {} running: {} days ({} to {}), sources {}",
                    context.getExecutionId(), running.getTotalDays(),
                    running.getSince(), running.getUntil(), plan.sourceKeys());
            
            SourceRateLimiter limiter = new SourceRateLimiter(plan.delays, System::nanoTime, sleeper);
            
            int dayIndex = 0;
            for (LocalDate day : plan.days) {
                dayIndex++;
                
                StopReason stopReason = checkStop(active, context);
                if (stopReason != null) {
                    stop(tracker, stopReason);
                    return;
                }
                
                publish(context, ExecutionEventKind.DATE_STARTED, payload(
                        "date", day.toString(),
                        "dayIndex", dayIndex,
                        "totalDays", plan.days.size()));
                
                List<CompletableFuture<SourceOutcome>> tasks = new ArrayList<>();
                for (SourceKey source : plan.sourcesFor(day)) {
                    SourceFetcher fetcher = plan.fetchers.get(source);
                    tasks.add(CompletableFuture.supplyAsync(
                            () -> runSource(active, fetcher, limiter, context, day), sourceExecutor));
                }
                
                List<SourceOutcome> outcomes = new ArrayList<>();
                for (CompletableFuture<SourceOutcome> task : tasks) {
                    outcomes.add(task.join());
                }
                
                stopReason = checkStop(active, context);
                if (stopReason != null) {
                    log.info("Execution {} stopping ({}), discarding results of {}",
                            context.getExecutionId(), stopReason, day);
                    stop(tracker, stopReason);
                    return;
                }
                
                for (SourceOutcome outcome : outcomes) {
                    record(tracker, context, outcome);
                }
                
                ExecutionSnapshot afterDay = tracker.advanceDay(day);
                publish(context, ExecutionEventKind.DAY_COMPLETED, payload(
                        "date", day.toString(),
                        "daysProcessed", afterDay.getDaysProcessed(),
                        "totalDays", afterDay.getTotalDays(),
                        "errorCount", afterDay.getErrors().size()));
                cacheProgress(afterDay);
            }
            
            publishTerminal(context, tracker.finish(ExecutionStatus.COMPLETED), null);
            
        } catch (Exception e) {
            log.error("Execution {} failed unexpectedly: {}", context.getExecutionId(), e.getMessage(), e);
            if (!tracker.getStatus().isTerminal()) {
                tracker.recordSystemError("Unexpected error: " + e.getMessage());
                publishTerminal(context, tracker.finish(ExecutionStatus.FAILED), null);
            }
        } finally {
            executionRegistry.remove(context.getExecutionId());
            sample.stop(Timer.builder("workflow.execution.duration")
                    .tag("status", tracker.snapshot().getStatusLabel())
                    .register(meterRegistry));
        }
    }
    
    /**
     * Resolves config and day lists. A source runs only on days of its own
     * range; the execution covers the ascending union of all of them.
     */
    ExecutionPlan plan(String configJson, DateRangeSpec rangeOverride) {
        WorkflowConfig config = configParser.parse(configJson);
        LocalDate today = dateRangeResolver.today();
        
        ExecutionPlan plan = new ExecutionPlan();
        TreeSet<LocalDate> union = new TreeSet<>();
        
        for (SourcePlan sourcePlan : config.getEnabledPlans()) {
            SourceKey source = sourcePlan.getSource();
            SourceFetcher fetcher = fetcherRegistry.find(source)
                    .orElseThrow(() -> new ValidationException("No fetcher registered for source " + source));
            
            DateRangeSpec range = rangeOverride != null ? rangeOverride : sourcePlan.getDateRange();
            List<LocalDate> days = dateRangeResolver.resolve(range, today);
            
            plan.sourceDays.put(source, new TreeSet<>(days));
            plan.delays.put(source, sourcePlan.getMinDelayMs());
            plan.fetchers.put(source, fetcher);
            union.addAll(days);
        }
        
        if (union.isEmpty()) {
            throw new ValidationException("Date range resolved to no days");
        }
        plan.days = new ArrayList<>(union);
        return plan;
    }
    
    private SourceOutcome runSource(ActiveExecution active,
                                    SourceFetcher fetcher,
                                    SourceRateLimiter limiter,
                                    ExecutionContext context,
                                    LocalDate day) {
        SourceKey source = fetcher.source();
        if (active.isCancelRequested()) {
            return SourceOutcome.skipped(source, day);
        }
        
        limiter.acquire(source);
        if (active.isCancelRequested()) {
            return SourceOutcome.skipped(source, day);
        }
        
        List<Map<String, Object>> records;
        try {
            records = fetcher.fetch(context, day);
        } catch (Exception e) {
            SourceFetchException failure = new SourceFetchException(source, day, e.getMessage(), e);
            log.warn("Execution {}: {}", context.getExecutionId(), failure.getMessage());
            return SourceOutcome.failed(source, day, failure.getMessage());
        }
        
        int fetched = records == null ? 0 : records.size();
        try {
            int processed = fetched == 0 ? 0 : fetcher.process(context, day, records);
            return SourceOutcome.succeeded(source, day, fetched, processed);
        } catch (Exception e) {
            SourceProcessException failure = new SourceProcessException(source, day, e.getMessage(), e);
            log.warn("Execution {}: {}", context.getExecutionId(), failure.getMessage());
            return SourceOutcome.failed(source, day, failure.getMessage());
        }
    }
    
    private void record(ExecutionTracker tracker, ExecutionContext context, SourceOutcome outcome) {
        if (outcome.skipped) {
            return;
        }
        
        if (outcome.error == null) {
            ExecutionSnapshot snapshot = tracker.recordSuccess(
                    outcome.source, outcome.day, outcome.fetched, outcome.processed);
            Counter.builder("workflow.execution.records")
                    .tag("source", outcome.source.getKey())
                    .register(meterRegistry)
                    .increment(outcome.fetched);
            publish(context, ExecutionEventKind.PROGRESS, payload(
                    "date", outcome.day.toString(),
                    "source", outcome.source.getKey(),
                    "fetched", outcome.fetched,
                    "processed", outcome.processed,
                    "daysProcessed", snapshot.getDaysProcessed(),
                    "totalDays", snapshot.getTotalDays()));
        } else {
            tracker.recordError(outcome.source, outcome.day, outcome.error);
            Counter.builder("workflow.execution.source.errors")
                    .tag("source", outcome.source.getKey())
                    .register(meterRegistry)
                    .increment();
            publish(context, ExecutionEventKind.ERROR, payload(
                    "date", outcome.day.toString(),
                    "source", outcome.source.getKey(),
                    "message", outcome.error));
        }
    }
    
    private StopReason checkStop(ActiveExecution active, ExecutionContext context) {
        if (active.isCancelRequested()) {
            return StopReason.CANCELLED;
        }
        try {
            if (!definitionRepository.existsById(UUID.fromString(context.getWorkflowId()))) {
                return StopReason.DEFINITION_DELETED;
            }
        } catch (RuntimeException e) {
            log.warn("Execution {}: could not check workflow {} still exists: {}",
                    context.getExecutionId(), context.getWorkflowId(), e.getMessage());
        }
        return null;
    }
    
    private void stop(ExecutionTracker tracker, StopReason reason) {
        ExecutionContext context = tracker.getContext();
        ExecutionSnapshot stopped;
        if (reason == StopReason.CANCELLED) {
            stopped = tracker.finish(ExecutionStatus.CANCELLED);
        } else {
            tracker.recordSystemError(DEFINITION_DELETED);
            stopped = tracker.finish(ExecutionStatus.FAILED);
        }
        log.info("Execution {} stopped: {} after {}/{} days",
                context.getExecutionId(), reason, stopped.getDaysProcessed(), stopped.getTotalDays());
        publishTerminal(context, stopped, reason);
    }
    
    private void publishTerminal(ExecutionContext context, ExecutionSnapshot snapshot, StopReason reason) {
        ExecutionEventKind kind;
        Map<String, Object> payload;
        switch (snapshot.getStatus()) {
            case COMPLETED:
                kind = snapshot.getErrors().isEmpty()
                        ? ExecutionEventKind.COMPLETED
                        : ExecutionEventKind.COMPLETED_WITH_ERRORS;
                payload = payload(
                        "statusLabel", snapshot.getStatusLabel(),
                        "daysProcessed", snapshot.getDaysProcessed(),
                        "totalDays", snapshot.getTotalDays(),
                        "errorCount", snapshot.getErrors().size(),
                        "durationMs", snapshot.getDurationMs());
                break;
            case CANCELLED:
                kind = ExecutionEventKind.CANCELLED;
                payload = payload(
                        "daysProcessed", snapshot.getDaysProcessed(),
                        "totalDays", snapshot.getTotalDays(),
                        "reason", reason == null ? "cancelled" : reason.name().toLowerCase(Locale.ROOT));
                break;
            default:
                kind = ExecutionEventKind.FAILED;
                String message = snapshot.getErrors().isEmpty()
                        ? "Execution failed"
                        : snapshot.getErrors().get(snapshot.getErrors().size() - 1).getMessage();
                payload = payload(
                        "message", message,
                        "daysProcessed", snapshot.getDaysProcessed(),
                        "totalDays", snapshot.getTotalDays(),
                        "errorCount", snapshot.getErrors().size(),
                        "stateInconsistent", snapshot.isStateInconsistent());
                break;
        }
        
        publish(context, kind, payload);
        cacheProgress(snapshot);
        
        Counter.builder("workflow.execution.finished")
                .tag("status", snapshot.getStatusLabel())
                .register(meterRegistry)
                .increment();
        
        log.info("Execution {} finished {} ({}/{} days, {} errors)",
                context.getExecutionId(), snapshot.getStatusLabel(),
                snapshot.getDaysProcessed(), snapshot.getTotalDays(), snapshot.getErrors().size());
    }
    
    private void publish(ExecutionContext context, ExecutionEventKind kind, Map<String, Object> payload) {
        eventPublisher.publish(ExecutionEvent.builder()
                .executionId(context.getExecutionId())
                .tenantId(context.getTenantId())
                .teamId(context.getTeamId())
                .timestamp(clock.instant())
                .eventKind(kind)
                .payload(payload)
                .build());
    }
    
    private void cacheProgress(ExecutionSnapshot snapshot) {
        try {
            progressCache.put(ExecutionProgress.from(snapshot, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Progress cache write failed for execution {}: {}", snapshot.getExecutionId(), e.getMessage());
        }
    }
    
    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            payload.put((String) keyValues[i], keyValues[i + 1]);
        }
        return payload;
    }
    
    enum StopReason {
        CANCELLED,
        DEFINITION_DELETED
    }
    
    static final class ExecutionPlan {
        
        private List<LocalDate> days = new ArrayList<>();
        private final Map<SourceKey, Set<LocalDate>> sourceDays = new EnumMap<>(SourceKey.class);
        private final Map<SourceKey, Long> delays = new EnumMap<>(SourceKey.class);
        private final Map<SourceKey, SourceFetcher> fetchers = new EnumMap<>(SourceKey.class);
        
        List<LocalDate> getDays() {
            return days;
        }
        
        /**
         * Sources planned for the day, in fixed source order.
         */
        List<SourceKey> sourcesFor(LocalDate day) {
            List<SourceKey> sources = new ArrayList<>();
            sourceDays.forEach((source, sourceDayList) -> {
                if (sourceDayList.contains(day)) {
                    sources.add(source);
                }
            });
            return sources;
        }
        
        Map<SourceKey, Integer> sourceTotals() {
            Map<SourceKey, Integer> totals = new EnumMap<>(SourceKey.class);
            sourceDays.forEach((source, sourceDayList) -> totals.put(source, sourceDayList.size()));
            return totals;
        }
        
        List<String> sourceKeys() {
            List<String> keys = new ArrayList<>();
            sourceDays.keySet().forEach(source -> keys.add(source.getKey()));
            return keys;
        }
    }
    
    private static final class SourceOutcome {
        
        private final SourceKey source;
        private final LocalDate day;
        private final long fetched;
        private final long processed;
        private final String error;
        private final boolean skipped;
        
        private SourceOutcome(SourceKey source, LocalDate day, long fetched, long processed,
                              String error, boolean skipped) {
            this.source = source;
            this.day = day;
            this.fetched = fetched;
            this.processed = processed;
            this.error = error;
            this.skipped = skipped;
        }
        
        static SourceOutcome succeeded(SourceKey source, LocalDate day, long fetched, long processed) {
            return new SourceOutcome(source, day, fetched, processed, null, false);
        }
        
        static SourceOutcome failed(SourceKey source, LocalDate day, String error) {
            return new SourceOutcome(source, day, 0, 0, error, false);
        }
        
        static SourceOutcome skipped(SourceKey source, LocalDate day) {
            return new SourceOutcome(source, day, 0, 0, null, true);
        }
    }
}
