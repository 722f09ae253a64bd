package com.analytics.workflow.domain.service;

import com.analytics.workflow.domain.exception.PersistenceException;
import com.analytics.workflow.domain.model.ExecutionContext;
import com.analytics.workflow.domain.model.ExecutionError;
import com.analytics.workflow.domain.model.ExecutionSnapshot;
import com.analytics.workflow.domain.model.ExecutionStatus;
import com.analytics.workflow.domain.model.SourceCounters;
import com.analytics.workflow.domain.model.SourceKey;
import com.analytics.workflow.domain.model.TriggerType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single owner of one execution's mutable record.
 * 
 * Every mutation runs under one lock, builds a fresh snapshot and writes
 * it through {@link ExecutionStore}. Failed writes are retried up to
 * maxAttempts times:
 * - intermediate write still failing: logged, the run carries on and the
 *   next mutation writes the newer state anyway
 * - initial write failing: PersistenceException, the run never starts
 * - final write failing: the record becomes FAILED with stateInconsistent
 *   set, and one more best-effort write of that marker is made
 * 
 * Once terminal the record is frozen; later mutations are ignored.
 */
@Slf4j
public class ExecutionTracker {
    
    private final ReentrantLock lock = new ReentrantLock();
    
    private final ExecutionStore store;
    private final Clock clock;
    private final int maxAttempts;
    private final long retryDelayMs;
    private final Sleeper sleeper;
    
    private final ExecutionContext context;
    private final TriggerType triggerType;
    private final Instant createdAt;
    
    private ExecutionStatus status = ExecutionStatus.PENDING;
    private LocalDate since;
    private LocalDate until;
    private int totalDays;
    private int daysProcessed;
    private LocalDate currentDate;
    private final Map<SourceKey, SourceCounters> sources = new EnumMap<>(SourceKey.class);
    private final List<ExecutionError> errors = new ArrayList<>();
    private Instant startedAt;
    private Instant completedAt;
    private boolean stateInconsistent;
    
    public ExecutionTracker(ExecutionContext context,
                            TriggerType triggerType,
                            ExecutionStore store,
                            Clock clock,
                            int maxAttempts,
                            long retryDelayMs,
                            Sleeper sleeper) {
        this.context = context;
        this.triggerType = triggerType;
        this.store = store;
        this.clock = clock;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryDelayMs = Math.max(0, retryDelayMs);
        this.sleeper = sleeper;
        this.createdAt = clock.instant();
    }
    
    public ExecutionContext getContext() {
        return context;
    }
    
    /**
     * Writes the initial PENDING record.
     *
     * @throws PersistenceException when the record cannot be stored
     */
    public ExecutionSnapshot create() {
        lock.lock();
        try {
            ExecutionSnapshot snapshot = buildSnapshot();
            RuntimeException failure = persistWithRetry(snapshot);
            if (failure != null) {
                throw new PersistenceException(
                        "Could not create execution record " + context.getExecutionId(), failure);
            }
            return snapshot;
        } finally {
            lock.unlock();
        }
    }
    
    public ExecutionSnapshot markRunning(LocalDate since,
                                         LocalDate until,
                                         int totalDays,
                                         Map<SourceKey, Integer> sourceTotals) {
        lock.lock();
        try {
            status = status.transitionTo(ExecutionStatus.RUNNING);
            this.since = since;
            this.until = until;
            this.totalDays = totalDays;
            this.startedAt = clock.instant();
            sourceTotals.forEach((source, total) ->
                    sources.put(source, SourceCounters.builder().total(total).build()));
            return commit();
        } finally {
            lock.unlock();
        }
    }
    
    public ExecutionSnapshot recordSuccess(SourceKey source, LocalDate day, long fetched, long processed) {
        lock.lock();
        try {
            if (status != ExecutionStatus.RUNNING) {
                log.debug("Ignoring {} result for {} on execution {} in state {}",
                        source, day, context.getExecutionId(), status);
                return buildSnapshot();
            }
            SourceCounters counters = sources.computeIfAbsent(source, key -> new SourceCounters());
            counters.setFetched(counters.getFetched() + Math.max(0, fetched));
            counters.setProcessed(counters.getProcessed() + Math.max(0, processed));
            counters.setCompleted(counters.getCompleted() + 1);
            return commit();
        } finally {
            lock.unlock();
        }
    }
    
    public ExecutionSnapshot recordError(SourceKey source, LocalDate day, String message) {
        return appendError(day.toString(), source.getKey(), message, false);
    }
    
    /**
     * Run-level failure (range resolution, unexpected exception). Allowed
     * before the run starts.
     */
    public ExecutionSnapshot recordSystemError(String message) {
        return appendError(ExecutionError.NO_DAY, ExecutionError.SYSTEM_SOURCE, message, true);
    }
    
    public ExecutionSnapshot advanceDay(LocalDate day) {
        lock.lock();
        try {
            if (status != ExecutionStatus.RUNNING) {
                return buildSnapshot();
            }
            daysProcessed = Math.min(totalDays, daysProcessed + 1);
            currentDate = day;
            return commit();
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Moves the record to a terminal state. Calling it on an already
     * terminal record returns the frozen snapshot unchanged.
     */
    public ExecutionSnapshot finish(ExecutionStatus target) {
        lock.lock();
        try {
            if (status.isTerminal()) {
                return buildSnapshot();
            }
            status = status.transitionTo(target);
            completedAt = clock.instant();
            
            ExecutionSnapshot snapshot = buildSnapshot();
            RuntimeException failure = persistWithRetry(snapshot);
            if (failure == null) {
                return snapshot;
            }
            
            log.error("Final state of execution {} could not be stored, marking inconsistent: {}",
                    context.getExecutionId(), failure.getMessage(), failure);
            // Replaces the requested terminal state; the stored row is stale.
            status = ExecutionStatus.FAILED;
            stateInconsistent = true;
            errors.add(ExecutionError.system("Final state could not be persisted: " + failure.getMessage(),
                    clock.instant()));
            ExecutionSnapshot inconsistent = buildSnapshot();
            try {
                store.persist(inconsistent);
            } catch (RuntimeException e) {
                log.error("Could not store inconsistent marker for execution {}: {}",
                        context.getExecutionId(), e.getMessage(), e);
            }
            return inconsistent;
        } finally {
            lock.unlock();
        }
    }
    
    public ExecutionSnapshot snapshot() {
        lock.lock();
        try {
            return buildSnapshot();
        } finally {
            lock.unlock();
        }
    }
    
    public ExecutionStatus getStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }
    
    private ExecutionSnapshot appendError(String day, String source, String message, boolean allowPending) {
        lock.lock();
        try {
            boolean writable = status == ExecutionStatus.RUNNING
                    || (allowPending && status == ExecutionStatus.PENDING);
            if (!writable) {
                log.debug("Ignoring error for {} on execution {} in state {}: {}",
                        source, context.getExecutionId(), status, message);
                return buildSnapshot();
            }
            errors.add(ExecutionError.builder()
                    .day(day)
                    .source(source)
                    .message(message)
                    .timestamp(clock.instant())
                    .build());
            return commit();
        } finally {
            lock.unlock();
        }
    }
    
    private ExecutionSnapshot commit() {
        ExecutionSnapshot snapshot = buildSnapshot();
        RuntimeException failure = persistWithRetry(snapshot);
        if (failure != null) {
            log.error("Execution {} snapshot not stored after {} attempts, continuing: {}",
                    context.getExecutionId(), maxAttempts, failure.getMessage(), failure);
        }
        return snapshot;
    }
    
    /**
     * @return null on success, otherwise the last failure
     */
    private RuntimeException persistWithRetry(ExecutionSnapshot snapshot) {
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                store.persist(snapshot);
                return null;
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn("Persist of execution {} failed (attempt {}/{}): {}",
                        context.getExecutionId(), attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts && !pause()) {
                    break;
                }
            }
        }
        return lastFailure;
    }
    
    private boolean pause() {
        if (retryDelayMs == 0) {
            return true;
        }
        try {
            sleeper.sleep(retryDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
    
    private ExecutionSnapshot buildSnapshot() {
        Map<SourceKey, SourceCounters> sourceCopy = new EnumMap<>(SourceKey.class);
        sources.forEach((key, counters) -> sourceCopy.put(key, counters.copy()));
        
        return ExecutionSnapshot.builder()
                .executionId(context.getExecutionId())
                .workflowId(context.getWorkflowId())
                .tenantId(context.getTenantId())
                .teamId(context.getTeamId())
                .status(status)
                .triggerType(triggerType)
                .since(since)
                .until(until)
                .totalDays(totalDays)
                .daysProcessed(daysProcessed)
                .currentDate(currentDate)
                .sources(Collections.unmodifiableMap(sourceCopy))
                .errors(List.copyOf(errors))
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .stateInconsistent(stateInconsistent)
                .build();
    }
}
