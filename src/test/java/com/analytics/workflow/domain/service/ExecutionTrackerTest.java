package com.analytics.workflow.domain.service;

import com.analytics.workflow.domain.exception.PersistenceException;
import com.analytics.workflow.domain.model.ExecutionContext;
import com.analytics.workflow.domain.model.ExecutionSnapshot;
import com.analytics.workflow.domain.model.ExecutionStatus;
import com.analytics.workflow.domain.model.SourceKey;
import com.analytics.workflow.domain.model.TenantContext;
import com.analytics.workflow.domain.model.TriggerType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ExecutionTracker.
 * 
 * Store failures are simulated with the mock; the sleeper is a no-op so
 * retries run instantly.
 */
@ExtendWith(MockitoExtension.class)
class ExecutionTrackerTest {
    
    private static final LocalDate DAY_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate DAY_2 = LocalDate.of(2024, 1, 2);
    
    @Mock
    private ExecutionStore store;
    
    private ExecutionTracker tracker;
    
    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-05T00:00:00Z"), ZoneOffset.UTC);
        ExecutionContext context = new ExecutionContext("exec-1", "wf-1", TenantContext.of("tenant-1", "team-1"));
        tracker = new ExecutionTracker(context, TriggerType.MANUAL, store, clock, 3, 10, millis -> { });
    }
    
    @Test
    void testLifecycle_CountersAndCompletion() {
        // Given
        tracker.create();
        tracker.markRunning(DAY_1, DAY_2, 2, Map.of(SourceKey.ADS, 2, SourceKey.POS, 2));
        
        // When
        tracker.recordSuccess(SourceKey.ADS, DAY_1, 10, 9);
        tracker.recordSuccess(SourceKey.POS, DAY_1, 4, 4);
        tracker.advanceDay(DAY_1);
        tracker.recordSuccess(SourceKey.ADS, DAY_2, 5, 5);
        tracker.recordError(SourceKey.POS, DAY_2, "pos down");
        tracker.advanceDay(DAY_2);
        ExecutionSnapshot result = tracker.finish(ExecutionStatus.COMPLETED);
        
        // Then
        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertEquals("COMPLETED_WITH_ERRORS", result.getStatusLabel());
        assertEquals(2, result.getTotalDays());
        assertEquals(2, result.getDaysProcessed());
        assertEquals(DAY_2, result.getCurrentDate());
        assertEquals(15, result.getSources().get(SourceKey.ADS).getFetched());
        assertEquals(14, result.getSources().get(SourceKey.ADS).getProcessed());
        assertEquals(2, result.getSources().get(SourceKey.ADS).getCompleted());
        assertEquals(1, result.getSources().get(SourceKey.POS).getCompleted());
        assertEquals(1, result.getErrors().size());
        assertEquals("2024-01-02", result.getErrors().get(0).getDay());
        assertEquals("pos", result.getErrors().get(0).getSource());
        assertNotNull(result.getCompletedAt());
        assertFalse(result.isStateInconsistent());
    }
    
    @Test
    void testPersist_EveryMutationWritesMonotonicSnapshots() {
        // Given
        tracker.create();
        tracker.markRunning(DAY_1, DAY_2, 2, Map.of(SourceKey.ADS, 2));
        tracker.recordError(SourceKey.ADS, DAY_1, "boom");
        tracker.advanceDay(DAY_1);
        tracker.advanceDay(DAY_2);
        tracker.advanceDay(DAY_2);
        tracker.finish(ExecutionStatus.COMPLETED);
        
        // Then
        ArgumentCaptor<ExecutionSnapshot> captor = ArgumentCaptor.forClass(ExecutionSnapshot.class);
        verify(store, times(7)).persist(captor.capture());
        List<ExecutionSnapshot> written = captor.getAllValues();
        for (int i = 1; i < written.size(); i++) {
            ExecutionSnapshot previous = written.get(i - 1);
            ExecutionSnapshot current = written.get(i);
            assertTrue(current.getDaysProcessed() >= previous.getDaysProcessed());
            assertTrue(current.getErrors().size() >= previous.getErrors().size());
            assertTrue(current.getDaysProcessed() <= current.getTotalDays() || current.getTotalDays() == 0);
        }
        assertEquals(2, written.get(written.size() - 1).getDaysProcessed());
    }
    
    @Test
    void testFinish_IsIdempotentOnceTerminal() {
        // Given
        tracker.create();
        tracker.markRunning(DAY_1, DAY_1, 1, Map.of(SourceKey.ADS, 1));
        tracker.finish(ExecutionStatus.CANCELLED);
        
        // When
        ExecutionSnapshot again = tracker.finish(ExecutionStatus.COMPLETED);
        tracker.recordSuccess(SourceKey.ADS, DAY_1, 1, 1);
        tracker.recordError(SourceKey.ADS, DAY_1, "late");
        
        // Then
        assertEquals(ExecutionStatus.CANCELLED, again.getStatus());
        assertTrue(tracker.snapshot().getErrors().isEmpty());
        verify(store, times(3)).persist(any());
    }
    
    @Test
    void testPersist_TransientFailureIsRetried() {
        // Given
        tracker.create();
        doThrow(new RuntimeException("db blip"))
                .doNothing()
                .when(store).persist(any());
        
        // When
        tracker.markRunning(DAY_1, DAY_1, 1, Map.of(SourceKey.ADS, 1));
        
        // Then
        verify(store, times(3)).persist(any());
        assertEquals(ExecutionStatus.RUNNING, tracker.getStatus());
    }
    
    @Test
    void testPersist_IntermediateFailureDoesNotStopRun() {
        // Given
        tracker.create();
        tracker.markRunning(DAY_1, DAY_1, 1, Map.of(SourceKey.ADS, 1));
        doThrow(new RuntimeException("db down")).when(store).persist(any());
        
        // When
        ExecutionSnapshot snapshot = tracker.recordSuccess(SourceKey.ADS, DAY_1, 3, 3);
        
        // Then
        assertEquals(3, snapshot.getSources().get(SourceKey.ADS).getFetched());
        assertEquals(ExecutionStatus.RUNNING, tracker.getStatus());
    }
    
    @Test
    void testCreate_FailureRaisesPersistenceException() {
        // Given
        doThrow(new RuntimeException("db down")).when(store).persist(any());
        
        // When/Then
        assertThrows(PersistenceException.class, () -> tracker.create());
        verify(store, times(3)).persist(any());
    }
    
    @Test
    void testFinish_LostTerminalWriteMarksInconsistent() {
        // Given
        tracker.create();
        tracker.markRunning(DAY_1, DAY_1, 1, Map.of(SourceKey.ADS, 1));
        doThrow(new RuntimeException("db down")).when(store).persist(any());
        
        // When
        ExecutionSnapshot result = tracker.finish(ExecutionStatus.COMPLETED);
        
        // Then
        assertEquals(ExecutionStatus.FAILED, result.getStatus());
        assertTrue(result.isStateInconsistent());
        assertEquals(1, result.getErrors().size());
        assertEquals("system", result.getErrors().get(0).getSource());
        assertTrue(result.getErrors().get(0).getMessage().startsWith("Final state could not be persisted"));
        // 2 earlier writes + 3 terminal attempts + 1 marker write
        verify(store, times(6)).persist(any());
    }
    
    @Test
    void testRecordSystemError_AllowedWhilePending() {
        // Given
        tracker.create();
        
        // When
        tracker.recordSystemError("bad range");
        ExecutionSnapshot result = tracker.finish(ExecutionStatus.FAILED);
        
        // Then
        assertEquals(ExecutionStatus.FAILED, result.getStatus());
        assertEquals("N/A", result.getErrors().get(0).getDay());
        assertEquals("bad range", result.getErrors().get(0).getMessage());
    }
    
    @Test
    void testRecordError_IgnoredWhilePending() {
        // Given
        tracker.create();
        
        // When
        tracker.recordError(SourceKey.POS, DAY_1, "too early");
        
        // Then
        assertTrue(tracker.snapshot().getErrors().isEmpty());
    }
    
    @Test
    void testMarkRunning_RejectedAfterTerminal() {
        // Given
        tracker.create();
        tracker.finish(ExecutionStatus.CANCELLED);
        
        // When/Then
        assertThrows(IllegalStateException.class,
                () -> tracker.markRunning(DAY_1, DAY_1, 1, Map.of(SourceKey.ADS, 1)));
    }
}
