package com.analytics.workflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-source progress of an execution.
 * 
 * total is the number of days the source is planned for, completed the
 * number of those days that finished without error; fetched and processed
 * count records.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SourceCounters {
    
    private int total;
    private int completed;
    private long fetched;
    private long processed;
    
    public SourceCounters copy() {
        return toBuilder().build();
    }
}
