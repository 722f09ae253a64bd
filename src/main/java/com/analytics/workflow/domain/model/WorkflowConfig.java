package com.analytics.workflow.domain.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Typed workflow config, one {@link SourcePlan} per known source.
 */
@Value
public class WorkflowConfig {
    
    DateRangeSpec dateRange;
    Map<SourceKey, SourcePlan> sources;
    
    public WorkflowConfig(DateRangeSpec dateRange, Map<SourceKey, SourcePlan> sources) {
        this.dateRange = dateRange;
        this.sources = Collections.unmodifiableMap(new EnumMap<>(sources));
    }
    
    /**
     * Enabled plans in fixed source order.
     */
    public List<SourcePlan> getEnabledPlans() {
        List<SourcePlan> plans = new ArrayList<>();
        for (SourceKey key : SourceKey.values()) {
            SourcePlan plan = sources.get(key);
            if (plan != null && plan.isEnabled()) {
                plans.add(plan);
            }
        }
        return plans;
    }
}
