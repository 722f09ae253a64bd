package com.analytics.workflow.domain.service;

import com.analytics.workflow.config.WorkflowEngineProperties;
import com.analytics.workflow.domain.exception.ValidationException;
import com.analytics.workflow.domain.model.DateRangeSpec;
import com.analytics.workflow.domain.model.SourceKey;
import com.analytics.workflow.domain.model.SourcePlan;
import com.analytics.workflow.domain.model.WorkflowConfig;
import com.analytics.workflow.domain.model.WorkflowConfigDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Parses stored workflow config JSON into a typed {@link WorkflowConfig}.
 * 
 * Used at definition write time and again at the start of every run, so
 * a config that was valid when saved but no longer resolves still fails
 * the run cleanly.
 * 
 * Delay precedence per source:
 * 1. sources.&lt;s&gt;.minDelayMs
 * 2. rateLimit.&lt;s&gt;DelayMs
 * 3. workflow-engine.default-source-delay-ms
 */
@Component
@RequiredArgsConstructor
public class WorkflowConfigParser {
    
    private final ObjectMapper objectMapper;
    private final DateRangeResolver dateRangeResolver;
    private final WorkflowEngineProperties properties;
    
    public WorkflowConfig parse(String json) {
        if (json == null || json.isBlank()) {
            throw new ValidationException("Workflow config is empty");
        }
        try {
            return toConfig(objectMapper.readValue(json, WorkflowConfigDocument.class));
        } catch (JsonProcessingException e) {
            throw new ValidationException("Workflow config is not valid: " + e.getOriginalMessage(), e);
        }
    }
    
    public WorkflowConfig parse(JsonNode node) {
        if (node == null || node.isNull() || !node.isObject()) {
            throw new ValidationException("Workflow config must be a JSON object");
        }
        try {
            return toConfig(objectMapper.treeToValue(node, WorkflowConfigDocument.class));
        } catch (JsonProcessingException e) {
            throw new ValidationException("Workflow config is not valid: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Workflow config is not valid: " + e.getMessage(), e);
        }
    }
    
    private WorkflowConfig toConfig(WorkflowConfigDocument document) {
        if (document == null) {
            throw new ValidationException("Workflow config is empty");
        }
        
        WorkflowConfigDocument.Sources sources = document.getSources();
        if (sources == null) {
            throw new ValidationException("Workflow config has no sources");
        }
        
        Map<SourceKey, SourcePlan> plans = new EnumMap<>(SourceKey.class);
        plans.put(SourceKey.ADS, toPlan(SourceKey.ADS, sources.getAds(), document));
        plans.put(SourceKey.POS, toPlan(SourceKey.POS, sources.getPos(), document));
        
        WorkflowConfig config = new WorkflowConfig(document.getDateRange(), plans);
        if (config.getEnabledPlans().isEmpty()) {
            throw new ValidationException("Workflow config has no enabled sources");
        }
        return config;
    }
    
    private SourcePlan toPlan(SourceKey source,
                              WorkflowConfigDocument.SourceSettings settings,
                              WorkflowConfigDocument document) {
        boolean enabled = settings != null && Boolean.TRUE.equals(settings.getEnabled());
        
        DateRangeSpec range = settings != null && settings.getDateRange() != null
                ? settings.getDateRange()
                : document.getDateRange();
        
        long delay = resolveDelay(source, settings, document.getRateLimit());
        
        if (enabled) {
            if (range == null) {
                throw new ValidationException("Source " + source + " has no date range");
            }
            // Structural check only; the run resolves again against its own "today".
            dateRangeResolver.resolve(range, dateRangeResolver.today());
        }
        
        return new SourcePlan(source, enabled, range, delay);
    }
    
    private long resolveDelay(SourceKey source,
                              WorkflowConfigDocument.SourceSettings settings,
                              WorkflowConfigDocument.RateLimit rateLimit) {
        Long delay = null;
        if (settings != null && settings.getMinDelayMs() != null) {
            delay = settings.getMinDelayMs();
        } else if (rateLimit != null) {
            delay = source == SourceKey.ADS ? rateLimit.getAdsDelayMs() : rateLimit.getPosDelayMs();
        }
        if (delay == null) {
            delay = properties.getDefaultSourceDelayMs();
        }
        if (delay < 0) {
            throw new ValidationException("Source " + source + " delay must be >= 0, got " + delay);
        }
        return delay;
    }
}
