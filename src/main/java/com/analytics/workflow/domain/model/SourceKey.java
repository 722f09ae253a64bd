package com.analytics.workflow.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * External data sources a workflow can ingest from.
 * 
 * Declaration order is the fixed per-day execution order (ads before POS),
 * which keeps the published event stream deterministic.
 */
public enum SourceKey {
    
    ADS("ads"),
    POS("pos");
    
    private final String key;
    
    SourceKey(String key) {
        this.key = key;
    }
    
    @JsonValue
    public String getKey() {
        return key;
    }
    
    @JsonCreator
    public static SourceKey fromKey(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Source key is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SourceKey source : values()) {
            if (source.key.equals(normalized)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown source: " + value);
    }
    
    @Override
    public String toString() {
        return key;
    }
}
