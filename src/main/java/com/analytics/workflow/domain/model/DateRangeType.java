package com.analytics.workflow.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DateRangeType {
    
    ROLLING,
    RELATIVE,
    ABSOLUTE;
    
    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    @JsonCreator
    public static DateRangeType fromKey(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Date range type is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
