package com.analytics.workflow.infrastructure.persistence.converter;

import com.analytics.workflow.domain.model.SourceCounters;
import com.analytics.workflow.domain.model.SourceKey;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.EnumMap;
import java.util.Map;

@Converter
public class SourceCountersMapConverter extends JsonAttributeConverter<Map<SourceKey, SourceCounters>> {
    
    public SourceCountersMapConverter() {
        super(new TypeReference<>() {
        });
    }
    
    @Override
    protected Map<SourceKey, SourceCounters> empty() {
        return new EnumMap<>(SourceKey.class);
    }
}
