package com.analytics.workflow.infrastructure.persistence.converter;

import com.analytics.workflow.domain.model.ExecutionError;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class ExecutionErrorListConverter extends JsonAttributeConverter<List<ExecutionError>> {
    
    public ExecutionErrorListConverter() {
        super(new TypeReference<>() {
        });
    }
    
    @Override
    protected List<ExecutionError> empty() {
        return new ArrayList<>();
    }
}
