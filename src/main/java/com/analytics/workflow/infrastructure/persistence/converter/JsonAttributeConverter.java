package com.analytics.workflow.infrastructure.persistence.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.persistence.AttributeConverter;

/**
 * Stores a value as a JSON TEXT column.
 * 
 * Uses its own mapper since Hibernate instantiates converters itself.
 */
public abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {
    
    static final ObjectMapper MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    
    private final TypeReference<T> type;
    
    protected JsonAttributeConverter(TypeReference<T> type) {
        this.type = type;
    }
    
    protected abstract T empty();
    
    @Override
    public String convertToDatabaseColumn(T attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize column value: " + e.getOriginalMessage(), e);
        }
    }
    
    @Override
    public T convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return empty();
        }
        try {
            return MAPPER.readValue(dbData, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not read JSON column: " + e.getOriginalMessage(), e);
        }
    }
}
