package com.ruleflow.model.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;

/**
 * Stores a value as a JSON string in a TEXT column.
 * Converters are instantiated by Hibernate, so they use their own ObjectMapper
 * rather than the application bean.
 */
public abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    private final TypeReference<T> type;

    protected JsonAttributeConverter(TypeReference<T> type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(T attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + attribute.getClass().getSimpleName(), e);
        }
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(dbData, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot deserialize column value: " + e.getOriginalMessage(), e);
        }
    }
}
