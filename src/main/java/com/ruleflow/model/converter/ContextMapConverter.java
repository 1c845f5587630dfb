package com.ruleflow.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

/**
 * Evaluation context bound to a workflow request.
 */
@Converter
public class ContextMapConverter extends JsonAttributeConverter<Map<String, Object>> {

    public ContextMapConverter() {
        super(new TypeReference<>() {});
    }
}
