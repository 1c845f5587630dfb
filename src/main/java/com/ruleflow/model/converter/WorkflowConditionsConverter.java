package com.ruleflow.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ruleflow.model.WorkflowConditions;
import jakarta.persistence.Converter;

@Converter
public class WorkflowConditionsConverter extends JsonAttributeConverter<WorkflowConditions> {

    public WorkflowConditionsConverter() {
        super(new TypeReference<>() {});
    }
}
