package com.ruleflow.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ruleflow.model.AssignmentRule;
import jakarta.persistence.Converter;

@Converter
public class AssignmentRuleConverter extends JsonAttributeConverter<AssignmentRule> {

    public AssignmentRuleConverter() {
        super(new TypeReference<>() {});
    }
}
