package com.ruleflow.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ruleflow.model.StageSettings;
import jakarta.persistence.Converter;

@Converter
public class StageSettingsConverter extends JsonAttributeConverter<StageSettings> {

    public StageSettingsConverter() {
        super(new TypeReference<>() {});
    }
}
