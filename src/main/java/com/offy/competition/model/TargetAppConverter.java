package com.offy.competition.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class TargetAppConverter implements AttributeConverter<TargetApp, String> {

    @Override
    public String convertToDatabaseColumn(TargetApp attribute) {
        return attribute == null ? null : attribute.toStorageValue();
    }

    @Override
    public TargetApp convertToEntityAttribute(String dbData) {
        return dbData == null ? null : TargetApp.fromStorageValue(dbData);
    }
}
