package com.machine.signals.model;

import com.machine.common.model.SignalType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores signal types by their wire value (state_change, error, power).
 */
@Converter(autoApply = true)
public class SignalTypeConverter implements AttributeConverter<SignalType, String> {

    @Override
    public String convertToDatabaseColumn(SignalType attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public SignalType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : SignalType.fromValue(dbData);
    }
}
