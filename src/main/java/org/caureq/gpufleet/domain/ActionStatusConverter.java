package org.caureq.gpufleet.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class ActionStatusConverter implements AttributeConverter<ActionStatus, String> {
    @Override
    public String convertToDatabaseColumn(ActionStatus status) {
        return status == null ? null : status.code();
    }

    @Override
    public ActionStatus convertToEntityAttribute(String code) {
        return ActionStatus.fromCode(code);
    }
}
