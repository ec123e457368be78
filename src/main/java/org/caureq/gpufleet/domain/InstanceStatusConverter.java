package org.caureq.gpufleet.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class InstanceStatusConverter implements AttributeConverter<InstanceStatus, String> {
    @Override
    public String convertToDatabaseColumn(InstanceStatus status) {
        return status == null ? null : status.code();
    }

    @Override
    public InstanceStatus convertToEntityAttribute(String code) {
        return InstanceStatus.fromCode(code);
    }
}
