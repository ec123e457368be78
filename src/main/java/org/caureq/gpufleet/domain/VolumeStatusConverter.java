package org.caureq.gpufleet.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class VolumeStatusConverter implements AttributeConverter<VolumeStatus, String> {
    @Override
    public String convertToDatabaseColumn(VolumeStatus status) {
        return status == null ? null : status.code();
    }

    @Override
    public VolumeStatus convertToEntityAttribute(String code) {
        return VolumeStatus.fromCode(code);
    }
}
