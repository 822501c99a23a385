package com.rht.repairorder.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link RepairStatus} by its label ("In Progress") rather than its constant name.
 */
@Converter
public class RepairStatusConverter implements AttributeConverter<RepairStatus, String> {

    @Override
    public String convertToDatabaseColumn(RepairStatus status) {
        return status == null ? null : status.getLabel();
    }

    @Override
    public RepairStatus convertToEntityAttribute(String label) {
        if (label == null) {
            return null;
        }
        return RepairStatus.fromLabel(label)
            .orElseThrow(() -> new IllegalArgumentException("Unknown repair status: " + label));
    }
}
