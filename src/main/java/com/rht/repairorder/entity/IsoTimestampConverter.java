package com.rht.repairorder.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;

/**
 * Maps report timestamps to the textual {@code yyyy-MM-ddTHH:mm:ss} form kept in the store.
 */
@Converter
public class IsoTimestampConverter implements AttributeConverter<LocalDateTime, String> {

    public static final DateTimeFormatter FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

    @Override
    public String convertToDatabaseColumn(LocalDateTime timestamp) {
        return timestamp == null ? null : FORMAT.format(timestamp);
    }

    @Override
    public LocalDateTime convertToEntityAttribute(String text) {
        return text == null ? null : LocalDateTime.parse(text, FORMAT);
    }
}
