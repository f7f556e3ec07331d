package com.trialwatch.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Stores dates as {@code yyyy-MM-dd} text so that column order matches date order.
 */
@Converter
public class IsoDateConverter implements AttributeConverter<LocalDate, String> {

    private static final Logger log = LoggerFactory.getLogger(IsoDateConverter.class);

    @Override
    public String convertToDatabaseColumn(LocalDate attribute) {
        return attribute == null ? null : attribute.toString();
    }

    @Override
    public LocalDate convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(dbData.trim());
        } catch (DateTimeParseException e) {
            log.warn("Unreadable date column value '{}'", dbData);
            return null;
        }
    }
}
