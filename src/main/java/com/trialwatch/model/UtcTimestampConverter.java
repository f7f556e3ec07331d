package com.trialwatch.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Stores instants as ISO-8601 UTC text with second precision, e.g. {@code 2024-09-03T10:15:30+00:00}.
 */
@Converter
public class UtcTimestampConverter implements AttributeConverter<Instant, String> {

    private static final Logger log = LoggerFactory.getLogger(UtcTimestampConverter.class);

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx");

    @Override
    public String convertToDatabaseColumn(Instant attribute) {
        if (attribute == null) {
            return null;
        }
        return FORMAT.format(OffsetDateTime.ofInstant(attribute.truncatedTo(ChronoUnit.SECONDS), ZoneOffset.UTC));
    }

    @Override
    public Instant convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(dbData.trim()).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("Unreadable timestamp column value '{}'", dbData);
            return null;
        }
    }
}
