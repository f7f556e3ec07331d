package com.trialwatch.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.trialwatch.model.DatePrecision;
import com.trialwatch.model.PartialDate;

import java.time.DateTimeException;
import java.time.LocalDate;

/**
 * Parses registry dates published as {@code yyyy}, {@code yyyy-MM} or {@code yyyy-MM-dd}.
 * Year-only dates are anchored to July 1 and month-only dates to the 15th so they sort
 * sensibly against exact dates. Never throws.
 */
public final class PartialDateParser {

    private static final String DATE_KEY = "date";
    private static final int MIN_YEAR = 1;
    private static final int MAX_YEAR = 9999;

    private PartialDateParser() {
    }

    /**
     * Accepts a plain text node or a date struct such as {@code {"date": "2024-09", "type": "ESTIMATED"}}.
     */
    public static PartialDate parse(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return PartialDate.none();
        }
        if (node.isObject() && node.has(DATE_KEY)) {
            node = node.get(DATE_KEY);
            if (node.isNull()) {
                return PartialDate.none();
            }
        }
        return parse(node.isValueNode() ? node.asText() : node.toString());
    }

    public static PartialDate parse(String raw) {
        if (raw == null) {
            return PartialDate.none();
        }
        String s = raw.strip();
        if (s.isEmpty()) {
            return PartialDate.none();
        }
        String[] parts = s.split("-", -1);
        try {
            int year = Integer.parseInt(parts[0]);
            if (year < MIN_YEAR || year > MAX_YEAR) {
                return PartialDate.unparsed(s);
            }
            if (parts.length == 1) {
                return new PartialDate(s, LocalDate.of(year, 7, 1), DatePrecision.YEAR);
            }
            int month = Integer.parseInt(parts[1]);
            if (parts.length == 2) {
                return new PartialDate(s, LocalDate.of(year, month, 15), DatePrecision.MONTH);
            }
            int day = Integer.parseInt(parts[2]);
            return new PartialDate(s, LocalDate.of(year, month, day), DatePrecision.DAY);
        } catch (NumberFormatException | DateTimeException e) {
            return PartialDate.unparsed(s);
        }
    }
}
