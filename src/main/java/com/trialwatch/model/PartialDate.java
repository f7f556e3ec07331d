package com.trialwatch.model;

import java.time.LocalDate;

/**
 * A registry date as published, plus the date used for ordering.
 *
 * @param raw       the original string, verbatim (empty when absent)
 * @param value     anchored date, or null when the raw string could not be parsed
 * @param precision granularity of the raw string
 */
public record PartialDate(String raw, LocalDate value, DatePrecision precision) {

    private static final PartialDate NONE = new PartialDate("", null, DatePrecision.NONE);

    public static PartialDate none() {
        return NONE;
    }

    public static PartialDate unparsed(String raw) {
        return new PartialDate(raw, null, DatePrecision.NONE);
    }

    public boolean isResolved() {
        return value != null;
    }

    public boolean hasRaw() {
        return raw != null && !raw.isEmpty();
    }
}
