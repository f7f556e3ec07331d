package com.trialwatch.model;

/**
 * Granularity at which a registry date was specified.
 */
public enum DatePrecision {
    DAY,
    MONTH,
    YEAR,
    NONE
}
