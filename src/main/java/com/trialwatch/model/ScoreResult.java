package com.trialwatch.model;

/**
 * Scores for one trial, each in [0, 100].
 *
 * @param daysToPrimaryCompletion primary completion date minus today, null without a date
 */
public record ScoreResult(
    int urgency,
    int major,
    int interesting,
    int total,
    Integer daysToPrimaryCompletion,
    ScoreReasons reasons
) {}
