package com.trialwatch.model;

import java.util.List;

/**
 * Canonical, flat view of one registry study. Built fresh on every sync pass.
 */
public record TrialRecord(
    String nctId,
    String briefTitle,
    String officialTitle,
    String acronym,
    String overallStatus,
    String studyType,
    List<String> phases,
    Integer enrollment,
    String enrollmentType,
    String leadSponsorName,
    String leadSponsorClass,
    Boolean fdaRegulatedDrug,
    Boolean fdaRegulatedDevice,
    Boolean oversightHasDmc,
    List<String> conditions,
    List<String> interventions,
    List<String> interventionTypes,
    Modality modality,
    Integer locationCount,
    ContactBundle contacts,
    PartialDate startDate,
    PartialDate primaryCompletionDate,
    String primaryCompletionType,
    PartialDate completionDate,
    String completionType,
    PartialDate lastUpdatePostDate,
    PartialDate resultsFirstPostDate,
    boolean hasResults
) {

    public TrialRecord {
        phases = phases == null ? List.of() : List.copyOf(phases);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        interventions = interventions == null ? List.of() : List.copyOf(interventions);
        interventionTypes = interventionTypes == null ? List.of() : List.copyOf(interventionTypes);
        contacts = contacts == null ? ContactBundle.empty() : contacts;
        startDate = orNone(startDate);
        primaryCompletionDate = orNone(primaryCompletionDate);
        completionDate = orNone(completionDate);
        lastUpdatePostDate = orNone(lastUpdatePostDate);
        resultsFirstPostDate = orNone(resultsFirstPostDate);
    }

    /**
     * First phase token as published, or null.
     */
    public String firstPhase() {
        return phases.isEmpty() ? null : phases.get(0);
    }

    /**
     * Free text searched by keyword scoring and topic tag matching.
     */
    public String searchableText() {
        return String.join(" ",
                nullToEmpty(briefTitle),
                nullToEmpty(officialTitle),
                String.join(" ", conditions),
                String.join(" ", interventions));
    }

    private static PartialDate orNone(PartialDate date) {
        return date == null ? PartialDate.none() : date;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
