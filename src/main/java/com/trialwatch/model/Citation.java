package com.trialwatch.model;

/**
 * A PubMed article linked to a trial.
 *
 * @param pubDate publication date as PubMed prints it; not guaranteed to be sortable
 */
public record Citation(
    String pmid,
    String title,
    String source,
    String pubDate,
    String doi
) {}
