package com.trialwatch.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@IdClass(CitationId.class)
@Table(name = "pubmed_citations")
public class CitationEntity {

    @Id
    @Column(name = "nct_id", nullable = false)
    private String nctId;

    @Id
    @Column(name = "pmid", nullable = false)
    private String pmid;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    @Column(name = "source")
    private String source;  // journal full name, else abbreviation

    @Column(name = "pub_date")
    private String pubDate;  // free-form, as PubMed prints it

    @Column(name = "doi")
    private String doi;

    @Convert(converter = UtcTimestampConverter.class)
    @Column(name = "last_seen_utc")
    private Instant lastSeenUtc;

    protected CitationEntity() {
    }

    public CitationEntity(String nctId, String pmid) {
        this.nctId = nctId;
        this.pmid = pmid;
    }

    /**
     * Overwrites metadata from a freshly fetched citation.
     */
    public void refresh(Citation citation, Instant seenAt) {
        this.title = citation.title();
        this.source = citation.source();
        this.pubDate = citation.pubDate();
        this.doi = citation.doi();
        this.lastSeenUtc = seenAt;
    }

    // Getters
    public String getNctId() {
        return nctId;
    }

    public String getPmid() {
        return pmid;
    }

    public String getTitle() {
        return title;
    }

    public String getSource() {
        return source;
    }

    public String getPubDate() {
        return pubDate;
    }

    public String getDoi() {
        return doi;
    }

    public Instant getLastSeenUtc() {
        return lastSeenUtc;
    }
}
