package com.trialwatch.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Composite key of {@link CitationEntity}: one row per (trial, PubMed id).
 */
public class CitationId implements Serializable {

    private String nctId;
    private String pmid;

    public CitationId() {
    }

    public CitationId(String nctId, String pmid) {
        this.nctId = nctId;
        this.pmid = pmid;
    }

    public String getNctId() {
        return nctId;
    }

    public String getPmid() {
        return pmid;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CitationId other)) return false;
        return Objects.equals(nctId, other.nctId) && Objects.equals(pmid, other.pmid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nctId, pmid);
    }
}
