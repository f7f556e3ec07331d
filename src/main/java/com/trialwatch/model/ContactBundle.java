package com.trialwatch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Investigator and contact details as published on the study record.
 */
public record ContactBundle(
    @JsonProperty("central_contacts") List<CentralContact> centralContacts,
    @JsonProperty("overall_officials") List<OverallOfficial> overallOfficials
) {

    public ContactBundle {
        centralContacts = centralContacts == null ? List.of() : List.copyOf(centralContacts);
        overallOfficials = overallOfficials == null ? List.of() : List.copyOf(overallOfficials);
    }

    public static ContactBundle empty() {
        return new ContactBundle(List.of(), List.of());
    }

    public record CentralContact(
        @JsonProperty("name") String name,
        @JsonProperty("role") String role,
        @JsonProperty("phone") String phone,
        @JsonProperty("email") String email
    ) {}

    public record OverallOfficial(
        @JsonProperty("name") String name,
        @JsonProperty("affiliation") String affiliation,
        @JsonProperty("role") String role
    ) {}
}
