package com.trialwatch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Human-readable justification for each contributing score, in evaluation order.
 */
public record ScoreReasons(
    @JsonProperty("urgency") List<String> urgency,
    @JsonProperty("major") List<String> major,
    @JsonProperty("interesting") List<String> interesting
) {

    public ScoreReasons {
        urgency = urgency == null ? List.of() : List.copyOf(urgency);
        major = major == null ? List.of() : List.copyOf(major);
        interesting = interesting == null ? List.of() : List.copyOf(interesting);
    }
}
