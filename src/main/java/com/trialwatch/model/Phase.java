package com.trialwatch.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Registry phase vocabulary. Ranked constants are declared from most to least advanced.
 */
public enum Phase {
    PHASE4("Phase 4", true),
    PHASE3("Phase 3", true),
    PHASE2("Phase 2", true),
    PHASE1("Phase 1", true),
    EARLY_PHASE1("Early Phase 1", true),
    NA("N/A", false),
    UNKNOWN("Unknown", false);

    private final String label;
    private final boolean ranked;

    Phase(String label, boolean ranked) {
        this.label = label;
        this.ranked = ranked;
    }

    public String label() {
        return label;
    }

    /**
     * Picks the most advanced phase among the given tokens. Exact tokens are matched first;
     * a combined token such as {@code PHASE2/PHASE3} is then matched by substring.
     */
    public static Phase mostAdvanced(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return UNKNOWN;
        }
        List<String> upper = normalize(tokens);
        for (Phase phase : values()) {
            if (phase.ranked && upper.contains(phase.name())) {
                return phase;
            }
        }
        String joined = String.join(",", upper);
        for (Phase phase : values()) {
            if (phase.ranked && joined.contains(phase.name())) {
                return phase;
            }
        }
        if (upper.contains(NA.name())) {
            return NA;
        }
        return UNKNOWN;
    }

    /**
     * Label used in score reasons for an unranked result: the first raw token, or UNKNOWN.
     */
    public static String unrankedLabel(List<String> tokens) {
        List<String> upper = normalize(tokens);
        return upper.isEmpty() ? UNKNOWN.name() : upper.get(0);
    }

    private static List<String> normalize(List<String> tokens) {
        List<String> upper = new ArrayList<>();
        if (tokens == null) {
            return upper;
        }
        for (String token : tokens) {
            if (token != null && !token.isEmpty()) {
                upper.add(token.toUpperCase(Locale.ROOT));
            }
        }
        return upper;
    }
}
