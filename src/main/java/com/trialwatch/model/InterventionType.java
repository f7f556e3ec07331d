package com.trialwatch.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Intervention type tokens published by the registry.
 */
public enum InterventionType {
    DRUG,
    BIOLOGICAL,
    GENETIC,
    GENE_TRANSFER,
    CELL_THERAPY,
    DEVICE,
    PROCEDURE,
    SURGERY,
    RADIATION,
    DIAGNOSTIC_TEST,
    BEHAVIORAL,
    DIETARY_SUPPLEMENT,
    COMBINATION_PRODUCT,
    OTHER;

    public static Optional<InterventionType> fromToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(token.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
