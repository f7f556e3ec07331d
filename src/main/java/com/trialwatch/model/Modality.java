package com.trialwatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Editorial bucket derived from intervention types. Buckets are evaluated in declaration
 * order and the first one with a matching type wins.
 */
public enum Modality {
    DRUG_BIOLOGIC("drug/biologic", EnumSet.of(InterventionType.DRUG, InterventionType.BIOLOGICAL,
            InterventionType.GENETIC, InterventionType.GENE_TRANSFER, InterventionType.CELL_THERAPY)),
    DEVICE("device", EnumSet.of(InterventionType.DEVICE)),
    PROCEDURE_SURGERY("procedure/surgery", EnumSet.of(InterventionType.PROCEDURE, InterventionType.SURGERY)),
    RADIATION("radiation", EnumSet.of(InterventionType.RADIATION)),
    DIAGNOSTIC("diagnostic", EnumSet.of(InterventionType.DIAGNOSTIC_TEST)),
    BEHAVIORAL("behavioral", EnumSet.of(InterventionType.BEHAVIORAL)),
    OTHER("other", EnumSet.noneOf(InterventionType.class));

    private final String label;
    private final Set<InterventionType> types;

    Modality(String label, Set<InterventionType> types) {
        this.label = label;
        this.types = types;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Modality infer(Collection<String> interventionTypeTokens) {
        EnumSet<InterventionType> present = EnumSet.noneOf(InterventionType.class);
        if (interventionTypeTokens != null) {
            for (String token : interventionTypeTokens) {
                InterventionType.fromToken(token).ifPresent(present::add);
            }
        }
        for (Modality modality : values()) {
            for (InterventionType type : modality.types) {
                if (present.contains(type)) {
                    return modality;
                }
            }
        }
        return OTHER;
    }
}
