package org.clerasense.domain.model.drug;

import java.util.Objects;

public record DrugInteraction(String interactingDrug, Severity severity, String description) {
    public DrugInteraction {
        Objects.requireNonNull(interactingDrug, "interactingDrug");
        severity = severity == null ? Severity.MODERATE : severity;
        description = description == null ? "" : description;
    }
}
