package org.clerasense.domain.model.verification;

import org.clerasense.domain.model.drug.NormalizedDrugData;
import org.clerasense.domain.model.drug.Provenance;

import java.util.List;

public record VerificationResult(
        boolean verified,
        double confidence,
        NormalizedDrugData mergedData,
        List<String> sourcesUsed,
        List<String> conflicts,
        List<String> notes,
        List<Provenance> contributingSources
) {
    public VerificationResult {
        sourcesUsed = sourcesUsed == null ? List.of() : List.copyOf(sourcesUsed);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        notes = notes == null ? List.of() : List.copyOf(notes);
        contributingSources = contributingSources == null ? List.of() : List.copyOf(contributingSources);
    }

    public static VerificationResult empty(String note) {
        return new VerificationResult(false, 0.0, null, List.of(), List.of(), List.of(note), List.of());
    }

    public boolean hasMergedData() {
        return mergedData != null;
    }
}
