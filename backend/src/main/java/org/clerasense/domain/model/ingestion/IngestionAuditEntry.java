package org.clerasense.domain.model.ingestion;

import java.util.List;

public record IngestionAuditEntry(
        String drugName,
        String sourceApi,
        IngestionStage stage,
        IngestionStatus status,
        Double confidence,
        List<String> sourcesUsed,
        List<String> conflicts,
        String details
) {
    public IngestionAuditEntry {
        sourcesUsed = sourcesUsed == null ? List.of() : List.copyOf(sourcesUsed);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        details = details == null ? "" : details;
    }
}
