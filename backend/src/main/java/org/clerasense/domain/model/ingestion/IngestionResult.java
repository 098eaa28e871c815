package org.clerasense.domain.model.ingestion;

import java.util.List;

public record IngestionResult(
        String drugName,
        IngestionStatus status,
        Double confidence,
        List<String> sourcesUsed,
        List<String> conflicts,
        Long recordId,
        String reason
) {
    public IngestionResult {
        sourcesUsed = sourcesUsed == null ? List.of() : List.copyOf(sourcesUsed);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        reason = reason == null ? "" : reason;
    }

    public static IngestionResult skipped(String drugName, Long recordId, String reason) {
        return new IngestionResult(drugName, IngestionStatus.SKIPPED, null, List.of(), List.of(), recordId, reason);
    }

    public static IngestionResult notFound(String drugName) {
        return new IngestionResult(drugName, IngestionStatus.NOT_FOUND, null, List.of(), List.of(), null,
                "No source returned data");
    }
}
