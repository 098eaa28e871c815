package org.clerasense.domain.model.ingestion;

import java.util.List;

public record DiscoveryReport(
        int discovered,
        int ingested,
        int skipped,
        int unverified,
        int failed,
        List<IngestionResult> details
) {
    public DiscoveryReport {
        details = details == null ? List.of() : List.copyOf(details);
    }
}
