package org.clerasense.domain.model.drug;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

public record Provenance(
        String sourceAuthority,
        String sourceDocumentTitle,
        String sourceUrl,
        Integer sourceYear,
        LocalDate effectiveDate,
        Instant retrievedAt
) {
    public Provenance {
        Objects.requireNonNull(sourceAuthority, "sourceAuthority");
        Objects.requireNonNull(sourceDocumentTitle, "sourceDocumentTitle");
        sourceUrl = sourceUrl == null ? "" : sourceUrl;
        retrievedAt = retrievedAt == null ? Instant.now() : retrievedAt;
    }

    public static Provenance of(String authority, String title, String url, Integer year) {
        return new Provenance(authority, title, url, year, null, Instant.now());
    }
}
