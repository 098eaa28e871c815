package org.clerasense.domain.model.ingestion;

public enum IngestionStatus {
    INGESTED("ingested"),
    SKIPPED("skipped"),
    NOT_FOUND("not_found"),
    UNVERIFIED("unverified"),
    INSERT_FAILED("insert_failed");

    private final String label;

    IngestionStatus(String label) {
        this.label = label;
    }

    public String label() { return label; }

    public boolean hasRecord() {
        return this == INGESTED || this == SKIPPED;
    }
}
