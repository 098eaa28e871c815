package org.clerasense.domain.model.ingestion;

public enum IngestionStage {
    CHECK_EXISTS,
    FETCHING,
    VERIFYING,
    PERSISTING,
    ENRICHING,
    DONE
}
