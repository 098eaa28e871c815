package org.clerasense.domain.model.ingestion;

public record ReverifyReport(int updated, int unchanged, int errors) {}
