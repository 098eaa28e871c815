package org.clerasense.domain.model.drug;

public record SourceRef(long id, String authority, String documentTitle, Integer publicationYear, String url) {}
