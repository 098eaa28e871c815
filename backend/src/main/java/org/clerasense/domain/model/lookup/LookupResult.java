package org.clerasense.domain.model.lookup;

import org.clerasense.domain.model.drug.DrugRecord;

import java.util.List;

public record LookupResult(List<DrugRecord> found, List<String> notFound) {
    public LookupResult {
        found = found == null ? List.of() : List.copyOf(found);
        notFound = notFound == null ? List.of() : List.copyOf(notFound);
    }
}
