package org.clerasense.application.port;

import org.clerasense.domain.model.drug.DrugInteraction;
import org.clerasense.domain.model.drug.NormalizedDrugData;
import org.clerasense.domain.model.ingestion.RequestPacing;

import java.util.List;
import java.util.Optional;

/**
 * One public drug-information provider.
 * <p>
 * Implementations rate-limit themselves, hold no per-call state and are safe to call
 * from several threads. "No data" and transient remote failures are reported as empty
 * results, never as exceptions.
 */
public interface DrugSourcePort {

    /** Display name, e.g. "OpenFDA Drug Label API". */
    String name();

    /** Issuing authority stamped on every record, e.g. "FDA". */
    String authority();

    List<String> search(String query, int limit);

    Optional<NormalizedDrugData> fetchDrugData(String genericName, RequestPacing pacing);

    default Optional<NormalizedDrugData> fetchDrugData(String genericName) {
        return fetchDrugData(genericName, RequestPacing.BATCH);
    }

    /** Providers without interaction data return an empty list. */
    List<DrugInteraction> fetchInteractions(String genericName);
}
