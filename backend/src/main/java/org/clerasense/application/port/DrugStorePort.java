package org.clerasense.application.port;

import org.clerasense.domain.model.drug.DrugRecord;
import org.clerasense.domain.model.drug.NormalizedDrugData;
import org.clerasense.domain.model.ingestion.IngestionAuditEntry;
import org.clerasense.domain.model.verification.VerificationResult;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence gateway for verified drug records. Every call is independent: implementations
 * must not share a session or connection between concurrent callers.
 */
public interface DrugStorePort {

    void ensureSchema();

    /** Case-insensitive, exact generic name. */
    boolean exists(String genericName);

    /**
     * Writes the drug row and all child rows atomically.
     *
     * @return id of the new drug row
     * @throws DuplicateDrugException when another writer stored the same generic name first
     * @throws DrugStoreException     on any other persistence failure (nothing is written)
     */
    long insertVerifiedDrug(NormalizedDrugData merged, VerificationResult verification);

    /** Never throws; failures are logged by the implementation. */
    void appendAuditLog(IngestionAuditEntry entry);

    /** Records for the given ids; unknown ids are skipped, order is unspecified. */
    List<DrugRecord> readManyById(Collection<Long> ids);

    Optional<DrugRecord> findById(long id);

    Optional<DrugRecord> findByGenericName(String name);

    Optional<DrugRecord> findFirstByGenericNameContaining(String fragment);

    Optional<DrugRecord> findByBrandName(String brand);

    /** Exact generic name, then partial generic name, then brand name. */
    default Optional<DrugRecord> findByNameOrBrand(String name) {
        Optional<DrugRecord> hit = findByGenericName(name);
        if (hit.isEmpty()) hit = findFirstByGenericNameContaining(name);
        if (hit.isEmpty()) hit = findByBrandName(name);
        return hit;
    }

    /** Matches generic name, drug class or mechanism text. */
    List<DrugRecord> searchByKeyword(String keyword, int limit);

    List<DrugRecord> findAll();

    /**
     * Applies a re-verification update. Null arguments leave the stored value untouched.
     *
     * @param addBrands brand names to append
     */
    void updateVerifiedFields(long id, String mechanismOfAction, List<String> addBrands, String drugClass);

    boolean hasEmbedding(long drugId, String fieldName);

    void saveEmbedding(long drugId, String fieldName, float[] vector, String modelName);
}
