package org.clerasense.application.usecase;

import org.clerasense.application.port.DrugStorePort;
import org.clerasense.application.port.DuplicateDrugException;
import org.clerasense.domain.model.drug.DrugRecord;
import org.clerasense.domain.model.drug.NormalizedDrugData;
import org.clerasense.domain.model.ingestion.IngestionAuditEntry;
import org.clerasense.domain.model.verification.VerificationResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** Thread-safe store fake with the same uniqueness rule as the JDBC adapter. */
class InMemoryDrugStore implements DrugStorePort {

    final Map<Long, DrugRecord> drugs = new ConcurrentHashMap<>();
    final List<IngestionAuditEntry> audit = new CopyOnWriteArrayList<>();
    final Map<String, float[]> embeddings = new ConcurrentHashMap<>();
    final AtomicInteger inserts = new AtomicInteger();
    private final Map<String, Long> byKey = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    private static String key(String name) {
        return name.strip().toLowerCase(Locale.ROOT);
    }

    DrugRecord add(String genericName, String... brands) {
        long id = ids.incrementAndGet();
        DrugRecord r = new DrugRecord(id, genericName, List.of(brands), "", "", null,
                List.of(), null, null, List.of(), null, Instant.now());
        byKey.put(key(genericName), id);
        drugs.put(id, r);
        return r;
    }

    @Override
    public void ensureSchema() {
    }

    @Override
    public boolean exists(String genericName) {
        return byKey.containsKey(key(genericName));
    }

    @Override
    public synchronized long insertVerifiedDrug(NormalizedDrugData merged, VerificationResult verification) {
        long id = ids.incrementAndGet();
        if (byKey.putIfAbsent(key(merged.genericName()), id) != null) {
            throw new DuplicateDrugException(merged.genericName(), null);
        }
        inserts.incrementAndGet();
        drugs.put(id, new DrugRecord(id, merged.genericName(), merged.brandNames(), merged.drugClass(),
                merged.mechanismOfAction(), null, merged.indications(), null, null, merged.interactions(),
                null, Instant.now()));
        return id;
    }

    @Override
    public void appendAuditLog(IngestionAuditEntry entry) {
        audit.add(entry);
    }

    @Override
    public List<DrugRecord> readManyById(Collection<Long> ids) {
        List<DrugRecord> out = new ArrayList<>();
        for (Long id : ids) {
            DrugRecord r = drugs.get(id);
            if (r != null) out.add(r);
        }
        return out;
    }

    @Override
    public Optional<DrugRecord> findById(long id) {
        return Optional.ofNullable(drugs.get(id));
    }

    @Override
    public synchronized Optional<DrugRecord> findByGenericName(String name) {
        Long id = byKey.get(key(name));
        return id == null ? Optional.empty() : Optional.ofNullable(drugs.get(id));
    }

    @Override
    public Optional<DrugRecord> findFirstByGenericNameContaining(String fragment) {
        String f = key(fragment);
        return drugs.values().stream()
                .filter(d -> key(d.genericName()).contains(f))
                .min((a, b) -> Long.compare(a.id(), b.id()));
    }

    @Override
    public Optional<DrugRecord> findByBrandName(String brand) {
        String b = key(brand);
        return drugs.values().stream()
                .filter(d -> d.brandNames().stream().anyMatch(x -> key(x).equals(b)))
                .min((x, y) -> Long.compare(x.id(), y.id()));
    }

    @Override
    public List<DrugRecord> searchByKeyword(String keyword, int limit) {
        String k = key(keyword);
        return drugs.values().stream()
                .filter(d -> key(d.genericName()).contains(k))
                .limit(limit)
                .toList();
    }

    @Override
    public List<DrugRecord> findAll() {
        return drugs.values().stream().sorted((a, b) -> Long.compare(a.id(), b.id())).toList();
    }

    @Override
    public void updateVerifiedFields(long id, String mechanismOfAction, List<String> addBrands, String drugClass) {
        DrugRecord r = drugs.get(id);
        List<String> brands = new ArrayList<>(r.brandNames());
        if (addBrands != null) brands.addAll(addBrands);
        drugs.put(id, new DrugRecord(id, r.genericName(), brands,
                drugClass != null ? drugClass : r.drugClass(),
                mechanismOfAction != null ? mechanismOfAction : r.mechanismOfAction(),
                r.source(), r.indications(), r.dosage(), r.safety(), r.interactions(), r.pricing(), r.createdAt()));
    }

    @Override
    public boolean hasEmbedding(long drugId, String fieldName) {
        return embeddings.containsKey(drugId + ":" + fieldName);
    }

    @Override
    public void saveEmbedding(long drugId, String fieldName, float[] vector, String modelName) {
        embeddings.put(drugId + ":" + fieldName, vector);
    }
}
