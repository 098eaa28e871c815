package org.clerasense.application.usecase;

import org.clerasense.application.port.DrugSourcePort;
import org.clerasense.application.port.DrugStorePort;
import org.clerasense.domain.model.drug.DrugRecord;
import org.clerasense.domain.model.ingestion.IngestionResult;
import org.clerasense.domain.model.lookup.LookupResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class LookupDrugsUseCase {

    private static final Logger log = LoggerFactory.getLogger(LookupDrugsUseCase.class);

    static final int EXTERNAL_SEARCH_LIMIT = 5;

    private final DrugStorePort store;
    private final IngestDrugUseCase ingest;
    private final Executor fillExecutor;
    private final DrugSourcePort searchSource;

    public LookupDrugsUseCase(DrugStorePort store,
                              IngestDrugUseCase ingest,
                              @Qualifier("lookupFillExecutor") Executor fillExecutor,
                              @Qualifier("openFdaSource") DrugSourcePort searchSource) {
        this.store = store;
        this.ingest = ingest;
        this.fillExecutor = fillExecutor;
        this.searchSource = searchSource;
    }

    public Optional<DrugRecord> lookupOne(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String clean = name.strip();

        Optional<DrugRecord> stored = store.findByNameOrBrand(clean);
        if (stored.isPresent()) return stored;

        log.info("Drug '{}' not in store, attempting on-demand ingestion", clean);
        return ingestOnDemand(clean);
    }

    public LookupResult lookupMany(List<String> names) {
        if (names == null || names.isEmpty()) return new LookupResult(List.of(), List.of());
        List<String> clean = names.stream()
                .filter(n -> n != null && !n.isBlank())
                .map(String::strip)
                .toList();
        if (clean.isEmpty()) return new LookupResult(List.of(), List.of());

        // keyed by lower-cased name; missing keeps the first spelling seen
        Map<String, Long> resolved = new ConcurrentHashMap<>();
        Map<String, String> missing = new LinkedHashMap<>();
        for (String n : clean) {
            String key = key(n);
            if (resolved.containsKey(key) || missing.containsKey(key)) continue;
            Optional<DrugRecord> hit = store.findByNameOrBrand(n);
            if (hit.isPresent()) resolved.put(key, hit.get().id());
            else missing.put(key, n);
        }

        if (!missing.isEmpty()) {
            log.info("Ingesting {} missing drug(s) in parallel: {}", missing.size(), missing.values());
            List<CompletableFuture<Void>> fills = missing.entrySet().stream()
                    .map(e -> CompletableFuture
                            .supplyAsync(() -> ingestOnDemand(e.getValue()), fillExecutor)
                            .thenAccept(r -> r.ifPresent(rec -> resolved.put(e.getKey(), rec.id())))
                            .exceptionally(ex -> {
                                log.error("Parallel ingestion error for '{}': {}", e.getValue(), ex.toString());
                                return null;
                            }))
                    .toList();
            CompletableFuture.allOf(fills.toArray(new CompletableFuture[0])).join();
        }

        // fill workers used their own store access; reload everything for one consistent view
        Map<Long, DrugRecord> reloaded = store.readManyById(new HashSet<>(resolved.values())).stream()
                .collect(Collectors.toMap(DrugRecord::id, Function.identity(), (a, b) -> a));

        List<DrugRecord> found = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        Set<String> reported = new HashSet<>();
        for (String n : clean) {
            Long id = resolved.get(key(n));
            if (id == null) {
                if (reported.add(key(n))) notFound.add(n);
            } else if (reloaded.containsKey(id) && seen.add(id)) {
                found.add(reloaded.get(id));
            }
        }
        return new LookupResult(found, notFound);
    }

    public List<DrugRecord> search(String query, int limit) {
        if (query == null || query.isBlank() || limit <= 0) return List.of();
        String q = query.strip().toLowerCase(Locale.ROOT);

        List<DrugRecord> results = store.searchByKeyword(q, limit);
        if (!results.isEmpty()) return results;

        List<DrugRecord> discovered = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        try {
            for (String candidate : searchSource.search(q, EXTERNAL_SEARCH_LIMIT)) {
                lookupOne(candidate).filter(r -> seen.add(r.id())).ifPresent(discovered::add);
                if (discovered.size() >= limit) break;
            }
        } catch (RuntimeException e) {
            log.warn("External drug search failed for '{}': {}", q, e.toString());
        }
        return discovered;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private Optional<DrugRecord> ingestOnDemand(String name) {
        IngestionResult result = ingest.ingest(name);
        if (result.status().hasRecord()) {
            Optional<DrugRecord> rec = result.recordId() != null
                    ? store.findById(result.recordId())
                    : store.findByGenericName(name);
            if (rec.isPresent()) {
                log.info("On-demand ingestion resolved '{}' ({})", name, result.status().label());
                return rec;
            }
        }
        log.info("On-demand ingestion for '{}' ended with status: {}", name, result.status().label());
        return Optional.empty();
    }
}
