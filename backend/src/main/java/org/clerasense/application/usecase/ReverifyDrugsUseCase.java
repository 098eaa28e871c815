package org.clerasense.application.usecase;

import org.clerasense.application.port.DrugSourcePort;
import org.clerasense.application.port.DrugStorePort;
import org.clerasense.application.port.EmbeddingPort;
import org.clerasense.config.IngestionProperties;
import org.clerasense.domain.model.drug.DrugRecord;
import org.clerasense.domain.model.drug.NormalizedDrugData;
import org.clerasense.domain.model.ingestion.RequestPacing;
import org.clerasense.domain.model.ingestion.ReverifyReport;
import org.clerasense.domain.model.verification.VerificationResult;
import org.clerasense.domain.service.profile.DrugProfileText;
import org.clerasense.domain.service.verification.VerificationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

@Service
public class ReverifyDrugsUseCase {

    private static final Logger log = LoggerFactory.getLogger(ReverifyDrugsUseCase.class);

    private static final Set<String> LABEL_AUTHORITIES = Set.of("FDA", "NIH/NLM");
    private static final Predicate<DrugSourcePort> LABEL_SOURCES = s -> LABEL_AUTHORITIES.contains(s.authority());

    private final DrugStorePort store;
    private final SourceFanOut fanOut;
    private final VerificationEngine engine;
    private final EmbeddingPort embedding;
    private final IngestionProperties props;

    public ReverifyDrugsUseCase(DrugStorePort store,
                                SourceFanOut fanOut,
                                VerificationEngine engine,
                                EmbeddingPort embedding,
                                IngestionProperties props) {
        this.store = store;
        this.fanOut = fanOut;
        this.engine = engine;
        this.embedding = embedding;
        this.props = props;
    }

    public ReverifyReport reverifyAll() {
        RequestPacing pacing = new RequestPacing(props.getBatchDelayScale());
        int updated = 0, unchanged = 0, errors = 0;
        for (DrugRecord drug : store.findAll()) {
            try {
                if (reverify(drug, pacing)) updated++;
                else unchanged++;
            } catch (RuntimeException e) {
                log.error("Update failed for drug '{}': {}", drug.genericName(), e.toString());
                errors++;
            }
        }
        log.info("Re-verification done: {} updated, {} unchanged, {} errors", updated, unchanged, errors);
        return new ReverifyReport(updated, unchanged, errors);
    }

    private boolean reverify(DrugRecord drug, RequestPacing pacing) {
        List<NormalizedDrugData> fresh = fanOut.fetch(drug.genericName(), pacing, LABEL_SOURCES);
        if (fresh.isEmpty()) return false;

        VerificationResult v = engine.verify(drug.genericName(), fresh);
        if (!v.verified() || !v.hasMergedData()) return false;
        NormalizedDrugData merged = v.mergedData();

        String mechanism = merged.mechanismOfAction().length() > nz(drug.mechanismOfAction()).length()
                ? merged.mechanismOfAction() : null;

        Set<String> known = new HashSet<>();
        drug.brandNames().forEach(b -> known.add(b.toLowerCase(Locale.ROOT)));
        List<String> newBrands = merged.brandNames().stream()
                .filter(b -> known.add(b.toLowerCase(Locale.ROOT)))
                .toList();

        String drugClass = nz(drug.drugClass()).isEmpty() && !merged.drugClass().isEmpty()
                ? merged.drugClass() : null;

        if (mechanism == null && newBrands.isEmpty() && drugClass == null) return false;

        store.updateVerifiedFields(drug.id(), mechanism, newBrands, drugClass);
        log.info("Updated '{}' from {}", drug.genericName(), v.sourcesUsed());
        reembed(drug.id());
        return true;
    }

    private void reembed(long drugId) {
        if (!props.isEnrichmentEnabled()) return;
        try {
            DrugRecord updated = store.findById(drugId).orElseThrow();
            float[] vector = embedding.embed(DrugProfileText.of(updated));
            store.saveEmbedding(drugId, DrugProfileText.FIELD_NAME, vector, embedding.modelName());
        } catch (RuntimeException e) {
            log.warn("Embedding refresh failed for drug {}: {}", drugId, e.getMessage());
        }
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
