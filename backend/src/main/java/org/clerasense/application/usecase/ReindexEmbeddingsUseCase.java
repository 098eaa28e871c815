package org.clerasense.application.usecase;

import org.clerasense.application.port.DrugStorePort;
import org.clerasense.application.port.EmbeddingPort;
import org.clerasense.domain.model.drug.DrugRecord;
import org.clerasense.domain.service.profile.DrugProfileText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ReindexEmbeddingsUseCase {

    private static final Logger log = LoggerFactory.getLogger(ReindexEmbeddingsUseCase.class);

    private final DrugStorePort store;
    private final EmbeddingPort embedding;

    public ReindexEmbeddingsUseCase(DrugStorePort store, EmbeddingPort embedding) {
        this.store = store;
        this.embedding = embedding;
    }

    public int reindexMissing() {
        List<DrugRecord> missing = store.findAll().stream()
                .filter(d -> !store.hasEmbedding(d.id(), DrugProfileText.FIELD_NAME))
                .toList();
        if (missing.isEmpty()) {
            log.info("All stored drugs already have embeddings");
            return 0;
        }

        List<float[]> vectors = embedding.embedBatch(missing.stream().map(DrugProfileText::of).toList());
        for (int i = 0; i < missing.size(); i++) {
            store.saveEmbedding(missing.get(i).id(), DrugProfileText.FIELD_NAME, vectors.get(i), embedding.modelName());
        }
        log.info("Indexed {} drug profile(s) with {}", missing.size(), embedding.modelName());
        return missing.size();
    }
}
