package org.clerasense.application.usecase;

import org.clerasense.application.port.DrugStorePort;
import org.clerasense.application.port.DuplicateDrugException;
import org.clerasense.application.port.EmbeddingPort;
import org.clerasense.config.IngestionProperties;
import org.clerasense.domain.model.drug.DrugRecord;
import org.clerasense.domain.model.drug.NormalizedDrugData;
import org.clerasense.domain.model.ingestion.IngestionAuditEntry;
import org.clerasense.domain.model.ingestion.IngestionResult;
import org.clerasense.domain.model.ingestion.IngestionStage;
import org.clerasense.domain.model.ingestion.IngestionStatus;
import org.clerasense.domain.model.ingestion.RequestPacing;
import org.clerasense.domain.model.verification.VerificationResult;
import org.clerasense.domain.service.profile.DrugProfileText;
import org.clerasense.domain.service.text.LabelTextCleaner;
import org.clerasense.domain.service.verification.VerificationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class IngestDrugUseCase {

    private static final Logger log = LoggerFactory.getLogger(IngestDrugUseCase.class);

    private final DrugStorePort store;
    private final SourceFanOut fanOut;
    private final VerificationEngine engine;
    private final EmbeddingPort embedding;
    private final IngestionProperties props;

    public IngestDrugUseCase(DrugStorePort store,
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

    public IngestionResult ingest(String drugName) {
        return ingest(drugName, new RequestPacing(props.getOnDemandDelayScale()));
    }

    public IngestionResult ingest(String drugName, RequestPacing pacing) {
        if (drugName == null || drugName.isBlank()) {
            throw new IllegalArgumentException("drug name must not be blank");
        }
        String name = LabelTextCleaner.titleCase(drugName.strip());

        stage(name, IngestionStage.CHECK_EXISTS);
        Optional<DrugRecord> existing = store.findByGenericName(name);
        if (existing.isPresent()) {
            IngestionResult skipped = IngestionResult.skipped(name, existing.get().id(), "Already in database");
            audit(name, "ingestion", IngestionStage.CHECK_EXISTS, skipped, List.of());
            return skipped;
        }

        log.info("Ingesting drug: {}", name);
        stage(name, IngestionStage.FETCHING);
        List<NormalizedDrugData> sourceResults = fanOut.fetchAll(name, pacing);
        if (sourceResults.isEmpty()) {
            IngestionResult notFound = IngestionResult.notFound(name);
            audit(name, "discovery", IngestionStage.FETCHING, notFound, List.of());
            return notFound;
        }

        stage(name, IngestionStage.VERIFYING);
        VerificationResult v = engine.verify(name, sourceResults);
        if (!v.verified() || !v.hasMergedData()) {
            IngestionResult unverified = new IngestionResult(name, IngestionStatus.UNVERIFIED, v.confidence(),
                    v.sourcesUsed(), v.conflicts(), null, String.join("; ", v.notes()));
            audit(name, "verification", IngestionStage.VERIFYING, unverified, v.conflicts());
            return unverified;
        }

        stage(name, IngestionStage.PERSISTING);
        long id;
        try {
            id = store.insertVerifiedDrug(v.mergedData(), v);
        } catch (DuplicateDrugException e) {
            // lost the race on the unique name; the winner's record is the answer
            Long winner = store.findByGenericName(name).map(DrugRecord::id).orElse(null);
            IngestionResult skipped = IngestionResult.skipped(name, winner, "Already in database");
            audit(name, "ingestion", IngestionStage.PERSISTING, skipped, v.conflicts());
            return skipped;
        } catch (RuntimeException e) {
            log.error("Persisting '{}' failed: {}", name, e.toString());
            IngestionResult failed = new IngestionResult(name, IngestionStatus.INSERT_FAILED, v.confidence(),
                    v.sourcesUsed(), v.conflicts(), null, "Database insert failed");
            audit(name, "insertion", IngestionStage.PERSISTING, failed, v.conflicts());
            return failed;
        }

        if (props.isEnrichmentEnabled()) {
            stage(name, IngestionStage.ENRICHING);
            enrich(id, name, v.mergedData());
        }

        stage(name, IngestionStage.DONE);
        IngestionResult ingested = new IngestionResult(name, IngestionStatus.INGESTED, v.confidence(),
                v.sourcesUsed(), v.conflicts(), id, String.join("; ", v.notes()));
        audit(name, "ingestion", IngestionStage.DONE, ingested, v.conflicts());
        return ingested;
    }

    private void enrich(long drugId, String name, NormalizedDrugData merged) {
        try {
            if (store.hasEmbedding(drugId, DrugProfileText.FIELD_NAME)) return;
            float[] vector = embedding.embed(DrugProfileText.of(merged));
            store.saveEmbedding(drugId, DrugProfileText.FIELD_NAME, vector, embedding.modelName());
            log.info("Generated embedding for drug '{}'", name);
        } catch (RuntimeException e) {
            log.warn("Embedding generation failed for '{}': {}", name, e.getMessage());
        }
    }

    private void audit(String name, String sourceApi, IngestionStage stage, IngestionResult result,
                       List<String> conflicts) {
        log.info("Ingestion of '{}' ended {} at {}", name, result.status().label(), stage);
        try {
            store.appendAuditLog(new IngestionAuditEntry(name, sourceApi, stage, result.status(),
                    result.confidence(), result.sourcesUsed(), conflicts, result.reason()));
        } catch (RuntimeException e) {
            log.warn("Failed to write ingestion log for '{}': {}", name, e.toString());
        }
    }

    private static void stage(String name, IngestionStage stage) {
        log.debug("[{}] {}", name, stage);
    }
}
