package org.clerasense.application.usecase;

import org.clerasense.application.port.CandidateSourcePort;
import org.clerasense.config.IngestionProperties;
import org.clerasense.domain.model.ingestion.DiscoveryReport;
import org.clerasense.domain.model.ingestion.IngestionResult;
import org.clerasense.domain.model.ingestion.RequestPacing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class DiscoverDrugsUseCase {

    private static final Logger log = LoggerFactory.getLogger(DiscoverDrugsUseCase.class);

    private final CandidateSourcePort candidates;
    private final IngestDrugUseCase ingest;
    private final IngestionProperties props;

    public DiscoverDrugsUseCase(CandidateSourcePort candidates, IngestDrugUseCase ingest, IngestionProperties props) {
        this.candidates = candidates;
        this.ingest = ingest;
        this.props = props;
    }

    public DiscoveryReport runDiscoveryBatch(int batchSize, int maxBatches) {
        if (batchSize <= 0 || maxBatches <= 0) {
            throw new IllegalArgumentException("batchSize and maxBatches must be positive");
        }
        RequestPacing pacing = new RequestPacing(props.getBatchDelayScale());
        int discovered = 0, ingested = 0, skipped = 0, unverified = 0, failed = 0;
        List<IngestionResult> details = new ArrayList<>();

        for (int batch = 0; batch < maxBatches; batch++) {
            int offset = batch * batchSize;
            List<String> names = candidates.page(offset, batchSize);
            if (names.isEmpty()) {
                log.info("No more drugs to discover at offset {}", offset);
                break;
            }
            discovered += names.size();

            for (String name : names) {
                IngestionResult r = ingest.ingest(name, pacing);
                switch (r.status()) {
                    case INGESTED -> ingested++;
                    case SKIPPED -> skipped++;
                    case UNVERIFIED -> unverified++;
                    default -> failed++;
                }
                details.add(r);
            }
            log.info("Batch {}/{} complete: {} ingested, {} skipped", batch + 1, maxBatches, ingested, skipped);
        }
        return new DiscoveryReport(discovered, ingested, skipped, unverified, failed, details);
    }
}
