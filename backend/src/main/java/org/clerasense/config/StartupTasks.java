package org.clerasense.config;

import org.clerasense.application.port.DrugStorePort;
import org.clerasense.application.usecase.DiscoverDrugsUseCase;
import org.clerasense.domain.model.ingestion.DiscoveryReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Component
public class StartupTasks implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupTasks.class);

    private final DrugStorePort store;
    private final DiscoverDrugsUseCase discovery;
    private final Executor executor;

    @Value("${clerasense.schema.init:true}")
    private boolean schemaInit;
    @Value("${clerasense.discovery.on-startup:false}")
    private boolean discoverOnStartup;
    @Value("${clerasense.discovery.batch-size:10}")
    private int batchSize;
    @Value("${clerasense.discovery.max-batches:5}")
    private int maxBatches;

    public StartupTasks(DrugStorePort store,
                        DiscoverDrugsUseCase discovery,
                        @Qualifier("discoveryExecutor") Executor executor) {
        this.store = store;
        this.discovery = discovery;
        this.executor = executor;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (schemaInit) {
            log.info("Ensuring drug store schema");
            store.ensureSchema();
        } else {
            log.info("Schema init disabled (clerasense.schema.init=false)");
        }

        if (!discoverOnStartup) return;
        log.info("Starting background discovery: {} batch(es) of {}", maxBatches, batchSize);
        CompletableFuture
                .supplyAsync(() -> discovery.runDiscoveryBatch(batchSize, maxBatches), executor)
                .whenComplete((DiscoveryReport report, Throwable ex) -> {
                    if (ex != null) {
                        log.error("Background discovery failed", ex);
                    } else {
                        log.info("Discovery finished: {} discovered, {} ingested, {} skipped, {} unverified, {} failed",
                                report.discovered(), report.ingested(), report.skipped(),
                                report.unverified(), report.failed());
                    }
                });
    }
}
