package org.clerasense.application.usecase;

import org.clerasense.application.port.DrugSourcePort;
import org.clerasense.config.IngestionProperties;
import org.clerasense.domain.model.drug.NormalizedDrugData;
import org.clerasense.domain.model.ingestion.RequestPacing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Queries every source adapter for one drug in parallel and waits for all of them.
 * Each adapter call gets its own timeout, counted from when the call starts on a worker.
 * A slow or failing adapter never cancels its siblings.
 */
@Component
public class SourceFanOut {

    private static final Logger log = LoggerFactory.getLogger(SourceFanOut.class);

    private final List<DrugSourcePort> sources;
    private final Executor executor;
    private final Duration timeout;

    public SourceFanOut(List<DrugSourcePort> sources,
                        @Qualifier("sourceFetchExecutor") Executor executor,
                        IngestionProperties props) {
        this.sources = List.copyOf(sources);
        this.executor = executor;
        this.timeout = props.getAdapterTimeout();
    }

    public List<DrugSourcePort> sources() {
        return sources;
    }

    public List<NormalizedDrugData> fetchAll(String drugName, RequestPacing pacing) {
        return fetch(drugName, pacing, s -> true);
    }

    /** Records from the matching adapters, in adapter registration order. */
    public List<NormalizedDrugData> fetch(String drugName, RequestPacing pacing, Predicate<DrugSourcePort> which) {
        List<CompletableFuture<Optional<NormalizedDrugData>>> futures = sources.stream()
                .filter(which)
                .map(s -> fetchOne(s, drugName, pacing))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream()
                .map(CompletableFuture::join)
                .flatMap(Optional::stream)
                .toList();
    }

    private CompletableFuture<Optional<NormalizedDrugData>> fetchOne(DrugSourcePort source, String drugName,
                                                                     RequestPacing pacing) {
        CompletableFuture<Optional<NormalizedDrugData>> call = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                // the timeout covers the adapter call only, not the time spent queued for a worker
                call.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
                try {
                    Optional<NormalizedDrugData> data = source.fetchDrugData(drugName, pacing);
                    call.complete(data == null ? Optional.empty() : data);
                } catch (RuntimeException e) {
                    call.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            call.completeExceptionally(e);
        }
        return call
                .whenComplete((data, ex) -> {
                    if (ex == null && data.isPresent()) log.debug("{} returned data for '{}'", source.name(), drugName);
                })
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    if (cause instanceof TimeoutException) {
                        log.warn("{} timed out after {}ms for '{}'", source.name(), timeout.toMillis(), drugName);
                    } else {
                        log.warn("{} fetch failed for '{}': {}", source.name(), drugName, cause.toString());
                    }
                    return Optional.empty();
                });
    }
}
