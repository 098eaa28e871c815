package org.clerasense.application.usecase;

import org.clerasense.application.port.DrugSourcePort;
import org.clerasense.config.IngestionProperties;
import org.clerasense.domain.model.drug.NormalizedDrugData;
import org.clerasense.domain.model.ingestion.RequestPacing;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.clerasense.application.usecase.IngestDrugUseCaseTest.data;
import static org.clerasense.application.usecase.IngestDrugUseCaseTest.source;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SourceFanOutTest {

    private ExecutorService pool;
    private IngestionProperties props;

    @BeforeEach
    void setUp() {
        pool = Executors.newSingleThreadExecutor();
        props = new IngestionProperties();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static DrugSourcePort answeringAfter(String authority, long millis) {
        DrugSourcePort s = source(authority);
        when(s.fetchDrugData(anyString(), any())).thenAnswer(inv -> {
            Thread.sleep(millis);
            return Optional.of(data(authority, inv.getArgument(0)));
        });
        return s;
    }

    @Test
    void time_queued_for_a_worker_does_not_count_against_the_timeout() {
        // Arrange: one worker, so the second call waits for the first to finish
        props.setAdapterTimeout(Duration.ofMillis(600));
        SourceFanOut fanOut = new SourceFanOut(
                List.of(answeringAfter("FDA", 400), answeringAfter("NIH/NLM", 400)), pool, props);

        // Act
        List<NormalizedDrugData> results = fanOut.fetchAll("Lisinopril", RequestPacing.ON_DEMAND);

        // Assert
        assertEquals(2, results.size());
        assertEquals(List.of("FDA", "NIH/NLM"), results.stream().map(d -> d.provenance().sourceAuthority()).toList());
    }

    @Test
    void call_running_past_the_timeout_is_dropped() {
        props.setAdapterTimeout(Duration.ofMillis(200));
        pool.shutdownNow();
        pool = Executors.newFixedThreadPool(2);
        SourceFanOut fanOut = new SourceFanOut(
                List.of(answeringAfter("FDA", 2_000), answeringAfter("CMS", 10)), pool, props);

        List<NormalizedDrugData> results = fanOut.fetchAll("Lisinopril", RequestPacing.ON_DEMAND);

        assertEquals(List.of("CMS"), results.stream().map(d -> d.provenance().sourceAuthority()).toList());
    }

    @Test
    void filter_limits_which_adapters_are_called() {
        DrugSourcePort fda = answeringAfter("FDA", 0);
        DrugSourcePort cms = answeringAfter("CMS", 0);
        SourceFanOut fanOut = new SourceFanOut(List.of(fda, cms), pool, props);

        List<NormalizedDrugData> results = fanOut.fetch("Lisinopril", RequestPacing.BATCH,
                s -> !"CMS".equals(s.authority()));

        assertEquals(1, results.size());
        verify(cms, never()).fetchDrugData(anyString(), any());
    }

    @Test
    void rejected_submission_counts_as_no_data() {
        pool.shutdown();
        SourceFanOut fanOut = new SourceFanOut(List.of(answeringAfter("FDA", 0)), pool, props);

        assertTrue(fanOut.fetchAll("Lisinopril", RequestPacing.ON_DEMAND).isEmpty());
    }
}
