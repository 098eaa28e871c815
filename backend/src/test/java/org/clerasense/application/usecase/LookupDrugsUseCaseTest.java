package org.clerasense.application.usecase;

import org.clerasense.application.port.DrugSourcePort;
import org.clerasense.application.port.EmbeddingPort;
import org.clerasense.config.IngestionProperties;
import org.clerasense.domain.model.drug.DrugRecord;
import org.clerasense.domain.model.lookup.LookupResult;
import org.clerasense.domain.service.verification.VerificationEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.clerasense.application.usecase.IngestDrugUseCaseTest.data;
import static org.clerasense.application.usecase.IngestDrugUseCaseTest.source;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LookupDrugsUseCaseTest {

    private DrugSourcePort fda;
    private DrugSourcePort nlm;
    private InMemoryDrugStore store;
    private ExecutorService fetchPool;
    private ExecutorService fillPool;
    private LookupDrugsUseCase useCase;

    @BeforeEach
    void setUp() {
        fda = source("FDA");
        nlm = source("NIH/NLM");
        EmbeddingPort embedding = mock(EmbeddingPort.class);
        when(embedding.embed(anyString())).thenReturn(new float[]{1f});
        when(embedding.modelName()).thenReturn("test-embed");

        IngestionProperties props = new IngestionProperties();
        store = new InMemoryDrugStore();
        fetchPool = Executors.newFixedThreadPool(4);
        fillPool = Executors.newFixedThreadPool(4);
        SourceFanOut fanOut = new SourceFanOut(List.of(fda, nlm), fetchPool, props);
        IngestDrugUseCase ingest = new IngestDrugUseCase(store, fanOut, new VerificationEngine(), embedding, props);
        useCase = new LookupDrugsUseCase(store, ingest, fillPool, fda);
    }

    @AfterEach
    void tearDown() {
        fetchPool.shutdownNow();
        fillPool.shutdownNow();
    }

    private void fetchable(String name) {
        when(fda.fetchDrugData(eq(name), any())).thenReturn(Optional.of(data("FDA", name)));
        when(nlm.fetchDrugData(eq(name), any())).thenReturn(Optional.of(data("NIH/NLM", name)));
    }

    @Test
    void batch_lookup_keeps_caller_order_and_lists_each_record_once() {
        DrugRecord aspirin = store.add("Aspirin", "Bayer");
        fetchable("Bisoprolol");

        LookupResult r = useCase.lookupMany(Arrays.asList(" Bisoprolol", "Aspirin", "Zzzznotadrug", "bayer", "", null));

        assertEquals(List.of("Bisoprolol", "Aspirin"), r.found().stream().map(DrugRecord::genericName).toList());
        assertEquals(aspirin.id(), r.found().get(1).id());
        assertEquals(List.of("Zzzznotadrug"), r.notFound());
        assertEquals(1, store.inserts.get());
    }

    @Test
    void batch_lookup_treats_names_differing_only_in_case_as_one_drug() {
        fetchable("Metformin");

        LookupResult r = useCase.lookupMany(List.of("Metformin", "metformin", "Zzzznotadrug", "ZZZZNOTADRUG"));

        assertEquals(List.of("Metformin"), r.found().stream().map(DrugRecord::genericName).toList());
        assertEquals(List.of("Zzzznotadrug"), r.notFound());
        assertEquals(1, store.inserts.get());
        verify(fda, times(1)).fetchDrugData(eq("Metformin"), any());
        verify(fda, times(1)).fetchDrugData(eq("Zzzznotadrug"), any());
    }

    @Test
    void batch_lookup_of_stored_drugs_never_calls_sources() {
        store.add("Aspirin");
        store.add("Metformin");

        LookupResult r = useCase.lookupMany(List.of("metformin", "aspirin"));

        assertEquals(List.of("Metformin", "Aspirin"), r.found().stream().map(DrugRecord::genericName).toList());
        assertTrue(r.notFound().isEmpty());
        verify(fda, never()).fetchDrugData(anyString(), any());
    }

    @Test
    void empty_batch_gives_empty_result() {
        LookupResult r = useCase.lookupMany(List.of());
        assertTrue(r.found().isEmpty());
        assertTrue(r.notFound().isEmpty());
    }

    @Test
    void single_lookup_falls_back_to_brand_then_ingestion() {
        store.add("Lisinopril", "Zestril");
        fetchable("Atorvastatin");

        assertEquals("Lisinopril", useCase.lookupOne("zestril").orElseThrow().genericName());
        assertEquals("Atorvastatin", useCase.lookupOne("atorvastatin").orElseThrow().genericName());
        assertTrue(useCase.lookupOne("   ").isEmpty());
        assertTrue(useCase.lookupOne("Zzzznotadrug").isEmpty());
    }

    @Test
    void concurrent_batches_asking_for_the_same_unknown_drug_share_one_record() throws Exception {
        fetchable("Omeprazole");
        fetchable("Losartan");

        int callers = 6;
        ExecutorService callerPool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<LookupResult>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            List<String> names = i % 2 == 0 ? List.of("omeprazole", "losartan") : List.of("Losartan", "Omeprazole");
            futures.add(callerPool.submit(() -> {
                start.await();
                return useCase.lookupMany(names);
            }));
        }
        start.countDown();

        for (Future<LookupResult> f : futures) {
            LookupResult r = f.get();
            assertEquals(2, r.found().size());
            assertTrue(r.notFound().isEmpty());
        }
        callerPool.shutdownNow();

        assertEquals(2, store.inserts.get());
        assertEquals(2, store.findAll().size());
    }

    @Test
    void search_uses_stored_records_first() {
        store.add("Metformin");

        List<DrugRecord> hits = useCase.search("METF", 5);

        assertEquals(1, hits.size());
        verify(fda, never()).search(anyString(), anyInt());
    }

    @Test
    void search_resolves_provider_suggestions_when_store_has_nothing() {
        when(fda.search("statin", LookupDrugsUseCase.EXTERNAL_SEARCH_LIMIT))
                .thenReturn(List.of("Atorvastatin", "Zzzznotadrug"));
        fetchable("Atorvastatin");

        List<DrugRecord> hits = useCase.search("statin", 5);

        assertEquals(List.of("Atorvastatin"), hits.stream().map(DrugRecord::genericName).toList());
    }
}
