package org.clerasense.application.usecase;

import org.clerasense.application.port.DrugStorePort;
import org.clerasense.application.port.EmbeddingPort;
import org.clerasense.domain.model.drug.DrugRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ReindexEmbeddingsUseCaseTest {

    private DrugStorePort store;
    private EmbeddingPort embedding;
    private ReindexEmbeddingsUseCase useCase;

    @BeforeEach
    void setUp() {
        store = mock(DrugStorePort.class);
        embedding = mock(EmbeddingPort.class);
        when(embedding.modelName()).thenReturn("nomic-embed-text");
        useCase = new ReindexEmbeddingsUseCase(store, embedding);
    }

    private static DrugRecord record(long id, String name) {
        return new DrugRecord(id, name, List.of(), "", "", null, List.of(), null, null, List.of(), null, Instant.now());
    }

    @Test
    void embeds_only_drugs_without_a_profile_vector() {
        when(store.findAll()).thenReturn(List.of(record(1, "Aspirin"), record(2, "Warfarin")));
        when(store.hasEmbedding(1, "full_profile")).thenReturn(true);
        when(store.hasEmbedding(2, "full_profile")).thenReturn(false);
        float[] vector = {0.5f, 0.25f};
        when(embedding.embedBatch(anyList())).thenReturn(List.of(vector));

        int indexed = useCase.reindexMissing();

        assertEquals(1, indexed);
        verify(embedding).embedBatch(argThat(texts -> texts.size() == 1 && texts.get(0).contains("Warfarin")));
        verify(store).saveEmbedding(2, "full_profile", vector, "nomic-embed-text");
        verify(store, never()).saveEmbedding(eq(1L), anyString(), any(), anyString());
    }

    @Test
    void nothing_to_do_when_every_drug_is_indexed() {
        when(store.findAll()).thenReturn(List.of(record(1, "Aspirin")));
        when(store.hasEmbedding(1, "full_profile")).thenReturn(true);

        assertEquals(0, useCase.reindexMissing());
        verify(embedding, never()).embedBatch(anyList());
    }
}
