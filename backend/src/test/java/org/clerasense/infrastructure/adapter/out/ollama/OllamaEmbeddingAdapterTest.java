package org.clerasense.infrastructure.adapter.out.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OllamaEmbeddingAdapterTest {

    private MockWebServer server;
    private OllamaEmbeddingAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        adapter = new OllamaEmbeddingAdapter(server.url("/").toString(), "nomic-embed-text");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void embed_posts_model_and_input() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"model\":\"nomic-embed-text\",\"embeddings\":[[0.5,-0.25,1]]}"));

        float[] v = adapter.embed("Lisinopril. ACE inhibitor.");

        assertArrayEquals(new float[]{0.5f, -0.25f, 1f}, v);
        RecordedRequest req = server.takeRequest();
        assertEquals("/api/embed", req.getPath());
        JsonNode body = new ObjectMapper().readTree(req.getBody().readUtf8());
        assertEquals("nomic-embed-text", body.get("model").asText());
        assertEquals("Lisinopril. ACE inhibitor.", body.get("input").get(0).asText());
    }

    @Test
    void batch_is_chunked() throws Exception {
        int n = OllamaEmbeddingAdapter.MAX_BATCH + 2;
        server.enqueue(new MockResponse().setBody(vectors(OllamaEmbeddingAdapter.MAX_BATCH)));
        server.enqueue(new MockResponse().setBody(vectors(2)));

        List<float[]> out = adapter.embedBatch(Collections.nCopies(n, "text"));

        assertEquals(n, out.size());
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void server_error_surfaces_as_illegal_state() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"error\":\"model not found\"}"));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> adapter.embed("text"));
        assertTrue(e.getMessage().contains("nomic-embed-text"));
    }

    @Test
    void vector_count_mismatch_is_rejected() {
        server.enqueue(new MockResponse().setBody(vectors(1)));

        assertThrows(IllegalStateException.class, () -> adapter.embedBatch(List.of("a", "b")));
    }

    private static String vectors(int count) {
        return "{\"embeddings\":[" + String.join(",", Collections.nCopies(count, "[0.1,0.2]")) + "]}";
    }
}
