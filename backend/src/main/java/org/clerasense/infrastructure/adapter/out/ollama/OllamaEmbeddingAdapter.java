package org.clerasense.infrastructure.adapter.out.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.*;
import org.clerasense.application.port.EmbeddingPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class OllamaEmbeddingAdapter implements EmbeddingPort {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingAdapter.class);

    private static final MediaType JSON = MediaType.parse("application/json");
    static final int MAX_BATCH = 16;

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();
    private final String baseUrl;
    private final String model;

    public OllamaEmbeddingAdapter(String baseUrl, String model) {
        this(baseUrl, model, new OkHttpClient.Builder().callTimeout(Duration.ofSeconds(60)).build());
    }

    public OllamaEmbeddingAdapter(String baseUrl, String model, OkHttpClient http) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.http = http;
    }

    @Override public String modelName() { return model; }

    @Override
    public float[] embed(String text) {
        return request(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += MAX_BATCH) {
            out.addAll(request(texts.subList(from, Math.min(texts.size(), from + MAX_BATCH))));
        }
        return out;
    }

    private List<float[]> request(List<String> inputs) {
        try {
            ObjectNode body = om.createObjectNode();
            body.put("model", model);
            inputs.forEach(body.putArray("input")::add);

            Request req = new Request.Builder()
                    .url(baseUrl + "/api/embed")
                    .post(RequestBody.create(om.writeValueAsBytes(body), JSON))
                    .build();

            try (Response resp = http.newCall(req).execute()) {
                if (!resp.isSuccessful()) {
                    throw new IOException("HTTP " + resp.code());
                }
                JsonNode embeddings = om.readTree(resp.body() != null ? resp.body().string() : "{}").path("embeddings");
                if (!embeddings.isArray() || embeddings.size() != inputs.size()) {
                    throw new IOException("expected " + inputs.size() + " vector(s), got " + embeddings.size());
                }
                List<float[]> vectors = new ArrayList<>(inputs.size());
                for (JsonNode e : embeddings) vectors.add(toFloatArray(e));
                log.debug("Embedded {} drug profile(s), dim={}", vectors.size(), vectors.get(0).length);
                return vectors;
            }
        } catch (IOException e) {
            log.error("Embedding failed for model '{}' at {}: {}", model, baseUrl, e.getMessage());
            throw new IllegalStateException("Embedding failed for model '" + model + "' at " + baseUrl +
                    ". Check model is pulled and API reachable.", e);
        }
    }

    private float[] toFloatArray(JsonNode arr) throws IOException {
        if (arr == null || !arr.isArray() || arr.isEmpty()) throw new IOException("Expected numeric array, got: " + arr);
        float[] v = new float[arr.size()];
        for (int i = 0; i < arr.size(); i++) v[i] = (float) arr.get(i).asDouble();
        return v;
    }
}
