package org.clerasense.infrastructure.adapter.out.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.clerasense.domain.model.ingestion.RequestPacing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Rate-limited GET client shared by the provider adapters. Sleeps
 * {@code baseDelay * pacing.delayScale} before every call and turns 404s, non-2xx
 * responses and I/O failures into empty results.
 */
public class PacedHttpClient {

    private static final Logger log = LoggerFactory.getLogger(PacedHttpClient.class);

    private final String sourceName;
    private final long baseDelayMs;
    private final OkHttpClient http;
    private final ObjectMapper om;

    public PacedHttpClient(String sourceName, Duration baseDelay, Duration callTimeout) {
        this(sourceName, baseDelay, new OkHttpClient.Builder()
                .callTimeout(callTimeout)
                .retryOnConnectionFailure(true)
                .build(), new ObjectMapper());
    }

    public PacedHttpClient(String sourceName, Duration baseDelay, OkHttpClient http, ObjectMapper om) {
        this.sourceName = sourceName;
        this.baseDelayMs = baseDelay.toMillis();
        this.http = http;
        this.om = om;
    }

    public ObjectMapper mapper() {
        return om;
    }

    public Optional<JsonNode> getJson(HttpUrl url, RequestPacing pacing) {
        return getBytes(url, pacing).flatMap(bytes -> {
            try {
                return Optional.of(om.readTree(bytes));
            } catch (IOException e) {
                log.warn("{} returned a non-JSON body for {}: {}", sourceName, url.encodedPath(), e.getMessage());
                return Optional.empty();
            }
        });
    }

    public Optional<byte[]> getBytes(HttpUrl url, RequestPacing pacing) {
        if (!pause(pacing)) return Optional.empty();
        Request req = new Request.Builder().url(url).get()
                .header("Accept", "application/json")
                .build();
        log.debug("{} GET {}", sourceName, url);
        try (Response resp = http.newCall(req).execute()) {
            if (resp.code() == 404) {
                log.debug("{} returned 404 for {}", sourceName, url.encodedPath());
                return Optional.empty();
            }
            if (!resp.isSuccessful()) {
                log.warn("{} returned HTTP {} for {}", sourceName, resp.code(), url.encodedPath());
                return Optional.empty();
            }
            ResponseBody body = resp.body();
            return body == null ? Optional.empty() : Optional.of(body.bytes());
        } catch (IOException e) {
            log.warn("{} request failed for {}: {}", sourceName, url.encodedPath(), e.toString());
            return Optional.empty();
        }
    }

    private boolean pause(RequestPacing pacing) {
        long ms = pacing.scaledMillis(baseDelayMs);
        if (ms <= 0) return true;
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("{} call abandoned: interrupted while pacing", sourceName);
            return false;
        }
    }
}
