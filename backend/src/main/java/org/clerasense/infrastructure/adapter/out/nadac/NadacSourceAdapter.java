package org.clerasense.infrastructure.adapter.out.nadac;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.HttpUrl;
import org.clerasense.application.port.DrugSourcePort;
import org.clerasense.application.port.ProviderCachePort;
import org.clerasense.application.port.ProviderCachePort.CachedValue;
import org.clerasense.domain.model.drug.DrugInteraction;
import org.clerasense.domain.model.drug.NormalizedDrugData;
import org.clerasense.domain.model.drug.Provenance;
import org.clerasense.domain.model.ingestion.RequestPacing;
import org.clerasense.domain.service.pricing.NadacPriceSummarizer;
import org.clerasense.domain.service.pricing.NadacPriceSummarizer.PriceRow;
import org.clerasense.domain.service.pricing.NadacPriceSummarizer.PriceSummary;
import org.clerasense.domain.service.text.LabelTextCleaner;
import org.clerasense.infrastructure.adapter.out.http.PacedHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Year;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public class NadacSourceAdapter implements DrugSourcePort {

    private static final Logger log = LoggerFactory.getLogger(NadacSourceAdapter.class);

    static final String AUTHORITY = "CMS";
    static final String DATASET_URL = "https://data.medicaid.gov/dataset/dfa2ab14-06c2-457a-9e36-5cb6d80f8d93";
    private static final int ROW_LIMIT = 50;

    private final PacedHttpClient http;
    private final ProviderCachePort cache;
    private final HttpUrl queryUrl;

    public NadacSourceAdapter(PacedHttpClient http, ProviderCachePort cache, String queryUrl) {
        this.http = http;
        this.cache = cache;
        this.queryUrl = HttpUrl.get(queryUrl);
    }

    @Override public String name() { return "CMS NADAC Pricing"; }

    @Override public String authority() { return AUTHORITY; }

    @Override
    public List<String> search(String query, int limit) {
        Set<String> names = new LinkedHashSet<>();
        for (PriceRow row : rows(query, RequestPacing.BATCH)) {
            String desc = row.ndcDescription() == null ? "" : row.ndcDescription().strip();
            if (desc.isEmpty()) continue;
            names.add(LabelTextCleaner.titleCase(desc.split("\\s+")[0]));
            if (names.size() >= limit) break;
        }
        return new ArrayList<>(names);
    }

    @Override
    public Optional<NormalizedDrugData> fetchDrugData(String genericName, RequestPacing pacing) {
        List<PriceRow> rows = rows(genericName, pacing);
        if (rows.isEmpty()) return Optional.empty();

        Optional<PriceSummary> summary = NadacPriceSummarizer.summarize(
                NadacPriceSummarizer.preferSingleIngredient(genericName, rows));
        if (summary.isEmpty()) {
            log.debug("NADAC rows for '{}' carry no usable price", genericName);
            return Optional.empty();
        }
        PriceSummary s = summary.get();
        String title = LabelTextCleaner.titleCase(genericName.strip());
        Integer year = s.primary().effectiveDate() != null
                ? s.primary().effectiveDate().getYear()
                : Year.now().getValue();
        Provenance provenance = Provenance.of(AUTHORITY, "NADAC Weekly Price – " + title, DATASET_URL, year);

        return Optional.of(NormalizedDrugData.builder(title, provenance)
                .approximateCost(s.displayText())
                .genericAvailable(s.generic())
                .unitPrice(s.primary())
                .build());
    }

    @Override
    public List<DrugInteraction> fetchInteractions(String genericName) {
        return List.of();
    }

    List<PriceRow> rows(String drugName, RequestPacing pacing) {
        String key = "nadac:" + drugName.strip().toUpperCase(Locale.ROOT);
        Optional<CachedValue> cached = cache.get(key);
        if (cached.isPresent() && cached.get().fresh()) {
            return parse(cached.get().value());
        }

        Optional<JsonNode> fetched = http.getJson(query(drugName), pacing);
        if (fetched.isPresent()) {
            JsonNode results = fetched.get().path("results");
            cache.put(key, results.toString());
            return toRows(results);
        }
        if (cached.isPresent()) {
            log.info("NADAC refresh failed for '{}', serving cached prices", drugName);
            return parse(cached.get().value());
        }
        return List.of();
    }

    private HttpUrl query(String drugName) {
        return queryUrl.newBuilder()
                .addQueryParameter("limit", String.valueOf(ROW_LIMIT))
                .addQueryParameter("offset", "0")
                .addQueryParameter("conditions[0][property]", "ndc_description")
                .addQueryParameter("conditions[0][value]", "%" + drugName.strip().toUpperCase(Locale.ROOT) + "%")
                .addQueryParameter("conditions[0][operator]", "LIKE")
                .addQueryParameter("sort", "effective_date")
                .addQueryParameter("sort_order", "desc")
                .build();
    }

    private List<PriceRow> parse(String json) {
        try {
            return toRows(http.mapper().readTree(json));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cached NADAC rows: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    static List<PriceRow> toRows(JsonNode results) {
        List<PriceRow> rows = new ArrayList<>();
        for (JsonNode r : results) {
            rows.add(new PriceRow(
                    r.path("ndc_description").asText(""),
                    r.path("pricing_unit").asText(""),
                    perUnit(r.path("nadac_per_unit")),
                    r.path("effective_date").asText(""),
                    r.path("classification_for_rate_setting").asText(""),
                    r.path("ndc").asText(""),
                    r.path("package_size").asText("")));
        }
        return rows;
    }

    // the datastore serves numbers as strings
    private static Double perUnit(JsonNode node) {
        if (node.isNumber()) return node.asDouble();
        String raw = node.asText("").strip();
        if (raw.isEmpty()) return null;
        try {
            return Double.valueOf(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
