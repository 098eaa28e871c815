package org.clerasense.infrastructure.adapter.out.openfda;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.HttpUrl;
import org.clerasense.application.port.DrugSourcePort;
import org.clerasense.domain.model.drug.AdverseEventSummary;
import org.clerasense.domain.model.drug.AdverseEventSummary.AdverseReaction;
import org.clerasense.domain.model.drug.DrugInteraction;
import org.clerasense.domain.model.drug.NormalizedDrugData;
import org.clerasense.domain.model.ingestion.RequestPacing;
import org.clerasense.domain.service.matching.ProductMatchScorer;
import org.clerasense.domain.service.text.InteractionTextParser;
import org.clerasense.domain.service.text.LabelTextCleaner;
import org.clerasense.infrastructure.adapter.out.http.PacedHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public class OpenFdaSourceAdapter implements DrugSourcePort {

    private static final Logger log = LoggerFactory.getLogger(OpenFdaSourceAdapter.class);

    static final String AUTHORITY = "FDA";
    private static final int LABEL_CANDIDATES = 10;
    private static final int TOP_REACTIONS = 15;
    private static final List<String> CLINICAL_SECTIONS = List.of(
            "contraindications", "warnings_and_cautions", "drug_interactions",
            "adverse_reactions", "boxed_warning", "pregnancy",
            "mechanism_of_action", "clinical_pharmacology");

    private final PacedHttpClient http;
    private final HttpUrl labelUrl;
    private final HttpUrl eventUrl;

    public OpenFdaSourceAdapter(PacedHttpClient http, String baseUrl) {
        this.http = http;
        HttpUrl base = HttpUrl.get(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
        this.labelUrl = base.newBuilder().addPathSegments("drug/label.json").build();
        this.eventUrl = base.newBuilder().addPathSegments("drug/event.json").build();
    }

    @Override public String name() { return "OpenFDA Drug Label API"; }

    @Override public String authority() { return AUTHORITY; }

    @Override
    public List<String> search(String query, int limit) {
        Optional<JsonNode> data = labels(query, Math.min(limit, 100), RequestPacing.BATCH);
        if (data.isEmpty()) return List.of();
        Set<String> names = new LinkedHashSet<>();
        for (JsonNode label : data.get().path("results")) {
            for (JsonNode gn : label.path("openfda").path("generic_name")) {
                names.add(LabelTextCleaner.titleCase(gn.asText().strip()));
            }
        }
        return names.stream().limit(limit).toList();
    }

    @Override
    public Optional<NormalizedDrugData> fetchDrugData(String genericName, RequestPacing pacing) {
        Optional<JsonNode> data = labels(genericName, LABEL_CANDIDATES, pacing);
        JsonNode results = data.map(d -> d.path("results")).orElse(null);
        if (results == null || !results.isArray() || results.isEmpty()) {
            log.debug("No FDA label for '{}'", genericName);
            return Optional.empty();
        }
        JsonNode label = pickBestLabel(results, genericName);
        NormalizedDrugData.Builder b = OpenFdaLabelMapper.map(genericName, label);
        b.adverseEvents(fetchAdverseEvents(genericName, pacing));
        return Optional.of(b.build());
    }

    @Override
    public List<DrugInteraction> fetchInteractions(String genericName) {
        JsonNode first = labels(genericName, 1, RequestPacing.BATCH)
                .map(d -> d.path("results").path(0))
                .orElse(null);
        if (first == null || first.isMissingNode()) return List.of();
        return InteractionTextParser.parse(LabelTextCleaner.clean(first.path("drug_interactions")));
    }

    private Optional<JsonNode> labels(String genericName, int limit, RequestPacing pacing) {
        HttpUrl url = labelUrl.newBuilder()
                .addQueryParameter("search", "openfda.generic_name:\"" + genericName + "\"")
                .addQueryParameter("limit", String.valueOf(limit))
                .build();
        return http.getJson(url, pacing);
    }

    static JsonNode pickBestLabel(JsonNode results, String genericName) {
        JsonNode best = results.get(0);
        int bestScore = Integer.MIN_VALUE;
        for (JsonNode label : results) {
            JsonNode openfda = label.path("openfda");
            int populated = 0;
            for (String section : CLINICAL_SECTIONS) {
                if (hasContent(label.path(section))) populated++;
            }
            int score = ProductMatchScorer.scoreLabel(
                    genericName,
                    texts(openfda.path("generic_name")),
                    populated,
                    hasContent(label.path("dosage_and_administration")),
                    texts(openfda.path("product_type")));
            if (score > bestScore) {
                bestScore = score;
                best = label;
            }
        }
        return best;
    }

    AdverseEventSummary fetchAdverseEvents(String genericName, RequestPacing pacing) {
        String search = "patient.drug.openfda.generic_name:\"" + genericName + "\"";

        Optional<JsonNode> totals = http.getJson(eventUrl.newBuilder()
                .addQueryParameter("search", search)
                .addQueryParameter("limit", "1")
                .build(), pacing);
        if (totals.isEmpty()) {
            log.debug("No FAERS totals for '{}'", genericName);
            return null;
        }
        long total = totals.get().path("meta").path("results").path("total").asLong(0);

        long serious = 0;
        Optional<JsonNode> seriousCounts = http.getJson(eventUrl.newBuilder()
                .addQueryParameter("search", search)
                .addQueryParameter("count", "serious")
                .build(), pacing);
        if (seriousCounts.isPresent()) {
            boolean found = false;
            for (JsonNode item : seriousCounts.get().path("results")) {
                if ("1".equals(item.path("term").asText())) {
                    serious = item.path("count").asLong(0);
                    found = true;
                    break;
                }
            }
            if (!found) serious = seriousCounts.get().path("meta").path("results").path("total").asLong(0);
        }

        List<AdverseReaction> reactions = new ArrayList<>();
        http.getJson(eventUrl.newBuilder()
                .addQueryParameter("search", search)
                .addQueryParameter("count", "patient.reaction.reactionmeddrapt.exact")
                .build(), pacing).ifPresent(r -> {
            for (JsonNode item : r.path("results")) {
                if (reactions.size() == TOP_REACTIONS) break;
                reactions.add(new AdverseReaction(item.path("term").asText(""), item.path("count").asLong(0)));
            }
        });
        return new AdverseEventSummary(total, serious, reactions);
    }

    static List<String> texts(JsonNode array) {
        List<String> out = new ArrayList<>();
        array.forEach(n -> out.add(n.asText("")));
        return out;
    }

    private static boolean hasContent(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return false;
        if (node.isArray()) return node.size() > 0;
        return !node.asText("").isBlank();
    }
}
