package org.clerasense.infrastructure.adapter.out.dailymed;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.HttpUrl;
import org.clerasense.application.port.DrugSourcePort;
import org.clerasense.domain.model.drug.DrugInteraction;
import org.clerasense.domain.model.drug.NormalizedDrugData;
import org.clerasense.domain.model.drug.Provenance;
import org.clerasense.domain.model.ingestion.RequestPacing;
import org.clerasense.domain.service.matching.ProductMatchScorer;
import org.clerasense.domain.service.text.InteractionTextParser;
import org.clerasense.domain.service.text.LabelTextCleaner;
import org.clerasense.infrastructure.adapter.out.http.PacedHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Year;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.clerasense.infrastructure.adapter.out.dailymed.SplSectionExtractor.*;

public class DailyMedSourceAdapter implements DrugSourcePort {

    private static final Logger log = LoggerFactory.getLogger(DailyMedSourceAdapter.class);

    static final String AUTHORITY = "NIH/NLM";
    private static final int SPL_CANDIDATES = 25;

    private final PacedHttpClient http;
    private final SplSectionExtractor extractor;
    private final HttpUrl base;

    public DailyMedSourceAdapter(PacedHttpClient http, SplSectionExtractor extractor, String baseUrl) {
        this.http = http;
        this.extractor = extractor;
        this.base = HttpUrl.get(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
    }

    @Override public String name() { return "NIH DailyMed API"; }

    @Override public String authority() { return AUTHORITY; }

    @Override
    public List<String> search(String query, int limit) {
        Optional<JsonNode> data = spls(query, Math.min(limit, 100), RequestPacing.BATCH);
        if (data.isEmpty()) return List.of();
        Set<String> names = new LinkedHashSet<>();
        for (JsonNode item : data.get().path("data")) {
            String title = item.path("title").asText("");
            String name = LabelTextCleaner.titleCase(title.split("\\s*[-–]\\s*", 2)[0].strip());
            if (name.length() > 2) names.add(name);
        }
        return names.stream().limit(limit).toList();
    }

    @Override
    public Optional<NormalizedDrugData> fetchDrugData(String genericName, RequestPacing pacing) {
        Optional<String> setId = bestSetId(genericName, pacing);
        if (setId.isEmpty()) {
            log.debug("No DailyMed label matched '{}'", genericName);
            return Optional.empty();
        }
        String title = LabelTextCleaner.titleCase(genericName.strip());
        Provenance provenance = Provenance.of(AUTHORITY, "DailyMed SPL – " + title,
                drugInfoUrl(setId.get()), Year.now().getValue());

        Map<String, String> sections = sections(setId.get(), pacing);
        if (sections.isEmpty()) {
            // the label exists even if its content could not be read; that still corroborates the drug
            return Optional.of(NormalizedDrugData.builder(title, provenance).build());
        }
        return Optional.of(map(title, provenance, sections));
    }

    @Override
    public List<DrugInteraction> fetchInteractions(String genericName) {
        return bestSetId(genericName, RequestPacing.BATCH)
                .map(id -> sections(id, RequestPacing.BATCH))
                .map(s -> InteractionTextParser.parse(clean(s, DRUG_INTERACTIONS)))
                .orElse(List.of());
    }

    static NormalizedDrugData map(String title, Provenance provenance, Map<String, String> sections) {
        String indications = clean(sections, INDICATIONS);
        String contraindications = clean(sections, CONTRAINDICATIONS);
        String warnings = clean(sections, WARNINGS_AND_PRECAUTIONS);
        if (warnings.isEmpty()) warnings = clean(sections, WARNINGS);
        String pregnancy = clean(sections, PREGNANCY);
        if (pregnancy.isEmpty()) pregnancy = clean(sections, SPECIFIC_POPULATIONS);
        String mechanism = clean(sections, MECHANISM);
        if (mechanism.isEmpty()) mechanism = clean(sections, CLINICAL_PHARMACOLOGY);
        String adverse = clean(sections, ADVERSE_REACTIONS);

        if (!warnings.isEmpty()) {
            contraindications = contraindications.isEmpty()
                    ? warnings
                    : contraindications + "\n\nWARNINGS: " + head(warnings, 1500);
        }
        if (!adverse.isEmpty()) {
            contraindications = contraindications.isEmpty()
                    ? "ADVERSE REACTIONS: " + adverse
                    : contraindications + "\n\nADVERSE REACTIONS: " + head(adverse, 1000);
        }

        return NormalizedDrugData.builder(title, provenance)
                .mechanismOfAction(mechanism)
                .indications(indications.isEmpty() ? List.of() : List.of(indications))
                .adultDosage(clean(sections, DOSAGE))
                .pediatricDosage(clean(sections, PEDIATRIC_USE))
                .overdoseInfo(clean(sections, OVERDOSAGE))
                .administrationInfo(clean(sections, HOW_SUPPLIED))
                .contraindications(contraindications)
                .blackBoxWarnings(clean(sections, BOXED_WARNING))
                .pregnancyRisk(truncate(pregnancy, 2000))
                .lactationRisk(truncate(clean(sections, NURSING_MOTHERS), 2000))
                .interactions(InteractionTextParser.parse(clean(sections, DRUG_INTERACTIONS)))
                .build();
    }

    Optional<String> bestSetId(String genericName, RequestPacing pacing) {
        Optional<JsonNode> data = spls(genericName, SPL_CANDIDATES, pacing);
        if (data.isEmpty()) return Optional.empty();
        String best = null;
        int bestScore = Integer.MIN_VALUE;
        for (JsonNode item : data.get().path("data")) {
            String setId = item.path("setid").asText("");
            if (setId.isEmpty()) continue;
            int score = ProductMatchScorer.scoreSplTitle(genericName, item.path("title").asText(""));
            if (score > bestScore) {
                bestScore = score;
                best = setId;
            }
        }
        return bestScore > ProductMatchScorer.MIN_SPL_SCORE ? Optional.ofNullable(best) : Optional.empty();
    }

    private Optional<JsonNode> spls(String drugName, int pageSize, RequestPacing pacing) {
        HttpUrl url = base.newBuilder()
                .addPathSegments("services/v2/spls.json")
                .addQueryParameter("drug_name", drugName)
                .addQueryParameter("page", "1")
                .addQueryParameter("pagesize", String.valueOf(pageSize))
                .build();
        return http.getJson(url, pacing);
    }

    private Map<String, String> sections(String setId, RequestPacing pacing) {
        HttpUrl url = base.newBuilder()
                .addPathSegment("getFile.cfm")
                .addQueryParameter("setid", setId)
                .addQueryParameter("type", "zip")
                .addQueryParameter("name", setId)
                .build();
        return http.getBytes(url, pacing).map(extractor::fromZip).orElse(Map.of());
    }

    private String drugInfoUrl(String setId) {
        return base.newBuilder()
                .addPathSegment("drugInfo.cfm")
                .addQueryParameter("setid", setId)
                .build()
                .toString();
    }

    private static String clean(Map<String, String> sections, String key) {
        return LabelTextCleaner.clean(sections.getOrDefault(key, ""));
    }

    private static String head(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) + "..." : s;
    }
}
