package org.clerasense.infrastructure.adapter.out.rxnorm;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.HttpUrl;
import org.clerasense.application.port.DrugSourcePort;
import org.clerasense.domain.model.drug.DrugInteraction;
import org.clerasense.domain.model.drug.NormalizedDrugData;
import org.clerasense.domain.model.drug.Provenance;
import org.clerasense.domain.model.ingestion.RequestPacing;
import org.clerasense.domain.service.matching.DrugClassOverrides;
import org.clerasense.domain.service.text.LabelTextCleaner;
import org.clerasense.infrastructure.adapter.out.http.PacedHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Year;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public class RxNormSourceAdapter implements DrugSourcePort {

    private static final Logger log = LoggerFactory.getLogger(RxNormSourceAdapter.class);

    static final String AUTHORITY = "NIH/NLM";
    private static final int MAX_BRANDS = 10;
    private static final Set<String> GENERIC_TERM_TYPES = Set.of("SCD", "GPCK");

    private final PacedHttpClient http;
    private final HttpUrl base;

    public RxNormSourceAdapter(PacedHttpClient http, String baseUrl) {
        this.http = http;
        this.base = HttpUrl.get(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
    }

    @Override public String name() { return "NIH RxNorm / RxNav API"; }

    @Override public String authority() { return AUTHORITY; }

    @Override
    public List<String> search(String query, int limit) {
        Optional<JsonNode> data = http.getJson(base.newBuilder()
                .addPathSegment("approximateTerm.json")
                .addQueryParameter("term", query)
                .addQueryParameter("maxEntries", String.valueOf(Math.min(limit, 20)))
                .build(), RequestPacing.BATCH);
        if (data.isEmpty()) return List.of();
        Set<String> names = new LinkedHashSet<>();
        Set<String> seenIds = new HashSet<>();
        for (JsonNode c : data.get().path("approximateGroup").path("candidate")) {
            String rxcui = c.path("rxcui").asText("");
            if (rxcui.isEmpty() || !seenIds.add(rxcui)) continue;
            properties(rxcui, RequestPacing.BATCH)
                    .map(p -> LabelTextCleaner.titleCase(p.path("name").asText("").strip()))
                    .filter(n -> n.length() > 2)
                    .ifPresent(names::add);
            if (names.size() >= limit) break;
        }
        return new ArrayList<>(names);
    }

    @Override
    public Optional<NormalizedDrugData> fetchDrugData(String genericName, RequestPacing pacing) {
        Optional<String> rxcui = conceptId(genericName, pacing);
        if (rxcui.isEmpty()) {
            log.debug("No RxNorm concept for '{}'", genericName);
            return Optional.empty();
        }
        String id = rxcui.get();
        Optional<JsonNode> props = properties(id, pacing);
        if (props.isEmpty()) return Optional.empty();

        String normalized = LabelTextCleaner.titleCase(props.get().path("name").asText(genericName).strip());
        Provenance provenance = Provenance.of(
                AUTHORITY,
                "RxNorm Drug Concept – " + normalized + " (RXCUI: " + id + ")",
                "https://mor.nlm.nih.gov/RxNav/search?searchBy=RXCUI&searchTerm=" + id,
                Year.now().getValue());

        return Optional.of(NormalizedDrugData.builder(normalized, provenance)
                .brandNames(brandNames(id, pacing))
                .drugClass(drugClass(id, pacing))
                // absence of a generic concept is not proof that none exists
                .genericAvailable(hasGenericConcept(id, pacing) ? Boolean.TRUE : null)
                .build());
    }

    @Override
    public List<DrugInteraction> fetchInteractions(String genericName) {
        return List.of();
    }

    private Optional<String> conceptId(String name, RequestPacing pacing) {
        return http.getJson(base.newBuilder()
                        .addPathSegment("rxcui.json")
                        .addQueryParameter("name", name)
                        .addQueryParameter("search", "2")
                        .build(), pacing)
                .map(d -> d.path("idGroup").path("rxnormId").path(0).asText(""))
                .filter(s -> !s.isEmpty());
    }

    private Optional<JsonNode> properties(String rxcui, RequestPacing pacing) {
        return http.getJson(base.newBuilder()
                        .addPathSegment("rxcui").addPathSegment(rxcui).addPathSegment("properties.json")
                        .build(), pacing)
                .map(d -> d.path("properties"))
                .filter(p -> !p.isMissingNode());
    }

    private List<String> brandNames(String rxcui, RequestPacing pacing) {
        List<String> brands = new ArrayList<>();
        http.getJson(base.newBuilder()
                .addPathSegment("rxcui").addPathSegment(rxcui).addPathSegment("related.json")
                .addQueryParameter("tty", "BN")
                .build(), pacing).ifPresent(d -> {
            for (JsonNode group : d.path("relatedGroup").path("conceptGroup")) {
                for (JsonNode p : group.path("conceptProperties")) {
                    String bn = LabelTextCleaner.titleCase(p.path("name").asText("").strip());
                    if (!bn.isEmpty()) brands.add(bn);
                }
            }
        });
        return brands.size() > MAX_BRANDS ? brands.subList(0, MAX_BRANDS) : brands;
    }

    private boolean hasGenericConcept(String rxcui, RequestPacing pacing) {
        return http.getJson(base.newBuilder()
                        .addPathSegment("rxcui").addPathSegment(rxcui).addPathSegment("allrelated.json")
                        .build(), pacing)
                .map(d -> {
                    for (JsonNode g : d.path("allRelatedGroup").path("conceptGroup")) {
                        if (GENERIC_TERM_TYPES.contains(g.path("tty").asText(""))
                                && g.path("conceptProperties").size() > 0) {
                            return true;
                        }
                    }
                    return false;
                })
                .orElse(false);
    }

    private String drugClass(String rxcui, RequestPacing pacing) {
        List<String> atc = classNames(rxcui, "ATC", pacing);
        String cls = atc.stream().filter(c -> !DrugClassOverrides.isCombinationClass(c)).findFirst()
                .orElse(atc.isEmpty() ? "" : atc.get(0));
        if (cls.isEmpty() || DrugClassOverrides.isCombinationClass(cls)) {
            cls = classNames(rxcui, "MESH", pacing).stream()
                    .filter(c -> !DrugClassOverrides.isCombinationClass(c))
                    .findFirst()
                    .orElse(cls);
        }
        return cls;
    }

    private List<String> classNames(String rxcui, String relaSource, RequestPacing pacing) {
        List<String> names = new ArrayList<>();
        http.getJson(base.newBuilder()
                .addPathSegments("rxclass/class/byRxcui.json")
                .addQueryParameter("rxcui", rxcui)
                .addQueryParameter("relaSource", relaSource)
                .build(), pacing).ifPresent(d -> {
            for (JsonNode info : d.path("rxclassDrugInfoList").path("rxclassDrugInfo")) {
                String n = info.path("rxclassMinConceptItem").path("className").asText("");
                if (!n.isEmpty()) names.add(n);
            }
        });
        return names;
    }
}
