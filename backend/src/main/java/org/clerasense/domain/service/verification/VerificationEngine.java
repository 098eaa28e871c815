package org.clerasense.domain.service.verification;

import org.clerasense.domain.model.drug.AdverseEventSummary;
import org.clerasense.domain.model.drug.DrugInteraction;
import org.clerasense.domain.model.drug.NormalizedDrugData;
import org.clerasense.domain.model.drug.Provenance;
import org.clerasense.domain.model.verification.VerificationResult;
import org.clerasense.domain.service.matching.DrugClassOverrides;
import org.clerasense.domain.service.text.LabelTextCleaner;
import org.clerasense.domain.service.text.TextSimilarity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Cross-checks per-provider records for one drug and merges them into a single
 * record with a confidence score.
 * <p>
 * Safety text is merged "most detailed wins", lists are unioned and interactions
 * keep the most severe entry per interacting drug. Inputs are put into a fixed
 * order first, so the result does not depend on which provider answered first.
 */
public class VerificationEngine {

    public static final double AGREEMENT_THRESHOLD = 0.35;
    public static final int MIN_SOURCES_REQUIRED = 2;

    static final double SINGLE_AUTHORITATIVE_CAP = 0.60;
    static final double SINGLE_NON_AUTHORITATIVE_CAP = 0.45;

    private static final List<String> AUTHORITATIVE = List.of("FDA", "NIH/NLM");
    private static final List<String> AUTHORITY_ORDER = List.of("FDA", "NIH/NLM", "CMS");
    private static final List<String> CLASS_AUTHORITY_PREFERENCE = List.of("NIH/NLM", "FDA");

    private static final Comparator<NormalizedDrugData> MERGE_ORDER = Comparator
            .comparingInt((NormalizedDrugData d) -> authorityRank(d.sourceAuthority()))
            .thenComparing(NormalizedDrugData::sourceAuthority)
            .thenComparing(d -> d.provenance().sourceDocumentTitle())
            .thenComparing(d -> d.provenance().sourceUrl())
            .thenComparing(NormalizedDrugData::toString);

    private final boolean acceptSingleSource;

    public VerificationEngine(boolean acceptSingleSource) {
        this.acceptSingleSource = acceptSingleSource;
    }

    public VerificationEngine() {
        this(true);
    }

    public VerificationResult verify(String drugName, List<NormalizedDrugData> sourceData) {
        Objects.requireNonNull(drugName, "drugName");
        List<NormalizedDrugData> data = sourceData == null ? List.of() : sourceData.stream()
                .filter(Objects::nonNull)
                .sorted(MERGE_ORDER)
                .toList();

        if (data.isEmpty()) {
            return VerificationResult.empty(String.format("No data found for '%s' from any source.", drugName));
        }

        List<String> notes = new ArrayList<>();
        List<String> sourcesUsed = data.stream().map(NormalizedDrugData::sourceAuthority).toList();
        boolean singleSource = data.size() < MIN_SOURCES_REQUIRED;
        boolean singleAuthoritative = singleSource && AUTHORITATIVE.contains(data.get(0).sourceAuthority());

        if (singleSource) {
            notes.add(String.format(
                    "Only %d source(s) returned data for '%s'. Minimum %d required for full verification.",
                    data.size(), drugName, MIN_SOURCES_REQUIRED));
            String authority = data.get(0).sourceAuthority();
            if (singleAuthoritative) {
                notes.add(String.format("Single %s source accepted as authoritative.", authority));
            } else {
                notes.add(String.format(
                        "Single non-authoritative source (%s); accepting with low confidence.", authority));
            }
        }

        List<String> conflicts = new ArrayList<>();
        checkAgreement(data, NormalizedDrugData::contraindications).ifPresent(sim -> conflicts.add(String.format(
                Locale.ROOT,
                "Contraindication descriptions differ significantly (similarity=%.2f). "
                        + "Using the most detailed version but flagging for review.", sim)));
        checkAgreement(data, NormalizedDrugData::blackBoxWarnings).ifPresent(sim -> conflicts.add(String.format(
                Locale.ROOT,
                "Black box warning descriptions differ (similarity=%.2f). "
                        + "Using the most detailed version but flagging for review.", sim)));
        checkAgreement(data, NormalizedDrugData::pregnancyRisk).ifPresent(sim -> conflicts.add(String.format(
                Locale.ROOT, "Pregnancy risk information differs (similarity=%.2f).", sim)));

        NormalizedDrugData merged = merge(drugName, data);
        double confidence = confidence(data.size(), merged, conflicts.size());
        if (singleSource) {
            confidence = Math.min(confidence,
                    singleAuthoritative ? SINGLE_AUTHORITATIVE_CAP : SINGLE_NON_AUTHORITATIVE_CAP);
        }
        confidence = Math.round(confidence * 1000.0) / 1000.0;

        boolean verified = !singleSource || acceptSingleSource;
        if (!verified) {
            notes.add("Single-source results are not accepted; record left unverified.");
        } else if (!conflicts.isEmpty()) {
            notes.add(String.format(
                    "Verified with %d conflict(s): data merged using safety-first approach.", conflicts.size()));
        } else {
            notes.add(String.format("Verified across %d source(s) with no conflicts.", data.size()));
        }

        return new VerificationResult(verified, confidence, merged, sourcesUsed, conflicts, notes,
                data.stream().map(NormalizedDrugData::provenance).toList());
    }

    /** Similarity of the first two populated values, present only when below the agreement threshold. */
    private static Optional<Double> checkAgreement(List<NormalizedDrugData> data,
                                                    Function<NormalizedDrugData, String> field) {
        List<String> values = data.stream().map(field).filter(VerificationEngine::hasText).limit(2).toList();
        if (values.size() < 2) return Optional.empty();
        double sim = TextSimilarity.similarity(values.get(0), values.get(1));
        return sim < AGREEMENT_THRESHOLD ? Optional.of(sim) : Optional.empty();
    }

    NormalizedDrugData merge(String drugName, List<NormalizedDrugData> data) {
        // FDA sorts first, so the head of the list carries the preferred provenance
        Provenance provenance = data.get(0).provenance();

        NormalizedDrugData.Builder b = NormalizedDrugData.builder(LabelTextCleaner.titleCase(drugName.strip()), provenance)
                .brandNames(union(data.stream().map(NormalizedDrugData::brandNames).toList()))
                .drugClass(mergeDrugClass(drugName, data))
                .mechanismOfAction(longest(data, NormalizedDrugData::mechanismOfAction))
                .indications(union(data.stream().map(NormalizedDrugData::indications).toList()))
                .adultDosage(longest(data, NormalizedDrugData::adultDosage))
                .pediatricDosage(longest(data, NormalizedDrugData::pediatricDosage))
                .renalAdjustment(longest(data, NormalizedDrugData::renalAdjustment))
                .hepaticAdjustment(longest(data, NormalizedDrugData::hepaticAdjustment))
                .overdoseInfo(longest(data, NormalizedDrugData::overdoseInfo))
                .underdoseInfo(longest(data, NormalizedDrugData::underdoseInfo))
                .administrationInfo(longest(data, NormalizedDrugData::administrationInfo))
                .contraindications(longest(data, NormalizedDrugData::contraindications))
                .blackBoxWarnings(longest(data, NormalizedDrugData::blackBoxWarnings))
                .pregnancyRisk(longest(data, NormalizedDrugData::pregnancyRisk))
                .lactationRisk(longest(data, NormalizedDrugData::lactationRisk))
                .interactions(mergeInteractions(data))
                .genericAvailable(mergeGenericAvailable(data))
                .adverseEvents(firstAdverseEvents(data));

        NormalizedDrugData priced = data.stream().filter(NormalizedDrugData::hasUnitPrice).findFirst().orElse(null);
        if (priced != null) {
            b.approximateCost(priced.approximateCost()).unitPrice(priced.unitPrice());
        }
        if (priced == null || !hasText(priced.approximateCost())) {
            data.stream().map(NormalizedDrugData::approximateCost).filter(VerificationEngine::hasText)
                    .findFirst().ifPresent(b::approximateCost);
        }
        return b.build();
    }

    static String mergeDrugClass(String drugName, List<NormalizedDrugData> data) {
        var override = DrugClassOverrides.lookup(drugName);
        if (override.isPresent()) return override.get();

        List<NormalizedDrugData> withClass = data.stream().filter(d -> hasText(d.drugClass())).toList();
        List<NormalizedDrugData> single = withClass.stream()
                .filter(d -> !DrugClassOverrides.isCombinationClass(d.drugClass()))
                .toList();
        if (!single.isEmpty()) {
            for (String authority : CLASS_AUTHORITY_PREFERENCE) {
                for (NormalizedDrugData d : single) {
                    if (authority.equals(d.sourceAuthority())) return d.drugClass();
                }
            }
            return single.get(0).drugClass();
        }
        return longest(withClass, NormalizedDrugData::drugClass);
    }

    static List<DrugInteraction> mergeInteractions(List<NormalizedDrugData> data) {
        Map<String, DrugInteraction> merged = new LinkedHashMap<>();
        for (NormalizedDrugData d : data) {
            for (DrugInteraction ix : d.interactions()) {
                String key = ix.interactingDrug().strip().toLowerCase(Locale.ROOT);
                if (key.isEmpty()) continue;
                DrugInteraction existing = merged.get(key);
                if (existing == null
                        || ix.severity().outranks(existing.severity())
                        || (ix.severity() == existing.severity()
                        && ix.description().length() > existing.description().length())) {
                    merged.put(key, ix);
                }
            }
        }
        return new ArrayList<>(merged.values());
    }

    private static Boolean mergeGenericAvailable(List<NormalizedDrugData> data) {
        if (data.stream().anyMatch(d -> Boolean.TRUE.equals(d.genericAvailable()))) return Boolean.TRUE;
        return data.stream().map(NormalizedDrugData::genericAvailable).filter(Objects::nonNull)
                .findFirst().orElse(null);
    }

    private static AdverseEventSummary firstAdverseEvents(List<NormalizedDrugData> data) {
        return data.stream().map(NormalizedDrugData::adverseEvents).filter(Objects::nonNull)
                .findFirst().orElse(null);
    }

    static double confidence(int sources, NormalizedDrugData merged, int conflicts) {
        double c = Math.min(sources / 4.0, 0.35);
        if (hasText(merged.mechanismOfAction())) c += 0.08;
        if (!merged.indications().isEmpty()) c += 0.08;
        if (hasText(merged.contraindications())) c += 0.08;
        if (hasText(merged.adultDosage())) c += 0.08;
        if (hasText(merged.blackBoxWarnings()) || hasText(merged.contraindications())) c += 0.08;
        if (merged.hasUnitPrice()) c += 0.08;
        if (merged.adverseEvents() != null) c += 0.07;
        c -= conflicts * 0.05;
        return Math.max(0.0, Math.min(1.0, c));
    }

    /** Longest non-blank value; the earliest wins a tie. */
    static String longest(List<NormalizedDrugData> data, Function<NormalizedDrugData, String> field) {
        String best = "";
        for (NormalizedDrugData d : data) {
            String v = field.apply(d);
            if (hasText(v) && v.length() > best.length()) best = v;
        }
        return best;
    }

    static List<String> union(List<List<String>> lists) {
        Set<String> seen = new HashSet<>();
        List<String> out = new ArrayList<>();
        for (List<String> l : lists) {
            for (String item : l) {
                if (item == null) continue;
                if (seen.add(item.strip().toLowerCase(Locale.ROOT))) out.add(item);
            }
        }
        return out;
    }

    private static int authorityRank(String authority) {
        int i = AUTHORITY_ORDER.indexOf(authority);
        return i < 0 ? AUTHORITY_ORDER.size() : i;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
