package org.clerasense.infrastructure.adapter.out.openfda;

import com.fasterxml.jackson.databind.JsonNode;
import org.clerasense.domain.model.drug.NormalizedDrugData;
import org.clerasense.domain.model.drug.Provenance;
import org.clerasense.domain.service.matching.DrugClassOverrides;
import org.clerasense.domain.service.pricing.CostEstimator;
import org.clerasense.domain.service.text.InteractionTextParser;
import org.clerasense.domain.service.text.LabelTextCleaner;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

final class OpenFdaLabelMapper {

    private static final String SEARCH_PAGE = "https://dailymed.nlm.nih.gov/dailymed/search.cfm?labeltype=all&query=";

    private OpenFdaLabelMapper() {}

    static NormalizedDrugData.Builder map(String genericName, JsonNode label) {
        JsonNode openfda = label.path("openfda");
        String title = LabelTextCleaner.titleCase(genericName.strip());

        List<String> brands = new ArrayList<>();
        openfda.path("brand_name").forEach(b -> brands.add(LabelTextCleaner.titleCase(b.asText().strip())));

        String drugClass = drugClass(openfda);

        String mechanism = clean(label, "mechanism_of_action");
        if (mechanism.isEmpty()) mechanism = clean(label, "clinical_pharmacology");

        String indications = clean(label, "indications_and_usage");

        String specificPopulations = clean(label, "use_in_specific_populations");
        String renal = "";
        String hepatic = "";
        if (!specificPopulations.isEmpty()) {
            String sp = specificPopulations.toLowerCase(Locale.ROOT);
            if (sp.contains("renal")) {
                renal = LabelTextCleaner.sentenceStartingWith(sp, "renal", 1).orElse("");
            }
            if (sp.contains("hepatic") || sp.contains("liver")) {
                hepatic = LabelTextCleaner.sentenceStartingWith(sp, "hepatic", 1).orElse("");
            }
        }

        String contraindications = safetyText(label);

        String pregnancy = LabelTextCleaner.clean(label.path("pregnancy"), 2000);
        if (pregnancy.isEmpty()) pregnancy = LabelTextCleaner.clean(label.path("teratogenic_effects"), 2000);
        String lactation = LabelTextCleaner.clean(label.path("nursing_mothers"), 2000);
        if (lactation.isEmpty() && specificPopulations.toLowerCase(Locale.ROOT).contains("lactat")) {
            lactation = LabelTextCleaner.sentenceStartingWith(specificPopulations, "lactat", 2).orElse("");
        }

        // several manufacturers means a generic is on the market
        boolean genericAvailable = openfda.path("manufacturer_name").size() > 1
                || OpenFdaSourceAdapter.texts(openfda.path("product_type")).stream()
                .anyMatch(pt -> pt.toLowerCase(Locale.ROOT).contains("generic"));
        String route = String.join(", ", OpenFdaSourceAdapter.texts(openfda.path("route"))).toLowerCase(Locale.ROOT);

        LocalDate effective = effectiveDate(label.path("effective_time").asText(""));
        Integer year = effective != null ? effective.getYear() : Year.now().getValue();
        Provenance provenance = new Provenance(
                OpenFdaSourceAdapter.AUTHORITY,
                "FDA Drug Label – " + title,
                SEARCH_PAGE + URLEncoder.encode(genericName, StandardCharsets.UTF_8),
                year,
                effective,
                Instant.now());

        return NormalizedDrugData.builder(title, provenance)
                .brandNames(brands)
                .drugClass(drugClass)
                .mechanismOfAction(mechanism)
                .indications(indications.isEmpty() ? List.of() : List.of(indications))
                .adultDosage(clean(label, "dosage_and_administration"))
                .pediatricDosage(clean(label, "pediatric_use"))
                .renalAdjustment(renal)
                .hepaticAdjustment(hepatic)
                .overdoseInfo(clean(label, "overdosage"))
                .administrationInfo(administration(label))
                .contraindications(contraindications)
                .blackBoxWarnings(clean(label, "boxed_warning"))
                .pregnancyRisk(pregnancy)
                .lactationRisk(lactation)
                .interactions(InteractionTextParser.parse(clean(label, "drug_interactions")))
                .approximateCost(CostEstimator.estimate(drugClass, route, genericAvailable))
                .genericAvailable(genericAvailable);
    }

    static String drugClass(JsonNode openfda) {
        List<String> raw = OpenFdaSourceAdapter.texts(openfda.path("pharm_class_epc"));
        if (raw.isEmpty()) raw = OpenFdaSourceAdapter.texts(openfda.path("pharm_class_moa"));
        List<String> single = raw.stream().filter(c -> !DrugClassOverrides.isCombinationClass(c)).toList();
        return String.join(", ", single.isEmpty() ? raw : single);
    }

    private static String safetyText(JsonNode label) {
        String contraindications = clean(label, "contraindications");
        String warnings = clean(label, "warnings_and_cautions");
        if (warnings.isEmpty()) warnings = clean(label, "warnings");
        if (!warnings.isEmpty()) {
            contraindications = contraindications.isEmpty()
                    ? warnings
                    : contraindications + "\n\nADDITIONAL WARNINGS: " + head(warnings, 1500);
        }
        String adverse = LabelTextCleaner.clean(label.path("adverse_reactions"), 2000);
        if (!adverse.isEmpty()) {
            contraindications = contraindications.isEmpty()
                    ? "ADVERSE REACTIONS: " + adverse
                    : contraindications + "\n\nADVERSE REACTIONS: " + head(adverse, 1000);
        }
        return contraindications;
    }

    private static String administration(JsonNode label) {
        List<String> parts = new ArrayList<>();
        String forms = LabelTextCleaner.clean(label.path("dosage_forms_and_strengths"), 1500);
        if (!forms.isEmpty()) parts.add(forms);
        String supplied = LabelTextCleaner.clean(label.path("how_supplied"), 1500);
        if (!supplied.isEmpty()) parts.add(supplied);
        String storage = LabelTextCleaner.clean(label.path("storage_and_handling"), 800);
        if (!storage.isEmpty()) parts.add("Storage & Handling: " + storage);
        return String.join("\n\n", parts);
    }

    // "20230115" -> 2023-01-15, "2023" -> 2023-01-01
    static LocalDate effectiveDate(String raw) {
        if (raw == null || raw.length() < 4) return null;
        try {
            int y = Integer.parseInt(raw.substring(0, 4));
            if (raw.length() >= 8) {
                return LocalDate.of(y, Integer.parseInt(raw.substring(4, 6)), Integer.parseInt(raw.substring(6, 8)));
            }
            return LocalDate.of(y, 1, 1);
        } catch (NumberFormatException | DateTimeException e) {
            return null;
        }
    }

    private static String clean(JsonNode label, String field) {
        return LabelTextCleaner.clean(label.path(field));
    }

    private static String head(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }
}
