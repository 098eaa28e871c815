package org.clerasense.domain.service.verification;

import org.clerasense.domain.model.drug.DrugInteraction;
import org.clerasense.domain.model.drug.NormalizedDrugData;
import org.clerasense.domain.model.drug.Provenance;
import org.clerasense.domain.model.drug.Severity;
import org.clerasense.domain.model.drug.UnitPrice;
import org.clerasense.domain.model.verification.VerificationResult;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VerificationEngineTest {

    private final VerificationEngine engine = new VerificationEngine();

    private static NormalizedDrugData.Builder from(String authority, String title) {
        return NormalizedDrugData.builder("X", Provenance.of(authority, title, "https://example.org/" + title, 2024));
    }

    @Test
    void similar_contraindications_merge_without_conflict_and_keep_longer_text() {
        var fda = from("FDA", "label").contraindications("Avoid in renal failure.").build();
        var nlm = from("NIH/NLM", "spl").contraindications("Contraindicated in renal impairment.").build();

        VerificationResult r = engine.verify("X", List.of(fda, nlm));

        assertTrue(r.verified());
        assertTrue(r.conflicts().isEmpty());
        assertEquals("Contraindicated in renal impairment.", r.mergedData().contraindications());
        // 2 sources (0.35) + contraindications (0.08) + safety bonus (0.08)
        assertEquals(0.51, r.confidence(), 1e-9);
        assertEquals(List.of("FDA", "NIH/NLM"), r.sourcesUsed());
    }

    @Test
    void dissimilar_safety_text_is_flagged_but_still_merged() {
        var fda = from("FDA", "label").contraindications("None.").build();
        var nlm = from("NIH/NLM", "spl").contraindications("Hypersensitivity to lithium.").build();

        VerificationResult r = engine.verify("X", List.of(fda, nlm));

        assertTrue(r.verified());
        assertEquals(1, r.conflicts().size());
        assertTrue(r.conflicts().get(0).startsWith("Contraindication descriptions differ significantly"));
        assertEquals("Hypersensitivity to lithium.", r.mergedData().contraindications());
        assertEquals(0.46, r.confidence(), 1e-9);
    }

    @Test
    void merge_does_not_depend_on_input_order() {
        var fda = from("FDA", "label")
                .brandNames(List.of("Zestril"))
                .mechanismOfAction("Inhibits ACE.")
                .interactions(List.of(new DrugInteraction("Potassium", Severity.MODERATE, "hyperkalemia")))
                .build();
        var nlm = from("NIH/NLM", "rxnorm")
                .brandNames(List.of("Prinivil", "zestril"))
                .drugClass("ACE Inhibitor")
                .build();
        var cms = from("CMS", "nadac")
                .approximateCost("$0.05 per tablet")
                .genericAvailable(true)
                .unitPrice(new UnitPrice(0.05, "EA", "123", LocalDate.of(2024, 1, 3), "LISINOPRIL 10 MG TABLET"))
                .build();

        List<NormalizedDrugData> inputs = new ArrayList<>(List.of(fda, nlm, cms));
        VerificationResult first = engine.verify("lisinopril", inputs);
        Collections.reverse(inputs);
        VerificationResult reversed = engine.verify("lisinopril", inputs);
        VerificationResult shuffled = engine.verify("lisinopril", List.of(nlm, cms, fda));

        assertEquals(first.mergedData(), reversed.mergedData());
        assertEquals(first.mergedData(), shuffled.mergedData());
        assertEquals(first.mergedData().brandNames(), shuffled.mergedData().brandNames());
        assertEquals(first.sourcesUsed(), shuffled.sourcesUsed());
        assertEquals(first.confidence(), shuffled.confidence());

        NormalizedDrugData merged = first.mergedData();
        assertEquals("Lisinopril", merged.genericName());
        assertEquals(List.of("Zestril", "Prinivil"), merged.brandNames());
        assertEquals("ACE Inhibitor", merged.drugClass());
        assertEquals("FDA", merged.sourceAuthority());
        assertEquals(Boolean.TRUE, merged.genericAvailable());
        assertEquals(0.05, merged.unitPrice().perUnit());
    }

    @Test
    void interactions_keep_most_severe_entry_per_drug() {
        var fda = from("FDA", "label").interactions(List.of(
                new DrugInteraction("Warfarin", Severity.MODERATE, "bleeding risk"))).build();
        var nlm = from("NIH/NLM", "spl").interactions(List.of(
                new DrugInteraction("warfarin", Severity.MAJOR, "serious bleeding"),
                new DrugInteraction("Aspirin", Severity.MINOR, "minor"))).build();

        List<DrugInteraction> merged = engine.verify("X", List.of(fda, nlm)).mergedData().interactions();

        assertEquals(2, merged.size());
        assertEquals(Severity.MAJOR, merged.get(0).severity());
        assertEquals("serious bleeding", merged.get(0).description());
        assertEquals("Aspirin", merged.get(1).interactingDrug());
    }

    @Test
    void single_authoritative_source_is_capped() {
        var fda = from("FDA", "label")
                .mechanismOfAction("m").indications(List.of("i")).contraindications("c").adultDosage("d")
                .build();

        VerificationResult r = engine.verify("X", List.of(fda));

        assertTrue(r.verified());
        assertEquals(0.60, r.confidence(), 1e-9);
        assertTrue(r.notes().contains("Single FDA source accepted as authoritative."));
    }

    @Test
    void single_pricing_source_gets_lower_cap() {
        var cms = from("CMS", "nadac")
                .approximateCost("$1.00 per tablet")
                .unitPrice(new UnitPrice(1.0, "EA", "1", null, "X"))
                .build();

        VerificationResult r = engine.verify("X", List.of(cms));

        assertTrue(r.confidence() <= 0.45);
        assertTrue(r.notes().get(1).startsWith("Single non-authoritative source (CMS)"));
    }

    @Test
    void single_source_is_unverified_when_not_accepted() {
        var strict = new VerificationEngine(false);
        var fda = from("FDA", "label").mechanismOfAction("m").build();

        VerificationResult r = strict.verify("X", List.of(fda));

        assertFalse(r.verified());
        assertTrue(r.hasMergedData());
    }

    @Test
    void no_data_gives_empty_result() {
        VerificationResult r = engine.verify("Zzzznotadrug", List.of());

        assertFalse(r.verified());
        assertFalse(r.hasMergedData());
        assertEquals(0.0, r.confidence());
        assertEquals("No data found for 'Zzzznotadrug' from any source.", r.notes().get(0));
    }

    @Test
    void curated_class_overrides_provider_class() {
        var nlm = from("NIH/NLM", "rxnorm").drugClass("Metformin and Sitagliptin Combination").build();
        var fda = from("FDA", "label").build();

        assertEquals("Biguanide Antihyperglycemic",
                engine.verify("metformin", List.of(fda, nlm)).mergedData().drugClass());
    }

    @Test
    void single_ingredient_class_preferred_over_combination() {
        var nlm = from("NIH/NLM", "rxnorm").drugClass("Beta Blocker and Thiazide Combination").build();
        var fda = from("FDA", "label").drugClass("Angiotensin II Receptor Blocker").build();

        assertEquals("Angiotensin II Receptor Blocker",
                engine.verify("losartan", List.of(nlm, fda)).mergedData().drugClass());
    }
}
