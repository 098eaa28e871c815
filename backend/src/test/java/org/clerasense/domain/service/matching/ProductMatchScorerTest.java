package org.clerasense.domain.service.matching;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProductMatchScorerTest {

    @Test
    void salt_form_title_scores_close_to_exact() {
        assertEquals(290, ProductMatchScorer.scoreSplTitle("atorvastatin",
                "ATORVASTATIN CALCIUM TABLET, FILM COATED [ACME]"));
    }

    @Test
    void combination_product_ranks_below_single_ingredient() {
        int single = ProductMatchScorer.scoreSplTitle("atorvastatin", "ATORVASTATIN CALCIUM TABLET [ACME]");
        int combo = ProductMatchScorer.scoreSplTitle("atorvastatin", "AMLODIPINE AND ATORVASTATIN TABLET [ACME]");

        assertTrue(single > combo);
        assertTrue(combo < 0);
    }

    @Test
    void non_drug_products_fall_below_minimum() {
        int score = ProductMatchScorer.scoreSplTitle("alcohol", "ALCOHOL HAND SANITIZER GEL [ACME]");
        assertTrue(score < ProductMatchScorer.MIN_SPL_SCORE);
    }

    @Test
    void prescription_label_with_exact_name_wins() {
        int rx = ProductMatchScorer.scoreLabel("lisinopril", List.of("LISINOPRIL"), 4, true,
                List.of("HUMAN PRESCRIPTION DRUG"));
        int combo = ProductMatchScorer.scoreLabel("lisinopril", List.of("LISINOPRIL AND HYDROCHLOROTHIAZIDE"), 4, true,
                List.of("HUMAN PRESCRIPTION DRUG"));

        assertEquals(355, rx);
        assertTrue(rx > combo);
    }

    @Test
    void class_overrides_and_combination_detection() {
        assertEquals("Proton Pump Inhibitor", DrugClassOverrides.lookup(" Omeprazole ").orElseThrow());
        assertTrue(DrugClassOverrides.lookup("lisinopril").isEmpty());
        assertTrue(DrugClassOverrides.isCombinationClass("Thiazide and ACE Inhibitor Combination"));
        assertFalse(DrugClassOverrides.isCombinationClass("ACE Inhibitor"));
    }
}
