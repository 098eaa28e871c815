package org.clerasense.domain.service.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextSimilarityTest {

    @Test
    void identical_text_ignoring_case_and_padding_scores_one() {
        assertEquals(1.0, TextSimilarity.similarity("  Avoid in pregnancy. ", "avoid in PREGNANCY."));
    }

    @Test
    void empty_or_null_scores_zero() {
        assertEquals(0.0, TextSimilarity.similarity("", "text"));
        assertEquals(0.0, TextSimilarity.similarity("text", null));
    }

    @Test
    void related_renal_warnings_are_similar() {
        double sim = TextSimilarity.similarity("Avoid in renal failure.", "Contraindicated in renal impairment.");
        assertEquals(0.610, sim, 0.001);
    }

    @Test
    void unrelated_warnings_score_below_agreement_threshold() {
        double sim = TextSimilarity.similarity("None.", "Hypersensitivity to lithium.");
        assertEquals(0.182, sim, 0.001);
    }

    @Test
    void popular_characters_are_not_anchors_in_long_text() {
        String a = "take with food. ".repeat(15).strip();
        String b = "take without food. ".repeat(15).strip();

        double sim = TextSimilarity.similarity(a, b);

        assertTrue(sim < 0.35, "long repetitive text should not look alike: " + sim);
    }

    @Test
    void ratio_of_two_empty_strings_is_one() {
        assertEquals(1.0, TextSimilarity.ratio("", ""));
    }
}
