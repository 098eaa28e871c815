package org.clerasense.domain.service.text;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LabelTextCleanerTest {

    @Test
    void strips_markup_and_collapses_whitespace() {
        assertEquals("Take with food.", LabelTextCleaner.clean("<b>Take</b>   with\n food."));
    }

    @Test
    void removes_all_caps_section_titles() {
        assertEquals("Use caution in the elderly.",
                LabelTextCleaner.clean("WARNINGS AND PRECAUTIONS Use caution in the elderly."));
    }

    @Test
    void caps_length_with_ellipsis() {
        assertEquals("abcde...", LabelTextCleaner.clean("abcdef ghij", 5));
    }

    @Test
    void blank_input_cleans_to_empty() {
        assertEquals("", LabelTextCleaner.clean((String) null));
        assertEquals("", LabelTextCleaner.clean("   "));
    }

    @Test
    void joins_json_arrays_before_cleaning() throws Exception {
        var node = new ObjectMapper().readTree("[\"Take once daily.\", \"Swallow whole.\"]");
        assertEquals("Take once daily. Swallow whole.", LabelTextCleaner.clean(node));
        assertEquals("", LabelTextCleaner.clean(new ObjectMapper().readTree("{}").path("missing")));
    }

    @Test
    void finds_sentence_starting_with_keyword() {
        Optional<String> s = LabelTextCleaner.sentenceStartingWith(
                "Lisinopril inhibits ACE. It lowers blood pressure. Other text.", "inhibits", 1);
        assertEquals(Optional.of("Inhibits ace. it lowers blood pressure."), s);
        assertTrue(LabelTextCleaner.sentenceStartingWith("Nothing here.", "inhibits", 1).isEmpty());
    }

    @Test
    void title_cases_each_word() {
        assertEquals("Metformin Hydrochloride", LabelTextCleaner.titleCase("metformin HYDROCHLORIDE"));
        assertEquals("Co-Trimoxazole", LabelTextCleaner.titleCase("CO-TRIMOXAZOLE"));
        assertEquals("", LabelTextCleaner.titleCase(null));
    }
}
