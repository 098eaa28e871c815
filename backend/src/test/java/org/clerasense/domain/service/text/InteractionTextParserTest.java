package org.clerasense.domain.service.text;

import org.clerasense.domain.model.drug.DrugInteraction;
import org.clerasense.domain.model.drug.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InteractionTextParserTest {

    @Test
    void extracts_named_interactions_with_severity() {
        String text = "Warfarin: Concomitant use may increase bleeding risk; monitor closely. "
                + "Ketoconazole may increase plasma levels significantly. "
                + "Table 3 lists other interactions here.";

        List<DrugInteraction> out = InteractionTextParser.parse(text);

        assertEquals(2, out.size());
        assertEquals("Warfarin", out.get(0).interactingDrug());
        assertEquals(Severity.MODERATE, out.get(0).severity());
        assertEquals("Concomitant use may increase bleeding risk; monitor closely.", out.get(0).description());
        assertEquals("Ketoconazole", out.get(1).interactingDrug());
        assertEquals(Severity.MAJOR, out.get(1).severity());
    }

    @Test
    void blank_text_has_no_interactions() {
        assertTrue(InteractionTextParser.parse(null).isEmpty());
        assertTrue(InteractionTextParser.parse("  ").isEmpty());
    }

    @Test
    void severity_keywords_strongest_first() {
        assertEquals(Severity.CONTRAINDICATED, InteractionTextParser.severityOf("Do not use; serious risk"));
        assertEquals(Severity.MAJOR, InteractionTextParser.severityOf("Avoid combination"));
        assertEquals(Severity.MODERATE, InteractionTextParser.severityOf("Use with caution"));
        assertEquals(Severity.MINOR, InteractionTextParser.severityOf("Slight change in absorption"));
    }
}
