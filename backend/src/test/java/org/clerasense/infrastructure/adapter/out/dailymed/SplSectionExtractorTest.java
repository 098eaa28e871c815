package org.clerasense.infrastructure.adapter.out.dailymed;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SplSectionExtractorTest {

    private final SplSectionExtractor extractor = new SplSectionExtractor();

    @Test
    void extracts_loinc_coded_sections() {
        Map<String, String> sections = extractor.fromZip(SplFixtures.zip("12345.xml", SplFixtures.LABEL_XML));

        assertEquals("Lisinopril is indicated for the treatment of hypertension.",
                sections.get(SplSectionExtractor.INDICATIONS));
        assertEquals("History of angioedema.", sections.get(SplSectionExtractor.CONTRAINDICATIONS));
        assertEquals("Fetal toxicity.", sections.get(SplSectionExtractor.BOXED_WARNING));
        assertEquals(3, sections.size());
    }

    @Test
    void archive_without_xml_gives_no_sections() {
        assertTrue(extractor.fromZip(SplFixtures.zip("image.jpg", "not xml")).isEmpty());
        assertTrue(extractor.fromZip("garbage".getBytes(StandardCharsets.UTF_8)).isEmpty());
    }

    @Test
    void doctype_declarations_are_refused() {
        String xxe = """
                <?xml version="1.0"?>
                <!DOCTYPE document [<!ENTITY xxe SYSTEM "file:///etc/passwd">]>
                <document xmlns="urn:hl7-org:v3"><component><section>
                  <code code="34067-9"/><text>&xxe;</text>
                </section></component></document>
                """;

        assertTrue(extractor.fromZip(SplFixtures.zip("evil.xml", xxe)).isEmpty());
    }
}
