package org.clerasense.infrastructure.adapter.out.dailymed;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

final class SplFixtures {

    static final String LABEL_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <document xmlns="urn:hl7-org:v3">
              <component><structuredBody>
                <component><section>
                  <code code="34067-9" codeSystem="2.16.840.1.113883.6.1"/>
                  <title>INDICATIONS AND USAGE</title>
                  <text><paragraph>Lisinopril is indicated for the treatment of hypertension.</paragraph></text>
                </section></component>
                <component><section>
                  <code code="34070-3" codeSystem="2.16.840.1.113883.6.1"/>
                  <text><paragraph>History of angioedema.</paragraph></text>
                </section></component>
                <component><section>
                  <code code="34066-1" codeSystem="2.16.840.1.113883.6.1"/>
                  <text><paragraph>Fetal toxicity.</paragraph></text>
                </section></component>
                <component><section>
                  <code code="99999-9" codeSystem="2.16.840.1.113883.6.1"/>
                  <text><paragraph>Unmapped section.</paragraph></text>
                </section></component>
              </structuredBody></component>
            </document>
            """;

    private SplFixtures() {}

    static byte[] zip(String entryName, String content) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            zip.putNextEntry(new ZipEntry(entryName));
            zip.write(content.getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }
}
