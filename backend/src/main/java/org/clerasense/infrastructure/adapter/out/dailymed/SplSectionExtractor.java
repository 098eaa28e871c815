package org.clerasense.infrastructure.adapter.out.dailymed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

public class SplSectionExtractor {

    private static final Logger log = LoggerFactory.getLogger(SplSectionExtractor.class);

    private static final String HL7_NS = "urn:hl7-org:v3";

    public static final String INDICATIONS = "indications_and_usage";
    public static final String DOSAGE = "dosage_and_administration";
    public static final String CONTRAINDICATIONS = "contraindications";
    public static final String WARNINGS_AND_PRECAUTIONS = "warnings_and_precautions";
    public static final String WARNINGS = "warnings";
    public static final String ADVERSE_REACTIONS = "adverse_reactions";
    public static final String DRUG_INTERACTIONS = "drug_interactions";
    public static final String PREGNANCY = "pregnancy";
    public static final String NURSING_MOTHERS = "nursing_mothers";
    public static final String PEDIATRIC_USE = "pediatric_use";
    public static final String OVERDOSAGE = "overdosage";
    public static final String CLINICAL_PHARMACOLOGY = "clinical_pharmacology";
    public static final String MECHANISM = "mechanism_of_action";
    public static final String BOXED_WARNING = "boxed_warning";
    public static final String HOW_SUPPLIED = "how_supplied";
    public static final String SPECIFIC_POPULATIONS = "use_in_specific_populations";

    static final Map<String, String> SECTION_CODES = Map.ofEntries(
            Map.entry("34067-9", INDICATIONS),
            Map.entry("34068-7", DOSAGE),
            Map.entry("34070-3", CONTRAINDICATIONS),
            Map.entry("43685-7", WARNINGS_AND_PRECAUTIONS),
            Map.entry("34071-1", WARNINGS),
            Map.entry("34084-4", ADVERSE_REACTIONS),
            Map.entry("34073-7", DRUG_INTERACTIONS),
            Map.entry("42228-7", PREGNANCY),
            Map.entry("34080-2", NURSING_MOTHERS),
            Map.entry("34081-0", PEDIATRIC_USE),
            Map.entry("34082-8", "geriatric_use"),
            Map.entry("34088-5", OVERDOSAGE),
            Map.entry("34090-1", CLINICAL_PHARMACOLOGY),
            Map.entry("43679-0", MECHANISM),
            Map.entry("34066-1", BOXED_WARNING),
            Map.entry("42229-5", "spl_medguide"),
            Map.entry("34069-5", HOW_SUPPLIED),
            Map.entry("43684-0", SPECIFIC_POPULATIONS)
    );

    private final DocumentBuilderFactory factory;

    public SplSectionExtractor() {
        this.factory = secureFactory();
    }

    public Map<String, String> fromZip(byte[] zip) {
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip))) {
            ZipEntry e;
            while ((e = in.getNextEntry()) != null) {
                if (!e.isDirectory() && e.getName().toLowerCase(Locale.ROOT).endsWith(".xml")) {
                    return fromXml(in);
                }
            }
            log.debug("SPL archive contains no XML document");
        } catch (IOException | SAXException | ParserConfigurationException e) {
            log.warn("SPL archive could not be parsed: {}", e.toString());
        }
        return Map.of();
    }

    Map<String, String> fromXml(InputStream xml) throws IOException, SAXException, ParserConfigurationException {
        DocumentBuilder builder;
        synchronized (factory) {
            builder = factory.newDocumentBuilder();
        }
        Document doc = builder.parse(xml);
        Map<String, String> sections = new LinkedHashMap<>();
        NodeList all = doc.getElementsByTagNameNS(HL7_NS, "section");
        for (int i = 0; i < all.getLength(); i++) {
            Element section = (Element) all.item(i);
            if (!isComponentChild(section)) continue;
            Element code = firstChild(section, "code");
            if (code == null) continue;
            String key = SECTION_CODES.get(code.getAttribute("code"));
            if (key == null) continue;
            Element text = firstChild(section, "text");
            if (text != null) sections.put(key, text.getTextContent().strip());
        }
        return sections;
    }

    private static boolean isComponentChild(Element section) {
        Node parent = section.getParentNode();
        return parent instanceof Element
                && "component".equals(parent.getLocalName())
                && HL7_NS.equals(parent.getNamespaceURI());
    }

    private static Element firstChild(Element parent, String localName) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element && localName.equals(n.getLocalName()) && HL7_NS.equals(n.getNamespaceURI())) {
                return (Element) n;
            }
        }
        return null;
    }

    private static DocumentBuilderFactory secureFactory() {
        DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
        f.setNamespaceAware(true);
        f.setValidating(false);
        f.setXIncludeAware(false);
        f.setExpandEntityReferences(false);
        try {
            f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            f.setFeature("http://xml.org/sax/features/external-general-entities", false);
            f.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            f.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Failed to configure secure XML parser", e);
        }
        return f;
    }
}
