package org.clerasense.domain.service.text;

import org.clerasense.domain.model.drug.DrugInteraction;
import org.clerasense.domain.model.drug.Severity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class InteractionTextParser {

    public static final int MAX_INTERACTIONS = 20;
    public static final int MAX_DESCRIPTION = 500;

    // capitalised words that open label sentences but never name a drug
    private static final Set<String> NON_DRUG_WORDS = Arrays.stream(new String[]{
            "Table", "Tables", "See", "Drug", "Drugs", "Interaction", "Interactions",
            "Concomitant", "Use", "Intervention", "Interventions", "Effect",
            "Effects", "Clinical", "Impact", "Example", "Examples", "Risk",
            "Monitor", "Monitoring", "Recommendation", "Recommendations",
            "Mechanism", "Warnings", "Warning", "Precaution", "Precautions",
            "Description", "May", "Can", "Should", "When", "Avoid", "The",
            "These", "There", "This", "Other", "Some", "Specific", "Certain",
            "Following", "Administration", "Dosage", "Management", "Patients",
            "Potential", "Information", "Note", "Important", "Based", "Data",
            "Studies", "Study", "Results", "Increased", "Decreased", "However",
            "Although", "Because", "Therefore", "Particularly", "Combination",
            "Combinations", "Concurrent", "Coadministration", "Pharmacokinetic",
            "Pharmacodynamic", "Efficacy", "Safety", "With", "Section"
    }).map(w -> w.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());

    private static final Pattern SEGMENT_SPLIT = Pattern.compile(
            "(?:(?<=\\n)|(?<=\\. ))(?=(?:\\d{1,2}(?:\\.\\d+)?\\s+)?[A-Z][a-z])");
    private static final Pattern BULLET_SPLIT = Pattern.compile("[•\\-–]\\s+");
    private static final Pattern NAME_WITH_SEPARATOR = Pattern.compile(
            "^(?:\\d{1,2}(?:\\.\\d+)?\\s+)?([A-Z][a-zA-Z\\-]+(?:\\s+[A-Z][a-zA-Z\\-]+){0,3})\\s*[:\\-–(]");
    private static final Pattern NAME_WITH_VERB = Pattern.compile(
            "^(?:\\d{1,2}(?:\\.\\d+)?\\s+)?([A-Z][a-zA-Z\\-]+(?:\\s+[A-Z][a-zA-Z\\-]+){0,2})"
                    + "\\s+(?:may|can|should|is|are|has|increases?|decreases?|affects?|inhibits?|induces?"
                    + "|reduces?|enhances?|potentiates?)\\b");

    private InteractionTextParser() {}

    public static List<DrugInteraction> parse(String raw) {
        if (raw == null || raw.isBlank()) return List.of();

        String[] segments = SEGMENT_SPLIT.split(raw);
        if (segments.length <= 2) segments = BULLET_SPLIT.split(raw);

        List<DrugInteraction> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String s : segments) {
            String segment = s.strip();
            if (segment.length() < 15) continue;

            Matcher m = NAME_WITH_SEPARATOR.matcher(segment);
            if (!m.find()) {
                m = NAME_WITH_VERB.matcher(segment);
                if (!m.find()) continue;
            }
            String name = m.group(1).strip();
            boolean anyDrugWord = Arrays.stream(name.split("\\s+"))
                    .anyMatch(w -> !NON_DRUG_WORDS.contains(w.toLowerCase(Locale.ROOT)));
            if (!anyDrugWord || name.length() < 3) continue;
            if (!seen.add(name.toLowerCase(Locale.ROOT))) continue;

            String desc = stripSeparators(segment.substring(m.end()));
            if (desc.isEmpty()) desc = segment;
            if (desc.length() > MAX_DESCRIPTION) desc = desc.substring(0, MAX_DESCRIPTION);

            out.add(new DrugInteraction(name, severityOf(segment), desc));
            if (out.size() == MAX_INTERACTIONS) break;
        }
        return out;
    }

    // keyword heuristic, strongest match first
    public static Severity severityOf(String text) {
        String t = text == null ? "" : text.toLowerCase(Locale.ROOT);
        if (containsAny(t, "contraindicated", "fatal", "death", "do not use")) return Severity.CONTRAINDICATED;
        if (containsAny(t, "serious", "severe", "major", "significant", "avoid")) return Severity.MAJOR;
        if (containsAny(t, "moderate", "caution", "monitor closely")) return Severity.MODERATE;
        return Severity.MINOR;
    }

    private static boolean containsAny(String text, String... needles) {
        for (String n : needles) {
            if (text.contains(n)) return true;
        }
        return false;
    }

    private static String stripSeparators(String s) {
        int start = 0, end = s.length();
        while (start < end && isSeparator(s.charAt(start))) start++;
        while (end > start && isSeparator(s.charAt(end - 1))) end--;
        return s.substring(start, end);
    }

    private static boolean isSeparator(char c) {
        return c == ' ' || c == ':' || c == '-' || c == '–';
    }
}
