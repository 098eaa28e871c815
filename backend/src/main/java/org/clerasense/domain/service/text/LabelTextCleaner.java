package org.clerasense.domain.service.text;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class LabelTextCleaner {

    public static final int DEFAULT_MAX_LENGTH = 3000;

    private static final Pattern TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    // "4 CONTRAINDICATIONS", "7.1 Drug Interactions", "12.1 Mechanism Of Action"
    private static final Pattern NUMBERED_HEADING = Pattern.compile(
            "\\b\\d{1,2}(?:\\.\\d{1,2})?\\s+[A-Z][A-Za-z\\s,&/\\-]{2,50}(?=\\s[a-z]|\\s[A-Z][a-z])");
    private static final Pattern CAPS_TITLE = Pattern.compile(
            "\\b[A-Z]{4,}(?:\\s+(?:AND|OR|IN|OF|FOR|THE|WITH)\\s+[A-Z]{3,})*\\b(?=\\s)");

    private LabelTextCleaner() {}

    public static String clean(String raw) {
        return clean(raw, DEFAULT_MAX_LENGTH);
    }

    public static String clean(String raw, int maxLength) {
        if (raw == null || raw.isBlank()) return "";
        String s = TAGS.matcher(raw).replaceAll(" ");
        s = collapse(s);
        s = NUMBERED_HEADING.matcher(s).replaceAll(" ");
        s = CAPS_TITLE.matcher(s).replaceAll(" ");
        s = collapse(s);
        if (s.length() > maxLength) s = s.substring(0, maxLength) + "...";
        return s;
    }

    public static String clean(JsonNode node, int maxLength) {
        return clean(join(node), maxLength);
    }

    public static String clean(JsonNode node) {
        return clean(node, DEFAULT_MAX_LENGTH);
    }

    static String join(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return "";
        if (!node.isArray()) return node.asText("");
        List<String> parts = new ArrayList<>();
        node.forEach(n -> parts.add(n.asText("")));
        return String.join(" ", parts);
    }

    public static String collapse(String s) {
        return s == null ? "" : WHITESPACE.matcher(s).replaceAll(" ").strip();
    }

    public static Optional<String> sentenceStartingWith(String text, String keyword, int followingSentences) {
        if (text == null || text.isEmpty()) return Optional.empty();
        String lower = text.toLowerCase(Locale.ROOT);
        String regex = "(" + Pattern.quote(keyword) + "[^.]*\\.(?:[^.]*\\.)?"
                + (followingSentences > 1 ? "(?:[^.]*\\.)?" : "") + ")";
        Matcher m = Pattern.compile(regex).matcher(lower);
        if (!m.find()) return Optional.empty();
        return Optional.of(capitalize(m.group(0).strip()));
    }

    public static String capitalize(String s) {
        if (s == null || s.isEmpty()) return "";
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1).toLowerCase(Locale.ROOT);
    }

    public static String titleCase(String s) {
        if (s == null) return "";
        StringBuilder out = new StringBuilder(s.length());
        boolean startOfWord = true;
        for (char c : s.toCharArray()) {
            if (Character.isLetter(c)) {
                out.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                out.append(c);
                startOfWord = true;
            }
        }
        return out.toString();
    }
}
