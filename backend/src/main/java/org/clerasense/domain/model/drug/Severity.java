package org.clerasense.domain.model.drug;

import java.util.Locale;

public enum Severity {
    CONTRAINDICATED("contraindicated", 4),
    MAJOR("major", 3),
    MODERATE("moderate", 2),
    MINOR("minor", 1);

    private final String label;
    private final int rank;

    Severity(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    public String label() { return label; }

    public int rank() { return rank; }

    public boolean outranks(Severity other) {
        return other == null || rank > other.rank;
    }

    // unknown or blank labels fall back to MODERATE
    public static Severity fromLabel(String label) {
        if (label == null || label.isBlank()) return MODERATE;
        String l = label.trim().toLowerCase(Locale.ROOT);
        for (Severity s : values()) {
            if (s.label.equals(l)) return s;
        }
        return MODERATE;
    }
}
