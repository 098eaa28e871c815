package org.clerasense.domain.service.matching;

import java.util.List;
import java.util.Locale;

/**
 * Scores provider search hits against a requested generic name. Higher is better;
 * single-ingredient products beat combinations and salt forms count as the base drug.
 */
public final class ProductMatchScorer {

    /** Best DailyMed hit must score above this to be used at all. */
    public static final int MIN_SPL_SCORE = -200;

    public static final List<String> SALT_SUFFIXES = List.of(
            "hydrochloride", "hcl", "sulfate", "sodium", "potassium",
            "maleate", "besylate", "mesylate", "fumarate", "tartrate",
            "succinate", "calcium", "acetate", "phosphate", "citrate",
            "dihydrate", "anhydrous", "trihydrate");

    private static final List<String> DOSAGE_FORMS = List.of(
            "tablet", "capsule", "solution", "injection", "cream",
            "ointment", "powder", "suspension", "aerosol", "spray",
            "patch", "gel", "drops", "inhaler", "suppository", "lozenge",
            "syrup", "elixir", "emulsion", "pellet", "granule", "kit");

    private static final List<String> NON_DRUG_PRODUCTS = List.of(
            "sanitizer", "hand wash", "antiseptic", "disinfectant",
            "cleaning", "cosmetic", "sunscreen", "soap", "shampoo",
            "toothpaste", "mouthwash", "deodorant");

    private ProductMatchScorer() {}

    /**
     * Scores one drug label.
     *
     * @param labelGenericNames generic names printed on the label
     * @param populatedClinicalSections number of filled clinical sections
     * @param hasDosage whether dosage and administration is present
     * @param productTypes e.g. "HUMAN PRESCRIPTION DRUG", "HUMAN OTC DRUG"
     */
    public static int scoreLabel(String requestedName, List<String> labelGenericNames,
                                 int populatedClinicalSections, boolean hasDosage,
                                 List<String> productTypes) {
        String name = normalize(requestedName);
        int score = 0;
        for (String raw : labelGenericNames) {
            String gn = normalize(raw);
            boolean combo = gn.contains(" and ") || gn.contains("/") || gn.contains(",");
            if (gn.equals(name)) score += 300;
            else if (gn.equals(name + " hydrochloride") || gn.equals(name + " hcl")) score += 280;
            else if (gn.startsWith(name) && !combo) score += 200;
            else if (gn.contains(name) && !combo) score += 100;
            else if (gn.contains(name)) score -= 200;
        }
        score += 5 * populatedClinicalSections;
        if (hasDosage) score += 5;
        for (String pt : productTypes) {
            String p = pt.toUpperCase(Locale.ROOT);
            if (p.contains("PRESCRIPTION")) score += 30;
            else if (p.contains("OTC")) score -= 10;
        }
        return score;
    }

    /** Scores a structured-product-label title such as "ATORVASTATIN CALCIUM TABLET [ACME]". */
    public static int scoreSplTitle(String requestedName, String title) {
        String name = normalize(requestedName);
        String t = title == null ? "" : title.strip();
        String lower = t.toLowerCase(Locale.ROOT);
        int score = 0;

        if (NON_DRUG_PRODUCTS.stream().anyMatch(lower::contains)) score -= 500;

        String drugPart = drugNamePortion(lower);
        boolean combo = drugPart.contains(" and ") || drugPart.contains(" / ")
                || (drugPart.contains(",") && SALT_SUFFIXES.stream().noneMatch(drugPart::contains));

        if (drugPart.equals(name)) score += 300;
        else if (SALT_SUFFIXES.stream().anyMatch(s -> drugPart.equals(name + " " + s))) score += 280;
        else if (drugPart.startsWith(name) && !combo) score += 260;
        else if (drugPart.contains(name) && !combo) score += 100;
        else if (drugPart.contains(name)) score -= 100;
        else if (!lower.contains(name)) score -= 300;

        if (combo) score -= 200;

        if (t.length() < 80) score += 10;
        else if (t.length() > 140) score -= 10;
        return score;
    }

    static String drugNamePortion(String lowerTitle) {
        String nameAndForm = lowerTitle.split("\\s*\\[", 2)[0].strip();
        String portion = nameAndForm.split("\\s*[-–]\\s*", 2)[0].strip();
        for (String form : DOSAGE_FORMS) {
            int idx = portion.indexOf(form);
            if (idx > 0) {
                portion = portion.substring(0, idx).strip();
                while (portion.endsWith(",")) portion = portion.substring(0, portion.length() - 1);
                return portion.strip();
            }
        }
        return portion;
    }

    private static String normalize(String s) {
        return s == null ? "" : s.strip().toLowerCase(Locale.ROOT);
    }
}
