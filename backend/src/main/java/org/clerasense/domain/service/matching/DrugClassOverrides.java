package org.clerasense.domain.service.matching;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class DrugClassOverrides {

    private static final Map<String, String> OVERRIDES = Map.ofEntries(
            Map.entry("metformin", "Biguanide Antihyperglycemic"),
            Map.entry("atorvastatin", "HMG-CoA Reductase Inhibitor (Statin)"),
            Map.entry("simvastatin", "HMG-CoA Reductase Inhibitor (Statin)"),
            Map.entry("rosuvastatin", "HMG-CoA Reductase Inhibitor (Statin)"),
            Map.entry("ibuprofen", "Nonsteroidal Anti-inflammatory Drug (NSAID)"),
            Map.entry("meloxicam", "Nonsteroidal Anti-inflammatory Drug (NSAID)"),
            Map.entry("amoxicillin", "Aminopenicillin Antibiotic"),
            Map.entry("omeprazole", "Proton Pump Inhibitor"),
            Map.entry("amlodipine", "Calcium Channel Blocker"),
            Map.entry("metoprolol", "Beta-Adrenergic Blocker"),
            Map.entry("hydrochlorothiazide", "Thiazide Diuretic"),
            Map.entry("doxycycline", "Tetracycline Antibiotic")
    );

    private static final List<String> COMBINATION_HINTS = List.of("combination", " and ", " with ");

    private DrugClassOverrides() {}

    public static Optional<String> lookup(String genericName) {
        if (genericName == null) return Optional.empty();
        return Optional.ofNullable(OVERRIDES.get(genericName.strip().toLowerCase(Locale.ROOT)));
    }

    public static boolean isCombinationClass(String drugClass) {
        if (drugClass == null) return false;
        String c = drugClass.toLowerCase(Locale.ROOT);
        return COMBINATION_HINTS.stream().anyMatch(c::contains);
    }
}
