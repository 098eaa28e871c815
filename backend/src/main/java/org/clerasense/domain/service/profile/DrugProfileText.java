package org.clerasense.domain.service.profile;

import org.clerasense.domain.model.drug.DrugInteraction;
import org.clerasense.domain.model.drug.DrugRecord;
import org.clerasense.domain.model.drug.NormalizedDrugData;

import java.util.ArrayList;
import java.util.List;

public final class DrugProfileText {

    public static final String FIELD_NAME = "full_profile";

    private DrugProfileText() {}

    public static String of(NormalizedDrugData d) {
        List<String> parts = header(d.genericName(), d.brandNames(), d.drugClass(), d.mechanismOfAction());
        d.indications().forEach(i -> parts.add("Indication: " + i));
        parts.addAll(dosage(d.adultDosage(), d.pediatricDosage(), d.renalAdjustment(), d.hepaticAdjustment(),
                d.overdoseInfo(), d.underdoseInfo(), d.administrationInfo()));
        parts.addAll(safety(d.contraindications(), d.blackBoxWarnings(), d.pregnancyRisk(), d.lactationRisk()));
        d.interactions().forEach(ix -> parts.add(interaction(ix)));
        return join(parts);
    }

    public static String of(DrugRecord r) {
        List<String> parts = header(r.genericName(), r.brandNames(), r.drugClass(), r.mechanismOfAction());
        r.indications().forEach(i -> parts.add("Indication: " + i));
        if (r.dosage() != null) {
            var g = r.dosage();
            parts.addAll(dosage(g.adultDosage(), g.pediatricDosage(), g.renalAdjustment(), g.hepaticAdjustment(),
                    g.overdoseInfo(), g.underdoseInfo(), g.administrationInfo()));
        }
        if (r.safety() != null) {
            var s = r.safety();
            parts.addAll(safety(s.contraindications(), s.blackBoxWarnings(), s.pregnancyRisk(), s.lactationRisk()));
        }
        r.interactions().forEach(ix -> parts.add(interaction(ix)));
        return join(parts);
    }

    private static List<String> header(String name, List<String> brands, String cls, String mechanism) {
        List<String> parts = new ArrayList<>();
        parts.add("Drug: " + name);
        parts.add("Brand names: " + String.join(", ", brands));
        parts.add("Class: " + nz(cls));
        parts.add("Mechanism: " + nz(mechanism));
        return parts;
    }

    private static List<String> dosage(String adult, String pediatric, String renal, String hepatic,
                                       String overdose, String underdose, String administration) {
        return List.of(
                "Adult dosage: " + nz(adult),
                "Pediatric dosage: " + nz(pediatric),
                "Renal adjustment: " + nz(renal),
                "Hepatic adjustment: " + nz(hepatic),
                "Overdose information: " + nz(overdose),
                "Underdose / missed dose: " + nz(underdose),
                "Administration details: " + nz(administration));
    }

    private static List<String> safety(String contra, String blackBox, String pregnancy, String lactation) {
        return List.of(
                "Contraindications: " + nz(contra),
                "Black box warnings: " + nz(blackBox),
                "Pregnancy risk: " + nz(pregnancy),
                "Lactation risk: " + nz(lactation));
    }

    private static String interaction(DrugInteraction ix) {
        return "Interaction with " + ix.interactingDrug() + ": " + ix.severity().label() + " – " + ix.description();
    }

    private static String join(List<String> parts) {
        return String.join("\n", parts.stream().filter(p -> !p.isBlank()).toList());
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
