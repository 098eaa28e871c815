package org.clerasense.domain.model.drug;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

// Text fields are never null, empty means not provided. Null genericAvailable, unitPrice or
// adverseEvents means the provider does not know.
public record NormalizedDrugData(
        String genericName,
        List<String> brandNames,
        String drugClass,
        String mechanismOfAction,
        List<String> indications,
        String adultDosage,
        String pediatricDosage,
        String renalAdjustment,
        String hepaticAdjustment,
        String overdoseInfo,
        String underdoseInfo,
        String administrationInfo,
        String contraindications,
        String blackBoxWarnings,
        String pregnancyRisk,
        String lactationRisk,
        List<DrugInteraction> interactions,
        String approximateCost,
        Boolean genericAvailable,
        UnitPrice unitPrice,
        AdverseEventSummary adverseEvents,
        Provenance provenance
) {

    public NormalizedDrugData {
        Objects.requireNonNull(genericName, "genericName");
        Objects.requireNonNull(provenance, "provenance");
        brandNames = brandNames == null ? List.of() : List.copyOf(brandNames);
        indications = indications == null ? List.of() : List.copyOf(indications);
        interactions = interactions == null ? List.of() : List.copyOf(interactions);
        drugClass = nz(drugClass);
        mechanismOfAction = nz(mechanismOfAction);
        adultDosage = nz(adultDosage);
        pediatricDosage = nz(pediatricDosage);
        renalAdjustment = nz(renalAdjustment);
        hepaticAdjustment = nz(hepaticAdjustment);
        overdoseInfo = nz(overdoseInfo);
        underdoseInfo = nz(underdoseInfo);
        administrationInfo = nz(administrationInfo);
        contraindications = nz(contraindications);
        blackBoxWarnings = nz(blackBoxWarnings);
        pregnancyRisk = nz(pregnancyRisk);
        lactationRisk = nz(lactationRisk);
        approximateCost = nz(approximateCost);
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }

    public String sourceAuthority() {
        return provenance.sourceAuthority();
    }

    public boolean hasUnitPrice() {
        return unitPrice != null;
    }

    public static Builder builder(String genericName, Provenance provenance) {
        return new Builder(genericName, provenance);
    }

    public Builder toBuilder() {
        return new Builder(genericName, provenance)
                .brandNames(brandNames)
                .drugClass(drugClass)
                .mechanismOfAction(mechanismOfAction)
                .indications(indications)
                .adultDosage(adultDosage)
                .pediatricDosage(pediatricDosage)
                .renalAdjustment(renalAdjustment)
                .hepaticAdjustment(hepaticAdjustment)
                .overdoseInfo(overdoseInfo)
                .underdoseInfo(underdoseInfo)
                .administrationInfo(administrationInfo)
                .contraindications(contraindications)
                .blackBoxWarnings(blackBoxWarnings)
                .pregnancyRisk(pregnancyRisk)
                .lactationRisk(lactationRisk)
                .interactions(interactions)
                .approximateCost(approximateCost)
                .genericAvailable(genericAvailable)
                .unitPrice(unitPrice)
                .adverseEvents(adverseEvents);
    }

    public static final class Builder {
        private String genericName;
        private Provenance provenance;
        private List<String> brandNames = new ArrayList<>();
        private String drugClass;
        private String mechanismOfAction;
        private List<String> indications = new ArrayList<>();
        private String adultDosage;
        private String pediatricDosage;
        private String renalAdjustment;
        private String hepaticAdjustment;
        private String overdoseInfo;
        private String underdoseInfo;
        private String administrationInfo;
        private String contraindications;
        private String blackBoxWarnings;
        private String pregnancyRisk;
        private String lactationRisk;
        private List<DrugInteraction> interactions = new ArrayList<>();
        private String approximateCost;
        private Boolean genericAvailable;
        private UnitPrice unitPrice;
        private AdverseEventSummary adverseEvents;

        private Builder(String genericName, Provenance provenance) {
            this.genericName = genericName;
            this.provenance = provenance;
        }

        public Builder genericName(String v) { this.genericName = v; return this; }
        public Builder provenance(Provenance v) { this.provenance = v; return this; }
        public Builder brandNames(List<String> v) { this.brandNames = v; return this; }
        public Builder drugClass(String v) { this.drugClass = v; return this; }
        public Builder mechanismOfAction(String v) { this.mechanismOfAction = v; return this; }
        public Builder indications(List<String> v) { this.indications = v; return this; }
        public Builder adultDosage(String v) { this.adultDosage = v; return this; }
        public Builder pediatricDosage(String v) { this.pediatricDosage = v; return this; }
        public Builder renalAdjustment(String v) { this.renalAdjustment = v; return this; }
        public Builder hepaticAdjustment(String v) { this.hepaticAdjustment = v; return this; }
        public Builder overdoseInfo(String v) { this.overdoseInfo = v; return this; }
        public Builder underdoseInfo(String v) { this.underdoseInfo = v; return this; }
        public Builder administrationInfo(String v) { this.administrationInfo = v; return this; }
        public Builder contraindications(String v) { this.contraindications = v; return this; }
        public Builder blackBoxWarnings(String v) { this.blackBoxWarnings = v; return this; }
        public Builder pregnancyRisk(String v) { this.pregnancyRisk = v; return this; }
        public Builder lactationRisk(String v) { this.lactationRisk = v; return this; }
        public Builder interactions(List<DrugInteraction> v) { this.interactions = v; return this; }
        public Builder approximateCost(String v) { this.approximateCost = v; return this; }
        public Builder genericAvailable(Boolean v) { this.genericAvailable = v; return this; }
        public Builder unitPrice(UnitPrice v) { this.unitPrice = v; return this; }
        public Builder adverseEvents(AdverseEventSummary v) { this.adverseEvents = v; return this; }

        public NormalizedDrugData build() {
            return new NormalizedDrugData(
                    genericName, brandNames, drugClass, mechanismOfAction, indications,
                    adultDosage, pediatricDosage, renalAdjustment, hepaticAdjustment,
                    overdoseInfo, underdoseInfo, administrationInfo,
                    contraindications, blackBoxWarnings, pregnancyRisk, lactationRisk,
                    interactions, approximateCost, genericAvailable, unitPrice, adverseEvents,
                    provenance);
        }
    }
}
