package org.clerasense.domain.model.drug;

import java.time.Instant;
import java.util.List;

public record DrugRecord(
        long id,
        String genericName,
        List<String> brandNames,
        String drugClass,
        String mechanismOfAction,
        SourceRef source,
        List<String> indications,
        Dosage dosage,
        Safety safety,
        List<DrugInteraction> interactions,
        Pricing pricing,
        Instant createdAt
) {
    public DrugRecord {
        brandNames = brandNames == null ? List.of() : List.copyOf(brandNames);
        indications = indications == null ? List.of() : List.copyOf(indications);
        interactions = interactions == null ? List.of() : List.copyOf(interactions);
    }

    public record Dosage(
            String adultDosage,
            String pediatricDosage,
            String renalAdjustment,
            String hepaticAdjustment,
            String overdoseInfo,
            String underdoseInfo,
            String administrationInfo,
            SourceRef source
    ) {}

    public record Safety(
            String contraindications,
            String blackBoxWarnings,
            String pregnancyRisk,
            String lactationRisk,
            AdverseEventSummary adverseEvents,
            SourceRef source
    ) {}

    public record Pricing(
            String approximateCost,
            boolean genericAvailable,
            String pricingSource,
            UnitPrice unitPrice,
            SourceRef source
    ) {}
}
