package org.clerasense.domain.model.drug;

import java.time.LocalDate;

public record UnitPrice(
        double perUnit,
        String unitCode,
        String ndc,
        LocalDate effectiveDate,
        String packageDescription
) {}
