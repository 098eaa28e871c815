package org.clerasense.domain.service.pricing;

import org.clerasense.domain.service.pricing.NadacPriceSummarizer.PriceRow;
import org.clerasense.domain.service.pricing.NadacPriceSummarizer.PriceSummary;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NadacPriceSummarizerTest {

    private static PriceRow row(String desc, double price, String date) {
        return new PriceRow(desc, "EA", price, date, "G", "00000000001", "100");
    }

    @Test
    void keeps_latest_row_per_form_and_cheapest_first() {
        List<PriceRow> rows = List.of(
                row("LISINOPRIL 10 MG TABLET", 0.0300, "2024-01-03T00:00:00"),
                row("LISINOPRIL 10 MG TABLET", 0.0250, "2024-02-07T00:00:00"),
                row("LISINOPRIL 40 MG TABLET", 0.0600, "2024-02-07T00:00:00"));

        PriceSummary s = NadacPriceSummarizer.summarize(rows).orElseThrow();

        assertEquals(2, s.formsCount());
        assertEquals(0.025, s.cheapestPerUnit());
        assertEquals(LocalDate.of(2024, 2, 7), s.primary().effectiveDate());
        assertTrue(s.generic());
        assertTrue(s.displayText().startsWith("$0.0250/EA → ~$0.75–$2.25/month (LISINOPRIL 10 MG TABLET)"));
    }

    @Test
    void zero_and_missing_prices_are_ignored() {
        List<PriceRow> rows = List.of(
                new PriceRow("X 1 MG TABLET", "EA", null, "2024-01-01", "B", "1", "1"),
                row("X 2 MG TABLET", 0.0, "2024-01-01"));

        assertTrue(NadacPriceSummarizer.summarize(rows).isEmpty());
    }

    @Test
    void single_ingredient_rows_preferred_over_combinations() {
        PriceRow single = row("LISINOPRIL 10 MG TABLET", 0.03, "2024-01-01");
        PriceRow combo = row("HYDROCHLOROTHIAZIDE-LISINOPRIL 12.5-20 MG TAB", 0.09, "2024-01-01");

        assertEquals(List.of(single), NadacPriceSummarizer.preferSingleIngredient("Lisinopril", List.of(combo, single)));
        assertEquals(List.of(combo), NadacPriceSummarizer.preferSingleIngredient("lisinopril", List.of(combo)));
    }

    @Test
    void estimate_bands_depend_on_generic_status_and_route() {
        assertEquals("Estimated $4–$30/month (generic; verify with NADAC/pharmacy)",
                CostEstimator.estimate("ACE Inhibitor", "oral", true));
        assertEquals("Estimated $1,000–$5,000/month (brand biologic; verify with pharmacy)",
                CostEstimator.estimate("Monoclonal Antibody", "injection", false));
    }
}
