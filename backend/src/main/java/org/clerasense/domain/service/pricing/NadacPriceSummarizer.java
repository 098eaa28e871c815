package org.clerasense.domain.service.pricing;

import org.clerasense.domain.model.drug.UnitPrice;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reduces raw weekly acquisition-cost rows to one price summary: latest row per
 * formulation, cheapest formulation first, up to three display lines.
 */
public final class NadacPriceSummarizer {

    private static final Set<String> PER_EACH_UNITS = Set.of("EA", "EACH", "TAB", "CAP");
    private static final int DISPLAY_LINES = 3;

    private NadacPriceSummarizer() {}

    /** One published price row. {@code effectiveDate} is ISO text, possibly with a time part. */
    public record PriceRow(
            String ndcDescription,
            String pricingUnit,
            Double perUnit,
            String effectiveDate,
            String classification,
            String ndc,
            String packageSize
    ) {}

    public record PriceSummary(
            String displayText,
            UnitPrice primary,
            String classification,
            double cheapestPerUnit,
            int formsCount
    ) {
        /** Rate-setting classification "G" marks a generic product. */
        public boolean generic() {
            return classification != null && classification.toUpperCase(Locale.ROOT).contains("G");
        }
    }

    /**
     * Keeps rows whose description names the drug as a single ingredient,
     * falling back to all rows when none do.
     */
    public static List<PriceRow> preferSingleIngredient(String genericName, List<PriceRow> rows) {
        String drug = genericName.strip().toUpperCase(Locale.ROOT);
        List<PriceRow> single = new ArrayList<>();
        List<PriceRow> combo = new ArrayList<>();
        for (PriceRow r : rows) {
            String desc = r.ndcDescription() == null ? "" : r.ndcDescription().toUpperCase(Locale.ROOT);
            if (desc.startsWith(drug)) {
                single.add(r);
            } else if (desc.contains(drug + " ") && !desc.substring(0, desc.indexOf(drug)).contains("-")) {
                single.add(r);
            } else {
                combo.add(r);
            }
        }
        return single.isEmpty() ? combo : single;
    }

    public static Optional<PriceSummary> summarize(List<PriceRow> rows) {
        Map<String, PriceRow> byForm = new LinkedHashMap<>();
        for (PriceRow r : rows) {
            if (r.perUnit() == null || r.perUnit() == 0.0) continue;
            String desc = r.ndcDescription() == null ? "" : r.ndcDescription();
            String key = desc.isEmpty()
                    ? "form_" + r.pricingUnit()
                    : truncate(desc.toLowerCase(Locale.ROOT).strip(), 80);
            PriceRow existing = byForm.get(key);
            if (existing == null || nz(r.effectiveDate()).compareTo(nz(existing.effectiveDate())) > 0) {
                byForm.put(key, r);
            }
        }
        if (byForm.isEmpty()) return Optional.empty();

        List<PriceRow> forms = new ArrayList<>(byForm.values());
        forms.sort(Comparator.comparingDouble(PriceRow::perUnit));

        List<String> lines = new ArrayList<>();
        for (PriceRow f : forms.subList(0, Math.min(DISPLAY_LINES, forms.size()))) {
            lines.add(displayLine(f));
        }

        PriceRow primary = forms.get(0);
        UnitPrice unitPrice = new UnitPrice(
                primary.perUnit(),
                nz(primary.pricingUnit()),
                nz(primary.ndc()),
                parseDate(primary.effectiveDate()),
                nz(primary.ndcDescription()));
        return Optional.of(new PriceSummary(
                String.join("; ", lines),
                unitPrice,
                nz(primary.classification()),
                primary.perUnit(),
                forms.size()));
    }

    static String displayLine(PriceRow f) {
        double price = f.perUnit();
        String unit = nz(f.pricingUnit());
        String line;
        if (PER_EACH_UNITS.contains(unit.toUpperCase(Locale.ROOT))) {
            line = String.format(Locale.ROOT, "$%.4f/%s → ~$%.2f–$%.2f/month", price, unit, price * 30, price * 90);
        } else {
            line = String.format(Locale.ROOT, "$%.4f/%s", price, unit);
        }
        String desc = nz(f.ndcDescription());
        return desc.isEmpty() ? line : line + " (" + desc + ")";
    }

    public static LocalDate parseDate(String raw) {
        if (raw == null || raw.length() < 10) return null;
        try {
            return LocalDate.parse(raw.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
