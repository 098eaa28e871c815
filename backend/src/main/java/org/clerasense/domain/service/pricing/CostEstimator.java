package org.clerasense.domain.service.pricing;

import java.util.Locale;

public final class CostEstimator {

    private CostEstimator() {}

    public static String estimate(String drugClass, String route, boolean genericAvailable) {
        String r = route == null ? "" : route.toLowerCase(Locale.ROOT);
        if (genericAvailable) {
            if (r.contains("oral") || r.contains("tablet")) {
                return "Estimated $4–$30/month (generic; verify with NADAC/pharmacy)";
            } else if (r.contains("injection") || r.contains("intravenous")) {
                return "Estimated $10–$100/dose (generic injection; verify with pharmacy)";
            } else if (r.contains("inhalation")) {
                return "Estimated $20–$80/month (generic inhaler; verify with pharmacy)";
            }
            return "Estimated $4–$50/month (generic; verify with pharmacy)";
        }
        String c = drugClass == null ? "" : drugClass.toLowerCase(Locale.ROOT);
        if (c.contains("biologic") || c.contains("monoclonal")) {
            return "Estimated $1,000–$5,000/month (brand biologic; verify with pharmacy)";
        } else if (r.contains("injection")) {
            return "Estimated $50–$500/dose (brand injection; verify with pharmacy)";
        } else if (r.contains("oral")) {
            return "Estimated $30–$200/month (brand oral; verify with pharmacy)";
        }
        return "Estimated $30–$300/month (brand; verify with pharmacy)";
    }
}
