package org.clerasense.domain.model.drug;

import java.util.List;

public record AdverseEventSummary(
        long totalEventCount,
        long seriousEventCount,
        List<AdverseReaction> topReactions
) {
    public AdverseEventSummary {
        topReactions = topReactions == null ? List.of() : List.copyOf(topReactions);
    }

    public record AdverseReaction(String reaction, long count) {}
}
