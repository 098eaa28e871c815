package org.clerasense.domain.model.ingestion;

public record RequestPacing(double delayScale) {
    public static final RequestPacing ON_DEMAND = new RequestPacing(0.2);
    public static final RequestPacing BATCH = new RequestPacing(1.0);

    public RequestPacing {
        if (delayScale < 0) throw new IllegalArgumentException("delayScale must be >= 0");
    }

    public long scaledMillis(long baseDelayMs) {
        return Math.round(baseDelayMs * delayScale);
    }
}
