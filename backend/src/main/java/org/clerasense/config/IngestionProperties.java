package org.clerasense.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "clerasense.ingestion")
public class IngestionProperties {
    private int fetchPoolSize = 4;
    private int fillPoolSize = 4;
    private Duration adapterTimeout = Duration.ofSeconds(90);
    private boolean acceptSingleSource = true;
    private double onDemandDelayScale = 0.2;
    private double batchDelayScale = 1.0;
    private Duration providerCacheTtl = Duration.ofHours(24);
    private long providerCacheMaxEntries = 500;
    private boolean enrichmentEnabled = true;

    public int getFetchPoolSize() { return fetchPoolSize; }
    public void setFetchPoolSize(int v) { this.fetchPoolSize = v; }
    public int getFillPoolSize() { return fillPoolSize; }
    public void setFillPoolSize(int v) { this.fillPoolSize = v; }
    public Duration getAdapterTimeout() { return adapterTimeout; }
    public void setAdapterTimeout(Duration v) { this.adapterTimeout = v; }
    public boolean isAcceptSingleSource() { return acceptSingleSource; }
    public void setAcceptSingleSource(boolean v) { this.acceptSingleSource = v; }
    public double getOnDemandDelayScale() { return onDemandDelayScale; }
    public void setOnDemandDelayScale(double v) { this.onDemandDelayScale = v; }
    public double getBatchDelayScale() { return batchDelayScale; }
    public void setBatchDelayScale(double v) { this.batchDelayScale = v; }
    public Duration getProviderCacheTtl() { return providerCacheTtl; }
    public void setProviderCacheTtl(Duration v) { this.providerCacheTtl = v; }
    public long getProviderCacheMaxEntries() { return providerCacheMaxEntries; }
    public void setProviderCacheMaxEntries(long v) { this.providerCacheMaxEntries = v; }
    public boolean isEnrichmentEnabled() { return enrichmentEnabled; }
    public void setEnrichmentEnabled(boolean v) { this.enrichmentEnabled = v; }
}
