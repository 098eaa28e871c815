package org.clerasense.application.port;

import java.util.Optional;

/**
 * Process-wide cache for provider responses. Entries past their time-to-live are still
 * returned, flagged as stale, so a caller can fall back to them when a refresh fails.
 */
public interface ProviderCachePort {

    record CachedValue(String value, boolean fresh) {}

    Optional<CachedValue> get(String key);

    void put(String key, String value);
}
