package org.clerasense.infrastructure.adapter.out.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.clerasense.application.port.ProviderCachePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * In-process provider response cache.
 * <p>
 * Entries count as fresh for {@code ttl}. They stay readable as stale values for a further
 * {@code STALE_FACTOR - 1} TTLs, so a provider outage can fall back to the last good answer.
 */
public class CaffeineProviderCache implements ProviderCachePort {

    private static final Logger log = LoggerFactory.getLogger(CaffeineProviderCache.class);

    static final int STALE_FACTOR = 7;

    private record Entry(String value, Instant storedAt) {}

    private final Cache<String, Entry> cache;
    private final Duration ttl;
    private final Clock clock;

    public CaffeineProviderCache(Duration ttl, long maxEntries) {
        this(ttl, maxEntries, Clock.systemUTC());
    }

    CaffeineProviderCache(Duration ttl, long maxEntries, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(ttl.multipliedBy(STALE_FACTOR))
                .removalListener((key, value, cause) -> {
                    if (cause.wasEvicted()) log.debug("Provider cache evicted {} ({})", key, cause);
                })
                .build();
    }

    @Override
    public Optional<CachedValue> get(String key) {
        Entry e = cache.getIfPresent(key);
        if (e == null) return Optional.empty();
        boolean fresh = e.storedAt().plus(ttl).isAfter(clock.instant());
        return Optional.of(new CachedValue(e.value(), fresh));
    }

    @Override
    public void put(String key, String value) {
        cache.put(key, new Entry(value, clock.instant()));
    }
}
