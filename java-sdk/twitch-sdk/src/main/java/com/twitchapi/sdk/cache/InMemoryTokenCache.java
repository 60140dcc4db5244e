package com.twitchapi.sdk.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link TokenCache} for tests and single-instance deployments.
 */
public class InMemoryTokenCache implements TokenCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTokenCache() {
        this(Clock.systemUTC());
    }

    public InMemoryTokenCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        return live(key).map(Entry::value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            entries.remove(key);
            return;
        }
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public Optional<Duration> getTtl(String key) {
        return live(key).map(entry -> Duration.between(clock.instant(), entry.expiresAt()));
    }

    private Optional<Entry> live(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private record Entry(String value, Instant expiresAt) {
    }
}
