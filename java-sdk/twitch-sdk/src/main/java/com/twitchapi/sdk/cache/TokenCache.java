package com.twitchapi.sdk.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared key-value store used to hand an issued access token between processes.
 *
 * <p>Only atomic single-key reads and writes are required. Implementations report an
 * unreachable store as an absent value rather than throwing.</p>
 */
public interface TokenCache {

    Optional<String> get(String key);

    /**
     * Store {@code value} under {@code key}, expiring after {@code ttl}. A missing or non-positive
     * {@code ttl} removes the key instead; entries without an expiry are never written.
     */
    void set(String key, String value, Duration ttl);

    /**
     * Remaining lifetime of {@code key}; empty when the key is missing or never expires
     */
    Optional<Duration> getTtl(String key);
}
