package com.twitchapi.sdk.client;

import java.time.Instant;
import java.util.Objects;

/**
 * Access token value together with the instant after which it must not be used.
 *
 * @param value     bearer token (without the {@code Bearer } prefix)
 * @param expiresAt expiry; {@link #UNKNOWN_EXPIRY} when the lifetime could not be determined
 */
public record AccessToken(String value, Instant expiresAt) {

    /**
     * Expiry used for a token whose lifetime is unknown. Always in the past, so the token is refreshed before use.
     */
    public static final Instant UNKNOWN_EXPIRY = Instant.EPOCH;

    public AccessToken {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public boolean hasKnownExpiry() {
        return !UNKNOWN_EXPIRY.equals(expiresAt);
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    @Override
    public String toString() {
        return "AccessToken[expiresAt=" + expiresAt + "]";
    }
}
