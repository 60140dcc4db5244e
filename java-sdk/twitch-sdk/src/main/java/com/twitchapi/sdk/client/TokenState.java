package com.twitchapi.sdk.client;

import java.time.Instant;
import java.util.Optional;

/**
 * In-process token state: either {@link #unset()} or holding an {@link AccessToken}.
 */
public final class TokenState {

    private static final TokenState UNSET = new TokenState(null);

    private final AccessToken token;

    private TokenState(AccessToken token) {
        this.token = token;
    }

    public static TokenState unset() {
        return UNSET;
    }

    public static TokenState valid(AccessToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        return new TokenState(token);
    }

    public boolean isSet() {
        return token != null;
    }

    public Optional<AccessToken> getToken() {
        return Optional.ofNullable(token);
    }

    /**
     * True when no token is held, its expiry is unknown, or {@code now} is past its expiry
     */
    public boolean needsRefresh(Instant now) {
        return token == null || !token.hasKnownExpiry() || token.isExpired(now);
    }

    @Override
    public String toString() {
        return token == null ? "TokenState[UNSET]" : "TokenState[VALID, " + token + "]";
    }
}
