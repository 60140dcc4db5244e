package com.twitchapi.sdk.client;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TokenStateTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    void unsetStateNeedsRefresh() {
        TokenState state = TokenState.unset();
        assertFalse(state.isSet());
        assertTrue(state.getToken().isEmpty());
        assertTrue(state.needsRefresh(NOW));
    }

    @Test
    void validStateIsUsableUntilExpiry() {
        TokenState state = TokenState.valid(new AccessToken("abc", NOW.plusSeconds(60)));

        assertTrue(state.isSet());
        assertFalse(state.needsRefresh(NOW));
        assertFalse(state.needsRefresh(NOW.plusSeconds(60)));
        assertTrue(state.needsRefresh(NOW.plusSeconds(61)));
    }

    @Test
    void unknownExpiryAlwaysNeedsRefresh() {
        AccessToken token = new AccessToken("abc", AccessToken.UNKNOWN_EXPIRY);
        assertFalse(token.hasKnownExpiry());
        assertTrue(TokenState.valid(token).needsRefresh(NOW));
    }

    @Test
    void validRejectsNullToken() {
        assertThrows(IllegalArgumentException.class, () -> TokenState.valid(null));
    }

    @Test
    void accessTokenToStringHidesValue() {
        AccessToken token = new AccessToken("super-secret-token", NOW);
        assertFalse(token.toString().contains("super-secret-token"));
        assertFalse(TokenState.valid(token).toString().contains("super-secret-token"));
    }
}
