package com.twitchapi.sdk.client;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CredentialsTest {

    @Test
    void constructorRejectsBlankValues() {
        assertThrows(IllegalArgumentException.class, () -> new Credentials(null, "secret"));
        assertThrows(IllegalArgumentException.class, () -> new Credentials("  ", "secret"));
        assertThrows(IllegalArgumentException.class, () -> new Credentials("id", null));
        assertThrows(IllegalArgumentException.class, () -> new Credentials("id", ""));
    }

    @Test
    void fromEnvironmentReadsBothVariables() {
        Map<String, String> env = Map.of(
                "TWITCH_CLIENT_ID", "abc123",
                "TWITCH_CLIENT_SECRET", "s3cr3t");

        Credentials credentials = Credentials.fromEnvironment(env::get);

        assertEquals("abc123", credentials.clientId());
        assertEquals("s3cr3t", credentials.clientSecret());
    }

    @Test
    void fromEnvironmentFailsWithoutClientId() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> Credentials.fromEnvironment(Map.of("TWITCH_CLIENT_SECRET", "s3cr3t")::get));
        assertEquals("TWITCH_CLIENT_ID is not set", ex.getMessage());
    }

    @Test
    void fromEnvironmentFailsWithBlankSecret() {
        Map<String, String> env = Map.of(
                "TWITCH_CLIENT_ID", "abc123",
                "TWITCH_CLIENT_SECRET", " ");

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> Credentials.fromEnvironment(env::get));
        assertEquals("TWITCH_CLIENT_SECRET is not set", ex.getMessage());
    }

    @Test
    void toStringMasksSecret() {
        String text = new Credentials("abc123", "s3cr3t").toString();
        assertTrue(text.contains("abc123"));
        assertFalse(text.contains("s3cr3t"));
    }
}
