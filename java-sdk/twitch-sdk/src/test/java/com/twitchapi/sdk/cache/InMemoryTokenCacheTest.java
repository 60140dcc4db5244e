package com.twitchapi.sdk.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTokenCacheTest {

    private Instant now;
    private InMemoryTokenCache cache;

    @BeforeEach
    void setUp() {
        now = Instant.parse("2024-03-01T12:00:00Z");
        cache = new InMemoryTokenCache(new Clock() {
            @Override
            public ZoneOffset getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return now;
            }
        });
    }

    @Test
    void missingKeyIsEmpty() {
        assertEquals(Optional.empty(), cache.get("twitch:access_token"));
        assertEquals(Optional.empty(), cache.getTtl("twitch:access_token"));
    }

    @Test
    void storedValueReportsRemainingTtl() {
        cache.set("twitch:access_token", "abc", Duration.ofSeconds(3600));
        now = now.plusSeconds(600);

        assertEquals(Optional.of("abc"), cache.get("twitch:access_token"));
        assertEquals(Optional.of(Duration.ofSeconds(3000)), cache.getTtl("twitch:access_token"));
    }

    @Test
    void expiredEntryIsEvicted() {
        cache.set("twitch:access_token", "abc", Duration.ofSeconds(10));
        now = now.plusSeconds(10);

        assertEquals(Optional.empty(), cache.get("twitch:access_token"));
        assertEquals(Optional.empty(), cache.getTtl("twitch:access_token"));
    }

    @Test
    void entryWithoutTtlIsNeverStored() {
        cache.set("twitch:access_token", "abc", null);

        assertEquals(Optional.empty(), cache.get("twitch:access_token"));
    }

    @Test
    void nonPositiveTtlRemovesExistingEntry() {
        cache.set("twitch:access_token", "abc", Duration.ofSeconds(3600));
        cache.set("twitch:access_token", "zero", Duration.ZERO);

        assertEquals(Optional.empty(), cache.get("twitch:access_token"));
        assertEquals(Optional.empty(), cache.getTtl("twitch:access_token"));
    }

    @Test
    void setOverwritesPreviousValue() {
        cache.set("twitch:access_token", "old", Duration.ofSeconds(60));
        cache.set("twitch:access_token", "new", Duration.ofSeconds(120));

        assertEquals(Optional.of("new"), cache.get("twitch:access_token"));
        assertEquals(Optional.of(Duration.ofSeconds(120)), cache.getTtl("twitch:access_token"));
    }
}
