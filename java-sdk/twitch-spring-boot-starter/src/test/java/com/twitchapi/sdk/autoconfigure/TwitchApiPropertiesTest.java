package com.twitchapi.sdk.autoconfigure;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TwitchApiPropertiesTest {

    private static TwitchApiProperties props(Boolean enabled, String clientId, String clientSecret,
                                             String transport, TwitchApiProperties.Cache cache) {
        return new TwitchApiProperties(enabled, clientId, clientSecret, null, null, null, null, transport, null, cache);
    }

    // --- Root properties: constructor & defaults ---

    @Test
    void defaultValuesWhenAllNulls() {
        TwitchApiProperties props = new TwitchApiProperties(null, null, null, null, null, null, null, null, null, null);

        assertThat(props.isEnabled()).isFalse();
        assertThat(props.getBaseUrl()).isEqualTo("https://api.twitch.tv/helix/");
        assertThat(props.getTokenUrl()).isEqualTo("https://id.twitch.tv/oauth2/token");
        assertThat(props.getConnectTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(props.getRequestTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.getTransport()).isEqualTo("jdk");
        assertThat(props.isAuthorizeOnStartup()).isTrue();
        assertThat(props.hasCredentials()).isFalse();
        assertThat(props.getCache().getType()).isEqualTo("memory");
        assertThat(props.getCache().getKey()).isEqualTo("twitch:access_token");
        assertThat(props.getCache().getSafetyMargin()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void customValuesPreserved() {
        TwitchApiProperties.Cache cache = new TwitchApiProperties.Cache(
                "redis", "redis://cache:6379", "bot:token", Duration.ofSeconds(30));
        TwitchApiProperties props = new TwitchApiProperties(
                true, "id", "secret", "https://helix.test/", "https://id.test/token",
                Duration.ofSeconds(2), Duration.ofSeconds(5), "restclient", false, cache);

        assertThat(props.isEnabled()).isTrue();
        assertThat(props.hasCredentials()).isTrue();
        assertThat(props.getClientId()).isEqualTo("id");
        assertThat(props.getClientSecret()).isEqualTo("secret");
        assertThat(props.getBaseUrl()).isEqualTo("https://helix.test/");
        assertThat(props.getTokenUrl()).isEqualTo("https://id.test/token");
        assertThat(props.getConnectTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(props.getRequestTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.getTransport()).isEqualTo("restclient");
        assertThat(props.isAuthorizeOnStartup()).isFalse();
        assertThat(props.getCache().isRedis()).isTrue();
        assertThat(props.getCache().getRedisUrl()).isEqualTo("redis://cache:6379");
        assertThat(props.getCache().getKey()).isEqualTo("bot:token");
        assertThat(props.getCache().getSafetyMargin()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void transportIsNormalized() {
        assertThat(props(true, null, null, "  WebClient ", null).getTransport()).isEqualTo("webclient");
    }

    // --- Cache ---

    @Test
    void cacheTypeDefaultsToRedisWhenUrlSet() {
        TwitchApiProperties.Cache cache = new TwitchApiProperties.Cache(null, "redis://localhost:6379", null, null);
        assertThat(cache.getType()).isEqualTo("redis");
    }

    @Test
    void explicitMemoryTypeWinsOverUrl() {
        TwitchApiProperties.Cache cache = new TwitchApiProperties.Cache("MEMORY", "redis://localhost:6379", null, null);
        assertThat(cache.isRedis()).isFalse();
    }

    // --- Validation ---

    @Test
    void credentialsMustBeSetTogether() {
        assertThat(props(true, "id", null, null, null).isCredentialsValid()).isFalse();
        assertThat(props(true, null, "secret", null, null).isCredentialsValid()).isFalse();
        assertThat(props(true, "id", "secret", null, null).isCredentialsValid()).isTrue();
        assertThat(props(true, null, null, null, null).isCredentialsValid()).isTrue();
        assertThat(props(false, "id", null, null, null).isCredentialsValid()).isTrue();
    }

    @Test
    void unknownTransportIsInvalid() {
        assertThat(props(true, null, null, "okhttp", null).isTransportValid()).isFalse();
        assertThat(props(true, null, null, "restclient", null).isTransportValid()).isTrue();
        assertThat(props(true, null, null, "webclient", null).isTransportValid()).isTrue();
    }

    @Test
    void unknownCacheTypeIsInvalid() {
        TwitchApiProperties.Cache cache = new TwitchApiProperties.Cache("memcached", null, null, null);
        assertThat(props(true, null, null, null, cache).isCacheTypeValid()).isFalse();
    }

    @Test
    void redisTypeRequiresUrl() {
        TwitchApiProperties.Cache cache = new TwitchApiProperties.Cache("redis", null, null, null);
        assertThat(props(true, null, null, null, cache).isRedisUrlValid()).isFalse();
        assertThat(props(false, null, null, null, cache).isRedisUrlValid()).isTrue();
    }

    @Test
    void negativeSafetyMarginIsInvalid() {
        TwitchApiProperties.Cache cache = new TwitchApiProperties.Cache(null, null, null, Duration.ofSeconds(-1));
        assertThat(props(true, null, null, null, cache).isSafetyMarginValid()).isFalse();
    }
}
