package com.twitchapi.sdk.autoconfigure;

import com.twitchapi.sdk.client.TokenManager;
import com.twitchapi.sdk.client.TwitchApiClient;
import jakarta.validation.constraints.AssertTrue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Locale;

@ConfigurationProperties(prefix = "twitch")
@Validated
public class TwitchApiProperties {

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final String DEFAULT_TRANSPORT = "jdk";

    private final boolean enabled;
    private final String clientId;
    private final String clientSecret;
    private final String baseUrl;
    private final String tokenUrl;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final String transport;
    private final boolean authorizeOnStartup;

    @NestedConfigurationProperty
    private final Cache cache;

    public TwitchApiProperties(
            Boolean enabled,
            String clientId,
            String clientSecret,
            String baseUrl,
            String tokenUrl,
            Duration connectTimeout,
            Duration requestTimeout,
            String transport,
            Boolean authorizeOnStartup,
            Cache cache) {
        this.enabled = enabled != null && enabled;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.baseUrl = hasText(baseUrl) ? baseUrl : TwitchApiClient.DEFAULT_BASE_URL;
        this.tokenUrl = hasText(tokenUrl) ? tokenUrl : TokenManager.DEFAULT_TOKEN_URL;
        this.connectTimeout = connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT;
        this.requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
        this.transport = hasText(transport) ? normalize(transport) : DEFAULT_TRANSPORT;
        this.authorizeOnStartup = authorizeOnStartup == null || authorizeOnStartup;
        this.cache = cache != null ? cache : new Cache(null, null, null, null);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    /**
     * True when both client id and secret are configured; otherwise credentials come from the environment
     */
    public boolean hasCredentials() {
        return hasText(clientId) && hasText(clientSecret);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public String getTransport() {
        return transport;
    }

    public boolean isAuthorizeOnStartup() {
        return authorizeOnStartup;
    }

    public Cache getCache() {
        return cache;
    }

    @AssertTrue(message = "twitch.client-id and twitch.client-secret must be set together")
    public boolean isCredentialsValid() {
        return !enabled || hasText(clientId) == hasText(clientSecret);
    }

    @AssertTrue(message = "twitch.transport must be one of: jdk, restclient, webclient")
    public boolean isTransportValid() {
        return transport.equals("jdk") || transport.equals("restclient") || transport.equals("webclient");
    }

    @AssertTrue(message = "twitch.cache.type must be one of: redis, memory")
    public boolean isCacheTypeValid() {
        return cache.type.equals(Cache.REDIS) || cache.type.equals(Cache.MEMORY);
    }

    @AssertTrue(message = "twitch.cache.redis-url is required when twitch.cache.type=redis")
    public boolean isRedisUrlValid() {
        return !enabled || !cache.isRedis() || hasText(cache.redisUrl);
    }

    @AssertTrue(message = "twitch.cache.safety-margin must not be negative")
    public boolean isSafetyMarginValid() {
        return !cache.safetyMargin.isNegative();
    }

    public static class Cache {
        static final String REDIS = "redis";
        static final String MEMORY = "memory";

        private final String type;
        private final String redisUrl;
        private final String key;
        private final Duration safetyMargin;

        public Cache(String type, String redisUrl, String key, Duration safetyMargin) {
            this.redisUrl = redisUrl;
            if (hasText(type)) {
                this.type = normalize(type);
            } else {
                this.type = hasText(redisUrl) ? REDIS : MEMORY;
            }
            this.key = hasText(key) ? key : TokenManager.DEFAULT_CACHE_KEY;
            this.safetyMargin = safetyMargin != null ? safetyMargin : TokenManager.DEFAULT_SAFETY_MARGIN;
        }

        public String getType() {
            return type;
        }

        public boolean isRedis() {
            return REDIS.equals(type);
        }

        public String getRedisUrl() {
            return redisUrl;
        }

        public String getKey() {
            return key;
        }

        public Duration getSafetyMargin() {
            return safetyMargin;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
