package com.twitchapi.sdk.client;

import com.twitchapi.sdk.cache.InMemoryTokenCache;
import com.twitchapi.sdk.cache.TokenCache;
import com.twitchapi.sdk.client.transport.TwitchRequest;
import com.twitchapi.sdk.client.transport.TwitchResponse;
import com.twitchapi.sdk.client.transport.TwitchTransport;
import com.twitchapi.sdk.exception.TwitchTransportException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the Twitch app access token for one client instance.
 *
 * <p>Tokens are obtained with the OAuth client credentials grant and shared with other
 * processes through a {@link TokenCache}. The cache is consulted only by {@link #authorize()};
 * afterwards the manager trusts its own clock-based expiry and goes straight to the token
 * endpoint when the token runs out.</p>
 *
 * <h2>Failure policy:</h2>
 * <ul>
 *   <li>Transport failures reaching the token endpoint are logged and thrown as
 *       {@link TwitchTransportException}.</li>
 *   <li>A token endpoint response without an access token is logged and reported as
 *       {@link TokenRefreshResult.Outcome#PROVIDER_ERROR}. It is never thrown and leaves the
 *       previously held token in place.</li>
 * </ul>
 *
 * <h2>Thread Safety:</h2>
 * <p>Refreshes are serialized. Concurrent callers that find the token expired share a single
 * token endpoint call: blocking callers through a lock, asynchronous callers through one
 * pending future.</p>
 */
public class TokenManager {

    private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

    public static final String DEFAULT_TOKEN_URL = "https://id.twitch.tv/oauth2/token";
    public static final String DEFAULT_CACHE_KEY = "twitch:access_token";
    public static final Duration DEFAULT_SAFETY_MARGIN = Duration.ofSeconds(5);

    private final Credentials credentials;
    private final TokenCache tokenCache;
    private final TwitchTransport transport;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String tokenUrl;
    private final String cacheKey;
    private final Duration safetyMargin;
    private final Duration requestTimeout;

    private volatile TokenState state = TokenState.unset();
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicInteger consecutiveProviderErrors = new AtomicInteger();
    private final AtomicReference<CompletableFuture<TokenRefreshResult>> inFlightRefresh = new AtomicReference<>();

    private TokenManager(Builder builder) {
        this.credentials = builder.credentials;
        this.tokenCache = builder.tokenCache != null ? builder.tokenCache : new InMemoryTokenCache(builder.clock);
        this.transport = builder.transport;
        this.objectMapper = builder.objectMapper != null
                ? builder.objectMapper
                : new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.clock = builder.clock;
        this.tokenUrl = builder.tokenUrl;
        this.cacheKey = builder.cacheKey;
        this.safetyMargin = builder.safetyMargin;
        this.requestTimeout = builder.requestTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Token lifecycle
    // ========================================================================

    /**
     * Load the token at startup, preferring one another process already stored in the shared cache
     *
     * <p>A cached token is adopted with an expiry of its remaining TTL minus the safety margin.
     * If the cache cannot report a TTL the token is kept but marked for refresh on the next
     * {@link #ensureValid()}. Without a cached token a new one is generated.</p>
     *
     * @throws TwitchTransportException if the token endpoint cannot be reached
     */
    public TokenRefreshResult authorize() {
        log.info("Authorizing Twitch API");

        refreshLock.lock();
        try {
            Optional<String> cached = tokenCache.get(cacheKey).filter(value -> !value.isBlank());
            if (cached.isEmpty()) {
                log.info("No cached access token found, generating new one");
                TokenRefreshResult result = fetchAndStore();
                log.info("Twitch API authorized");
                return result;
            }

            Optional<Duration> ttl = tokenCache.getTtl(cacheKey).filter(value -> !value.isZero());
            Instant expiresAt = ttl
                    .map(value -> clock.instant().plus(value).minus(safetyMargin))
                    .orElse(AccessToken.UNKNOWN_EXPIRY);
            if (ttl.isEmpty()) {
                log.debug("Cached access token has no TTL, it will be refreshed before first use");
            }
            state = TokenState.valid(new AccessToken(cached.get(), expiresAt));
            log.info("Twitch API authorized");
            return TokenRefreshResult.cacheHit();
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Request a new token from the token endpoint and publish it to the shared cache
     *
     * @return {@code REFRESHED}, or {@code PROVIDER_ERROR} if the endpoint did not issue a token
     * @throws TwitchTransportException if the token endpoint cannot be reached
     */
    public TokenRefreshResult generateToken() {
        refreshLock.lock();
        try {
            return fetchAndStore();
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Make sure a usable token is held, generating one if it is missing, of unknown lifetime or expired
     *
     * @throws TwitchTransportException if a refresh was needed and the token endpoint cannot be reached
     */
    public TokenRefreshResult ensureValid() {
        // Fast path without the lock
        if (!state.needsRefresh(clock.instant())) {
            return TokenRefreshResult.reused();
        }

        refreshLock.lock();
        try {
            TokenState current = state;
            if (!current.needsRefresh(clock.instant())) {
                log.debug("Twitch access token refreshed by a concurrent caller");
                return TokenRefreshResult.reused();
            }
            log.debug(current.isSet() ? "Twitch access token expired" : "Twitch access token is not set");
            return fetchAndStore();
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Non-blocking variant of {@link #ensureValid()}
     *
     * <p>The token request goes through {@link TwitchTransport#sendAsync}. Concurrent callers
     * that find the token expired share the same pending refresh.</p>
     *
     * @return a future failing with {@link TwitchTransportException} if the token endpoint cannot be reached
     */
    public CompletableFuture<TokenRefreshResult> ensureValidAsync() {
        if (!state.needsRefresh(clock.instant())) {
            return CompletableFuture.completedFuture(TokenRefreshResult.reused());
        }

        CompletableFuture<TokenRefreshResult> refresh = new CompletableFuture<>();
        CompletableFuture<TokenRefreshResult> pending = inFlightRefresh.compareAndExchange(null, refresh);
        if (pending != null) {
            log.debug("Joining Twitch access token refresh already in flight");
            return pending;
        }

        if (!state.needsRefresh(clock.instant())) {
            inFlightRefresh.set(null);
            refresh.complete(TokenRefreshResult.reused());
            return refresh;
        }

        fetchAndStoreAsync().whenComplete((result, ex) -> {
            // Cleared before completing so callbacks that refresh again start a new request
            inFlightRefresh.set(null);
            if (ex != null) {
                refresh.completeExceptionally(unwrap(ex));
            } else {
                refresh.complete(result);
            }
        });
        return refresh;
    }

    /**
     * Token value currently held, if any. It may be expired when the last refresh failed.
     */
    public Optional<String> currentToken() {
        return state.getToken().map(AccessToken::value);
    }

    public TokenState getState() {
        return state;
    }

    /**
     * Number of provider errors since the last successful token generation
     */
    public int getConsecutiveProviderErrors() {
        return consecutiveProviderErrors.get();
    }

    // ========================================================================
    // Token Fetching
    // ========================================================================

    private TokenRefreshResult fetchAndStore() {
        log.info("Generating new Twitch access token");

        TwitchResponse response;
        try {
            response = transport.send(buildTokenRequest());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Twitch access token request interrupted", e);
            throw new TwitchTransportException("Access token request interrupted", e);
        } catch (Exception e) {
            throw tokenRequestFailure(e);
        }
        return applyTokenResponse(response);
    }

    private CompletableFuture<TokenRefreshResult> fetchAndStoreAsync() {
        log.info("Generating new Twitch access token");

        CompletableFuture<TwitchResponse> pending;
        try {
            pending = transport.sendAsync(buildTokenRequest());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(tokenRequestFailure(e));
        }
        return pending.handle((response, ex) -> {
            if (ex != null) {
                throw tokenRequestFailure(unwrap(ex));
            }
            return applyTokenResponse(response);
        });
    }

    private TokenRefreshResult applyTokenResponse(TwitchResponse response) {
        TokenResponse tokenResponse = parse(response);
        if (tokenResponse != null
                && tokenResponse.accessToken != null
                && !tokenResponse.accessToken.isBlank()
                && tokenResponse.expiresIn != null
                && tokenResponse.expiresIn > 0) {
            Duration lifetime = Duration.ofSeconds(tokenResponse.expiresIn);
            state = TokenState.valid(new AccessToken(tokenResponse.accessToken, clock.instant().plus(lifetime)));
            tokenCache.set(cacheKey, tokenResponse.accessToken, lifetime);
            consecutiveProviderErrors.set(0);
            log.info("New Twitch access token generated, expires in {} seconds", tokenResponse.expiresIn);
            return TokenRefreshResult.refreshed(response.getStatusCode());
        }

        String message;
        if (tokenResponse != null && tokenResponse.message != null) {
            message = tokenResponse.message;
        } else if (tokenResponse != null && tokenResponse.accessToken != null
                && !tokenResponse.accessToken.isBlank() && tokenResponse.expiresIn != null) {
            message = "token response has non-positive expires_in: " + tokenResponse.expiresIn;
        } else {
            message = "token response missing access_token";
        }
        int failures = consecutiveProviderErrors.incrementAndGet();
        log.error("Twitch access token request failed. status={} message={} consecutiveFailures={}",
                response.getStatusCode(), message, failures);
        log.debug("Access token request to {} failed. Status code: {}, Headers: {}, Body: {}",
                tokenUrl, response.getStatusCode(), response.getHeaders(), response.getBody());
        return TokenRefreshResult.providerError(response.getStatusCode(), message);
    }

    private TwitchTransportException tokenRequestFailure(Throwable cause) {
        if (cause instanceof TwitchTransportException transportException) {
            return transportException;
        }
        log.error("Twitch access token request failed", cause);
        return new TwitchTransportException("Access token request to " + tokenUrl + " failed: " + cause.getMessage(), cause);
    }

    private static Throwable unwrap(Throwable ex) {
        if (ex instanceof CompletionException && ex.getCause() != null) {
            return ex.getCause();
        }
        return ex;
    }

    private TwitchRequest buildTokenRequest() {
        String query = "client_id=" + encode(credentials.clientId())
                + "&client_secret=" + encode(credentials.clientSecret())
                + "&grant_type=client_credentials";
        return new TwitchRequest(
                URI.create(tokenUrl + (tokenUrl.contains("?") ? "&" : "?") + query),
                "POST",
                null,
                Map.of("Accept", "application/json"),
                requestTimeout);
    }

    private TokenResponse parse(TwitchResponse response) {
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, TokenResponse.class);
        } catch (JsonProcessingException e) {
            log.debug("Token endpoint returned a body that is not a token response: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    // ========================================================================
    // Supporting Classes
    // ========================================================================

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class TokenResponse {
        @JsonProperty("access_token")
        String accessToken;

        @JsonProperty("expires_in")
        Long expiresIn;

        @JsonProperty("token_type")
        String tokenType;

        @JsonProperty("message")
        String message;
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private Credentials credentials;
        private TokenCache tokenCache;
        private TwitchTransport transport;
        private ObjectMapper objectMapper;
        private Clock clock = Clock.systemUTC();
        private String tokenUrl = DEFAULT_TOKEN_URL;
        private String cacheKey = DEFAULT_CACHE_KEY;
        private Duration safetyMargin = DEFAULT_SAFETY_MARGIN;
        private Duration requestTimeout = Duration.ofSeconds(30);

        /**
         * Client id and secret (required)
         */
        public Builder credentials(Credentials credentials) {
            this.credentials = credentials;
            return this;
        }

        /**
         * Shared cache for the issued token (default: process-local in-memory cache)
         */
        public Builder tokenCache(TokenCache tokenCache) {
            this.tokenCache = tokenCache;
            return this;
        }

        /**
         * Transport used to reach the token endpoint (required)
         */
        public Builder transport(TwitchTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * OAuth token endpoint (default: {@value #DEFAULT_TOKEN_URL})
         */
        public Builder tokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
            return this;
        }

        /**
         * Cache key the token is shared under (default: {@value #DEFAULT_CACHE_KEY})
         */
        public Builder cacheKey(String cacheKey) {
            this.cacheKey = cacheKey;
            return this;
        }

        /**
         * Amount subtracted from a cached token's TTL (default: 5 seconds)
         */
        public Builder safetyMargin(Duration safetyMargin) {
            this.safetyMargin = safetyMargin;
            return this;
        }

        /**
         * Per-request timeout for token requests (default: 30 seconds)
         */
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public TokenManager build() {
            if (credentials == null) {
                throw new IllegalStateException("credentials are required");
            }
            if (transport == null) {
                throw new IllegalStateException("transport is required");
            }
            if (tokenUrl == null || tokenUrl.isBlank()) {
                throw new IllegalStateException("tokenUrl is required");
            }
            if (cacheKey == null || cacheKey.isBlank()) {
                throw new IllegalStateException("cacheKey is required");
            }
            if (clock == null) {
                throw new IllegalStateException("clock is required");
            }
            if (safetyMargin == null || safetyMargin.isNegative()) {
                throw new IllegalStateException("safetyMargin must not be negative");
            }
            return new TokenManager(this);
        }
    }
}
