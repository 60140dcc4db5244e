package com.twitchapi.sdk.client;

import com.twitchapi.sdk.cache.TokenCache;
import com.twitchapi.sdk.client.transport.JdkHttpTransport;
import com.twitchapi.sdk.client.transport.TwitchRequest;
import com.twitchapi.sdk.client.transport.TwitchResponse;
import com.twitchapi.sdk.client.transport.TwitchTransport;
import com.twitchapi.sdk.exception.TwitchApiException;
import com.twitchapi.sdk.exception.TwitchHttpStatusException;
import com.twitchapi.sdk.exception.TwitchParseException;
import com.twitchapi.sdk.exception.TwitchTransportException;
import com.twitchapi.sdk.model.Channel;
import com.twitchapi.sdk.model.Game;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Twitch Helix API Client - Main entry point for the SDK
 *
 * <p>Every request first asks the {@link TokenManager} for a valid app access token and then
 * carries the {@code Client-ID} and {@code Authorization: Bearer} headers. Responses outside
 * 2xx/3xx raise {@link TwitchHttpStatusException}; network failures raise
 * {@link TwitchTransportException}. No retries are performed, and 429 responses are reported
 * like any other status.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * TwitchApiClient client = TwitchApiClient.builder()
 *     .credentials(Credentials.fromEnvironment())
 *     .tokenCache(RedisTokenCache.create("redis://localhost:6379"))
 *     .build();
 *
 * client.authorize();
 * List<Channel> channels = client.fetchChannels(List.of("141981764"));
 * }</pre>
 *
 * <p>One instance is meant to be shared by all callers of a process and closed on shutdown.</p>
 */
public class TwitchApiClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TwitchApiClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.twitch.tv/helix/";

    private final String baseUrl;
    private final Credentials credentials;
    private final TokenManager tokenManager;
    private final TwitchTransport transport;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final AtomicBoolean closed = new AtomicBoolean();

    private TwitchApiClient(Builder builder) {
        this.baseUrl = builder.baseUrl.endsWith("/") ? builder.baseUrl : builder.baseUrl + "/";
        this.credentials = builder.credentials;

        if (builder.transport != null) {
            this.transport = builder.transport;
        } else if (builder.httpClient != null) {
            this.transport = new JdkHttpTransport(builder.httpClient);
        } else {
            this.transport = JdkHttpTransport.create(builder.connectTimeout);
        }

        this.objectMapper = builder.objectMapper != null
                ? builder.objectMapper
                : new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        this.requestTimeout = builder.requestTimeout;

        this.tokenManager = TokenManager.builder()
                .credentials(builder.credentials)
                .tokenCache(builder.tokenCache)
                .transport(this.transport)
                .objectMapper(this.objectMapper)
                .clock(builder.clock)
                .tokenUrl(builder.tokenUrl)
                .cacheKey(builder.cacheKey)
                .safetyMargin(builder.safetyMargin)
                .requestTimeout(builder.requestTimeout)
                .build();
    }

    /**
     * Create a new builder for TwitchApiClient
     */
    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Authorization
    // ========================================================================

    /**
     * Load or generate the access token; call once at startup
     *
     * @see TokenManager#authorize()
     */
    public TokenRefreshResult authorize() {
        return tokenManager.authorize();
    }

    public TokenManager getTokenManager() {
        return tokenManager;
    }

    // ========================================================================
    // Typed Operations
    // ========================================================================

    /**
     * Get channel information for broadcasters
     *
     * @param broadcasterIds non-empty list of broadcaster ids
     * @return channels in the order the API returned them
     * @throws TwitchParseException if the response has no {@code data} array
     */
    public List<Channel> fetchChannels(List<String> broadcasterIds) {
        requireIds(broadcasterIds, "broadcasterIds");
        log.debug("Fetching {} channels from API. {}", broadcasterIds.size(), broadcasterIds);
        TwitchResponse response = get("channels", Map.of("broadcaster_id", broadcasterIds));
        return parseData(response, Channel.class);
    }

    public CompletableFuture<List<Channel>> fetchChannelsAsync(List<String> broadcasterIds) {
        requireIds(broadcasterIds, "broadcasterIds");
        return getAsync("channels", Map.of("broadcaster_id", broadcasterIds))
                .thenApply(response -> parseData(response, Channel.class));
    }

    /**
     * Get games (categories) by id
     *
     * @param gameIds non-empty list of game ids
     * @return games in the order the API returned them
     */
    public List<Game> fetchGames(List<String> gameIds) {
        requireIds(gameIds, "gameIds");
        log.debug("Fetching {} games from API. {}", gameIds.size(), gameIds);
        TwitchResponse response = get("games", Map.of("id", gameIds));
        return parseData(response, Game.class);
    }

    public CompletableFuture<List<Game>> fetchGamesAsync(List<String> gameIds) {
        requireIds(gameIds, "gameIds");
        return getAsync("games", Map.of("id", gameIds))
                .thenApply(response -> parseData(response, Game.class));
    }

    // ========================================================================
    // HTTP Methods
    // ========================================================================

    public TwitchResponse get(String path) {
        return get(path, null);
    }

    /**
     * Make an authenticated GET request
     *
     * @param path   path relative to the base URL
     * @param params query parameters; {@link Iterable} values become repeated parameters
     */
    public TwitchResponse get(String path, Map<String, ?> params) {
        return execute("GET", path, params, null);
    }

    public TwitchResponse post(String path, Object body) {
        return post(path, body, null);
    }

    /**
     * Make an authenticated POST request
     *
     * @param body JSON body; a {@link String} is sent as-is, other objects are serialized. May be null.
     */
    public TwitchResponse post(String path, Object body, Map<String, ?> params) {
        return execute("POST", path, params, body);
    }

    public TwitchResponse delete(String path) {
        return delete(path, null);
    }

    public TwitchResponse delete(String path, Map<String, ?> params) {
        return execute("DELETE", path, params, null);
    }

    /**
     * Asynchronous GET. A token refresh that has to happen first runs through the transport's
     * asynchronous path as well, so the calling thread is never blocked.
     */
    public CompletableFuture<TwitchResponse> getAsync(String path, Map<String, ?> params) {
        return executeAsync("GET", path, params, null);
    }

    public CompletableFuture<TwitchResponse> postAsync(String path, Object body, Map<String, ?> params) {
        return executeAsync("POST", path, params, body);
    }

    public CompletableFuture<TwitchResponse> deleteAsync(String path, Map<String, ?> params) {
        return executeAsync("DELETE", path, params, null);
    }

    private TwitchResponse execute(String method, String path, Map<String, ?> params, Object body) {
        tokenManager.ensureValid();
        TwitchRequest request = buildRequest(method, path, params, body);
        logRequest(request);

        TwitchResponse response;
        try {
            response = transport.send(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Request to {} interrupted", request.getUri(), e);
            throw new TwitchTransportException(method + " request to " + request.getUri() + " interrupted", e);
        } catch (Exception e) {
            throw transportFailure(request, e);
        }

        logResponse(request, response);
        return checkStatus(request, response);
    }

    private CompletableFuture<TwitchResponse> executeAsync(String method, String path, Map<String, ?> params, Object body) {
        return tokenManager.ensureValidAsync()
                .thenCompose(refresh -> sendAsync(buildRequest(method, path, params, body)));
    }

    private CompletableFuture<TwitchResponse> sendAsync(TwitchRequest request) {
        logRequest(request);
        CompletableFuture<TwitchResponse> pending;
        try {
            pending = transport.sendAsync(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(transportFailure(request, e));
        }

        return pending.handle((response, ex) -> {
            if (ex != null) {
                throw transportFailure(request, unwrapCompletionException(ex));
            }
            logResponse(request, response);
            return checkStatus(request, response);
        });
    }

    private TwitchRequest buildRequest(String method, String path, Map<String, ?> params, Object body) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Client-ID", credentials.clientId());
        tokenManager.currentToken().ifPresent(token -> headers.put("Authorization", "Bearer " + token));

        String json = body != null ? toJson(body) : null;
        if (json != null && json.isEmpty()) {
            json = null;
        }
        if (json != null) {
            headers.put("Content-Type", "application/json");
        }

        return new TwitchRequest(URI.create(buildUrl(path, params)), method, json, headers, requestTimeout);
    }

    private TwitchResponse checkStatus(TwitchRequest request, TwitchResponse response) {
        if (response.isSuccess()) {
            return response;
        }
        log.warn("{} request to {} returned status {}", request.getMethod(), request.getUri(), response.getStatusCode());
        throw new TwitchHttpStatusException(
                response.getStatusCode(),
                request.getMethod(),
                request.getUri().toString(),
                response.getBody(),
                extractErrorCode(response.getBody()));
    }

    private TwitchTransportException transportFailure(TwitchRequest request, Throwable cause) {
        if (cause instanceof TwitchTransportException transportException) {
            return transportException;
        }
        log.error("{} request to {} failed", request.getMethod(), request.getUri(), cause);
        return new TwitchTransportException(
                request.getMethod() + " request to " + request.getUri() + " failed: " + cause.getMessage(), cause);
    }

    private Throwable unwrapCompletionException(Throwable ex) {
        if (ex instanceof CompletionException && ex.getCause() != null) {
            return ex.getCause();
        }
        return ex;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private String buildUrl(String path, Map<String, ?> params) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        StringBuilder url = new StringBuilder(baseUrl).append(relative);

        if (params != null && !params.isEmpty()) {
            List<String> pairs = new ArrayList<>();
            params.forEach((key, value) -> {
                if (value instanceof Iterable<?> values) {
                    for (Object item : values) {
                        if (item != null) {
                            pairs.add(encode(key) + "=" + encode(String.valueOf(item)));
                        }
                    }
                } else if (value != null) {
                    pairs.add(encode(key) + "=" + encode(String.valueOf(value)));
                }
            });
            if (!pairs.isEmpty()) {
                url.append(relative.contains("?") ? "&" : "?").append(String.join("&", pairs));
            }
        }

        return url.toString();
    }

    private String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private String toJson(Object body) {
        if (body instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new TwitchApiException("Failed to serialize request body: " + e.getOriginalMessage(), e);
        }
    }

    private <T> List<T> parseData(TwitchResponse response, Class<T> type) {
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            throw new TwitchParseException("Response body is empty, expected a data array");
        }

        JsonNode data;
        try {
            data = objectMapper.readTree(body).path("data");
        } catch (JsonProcessingException e) {
            throw new TwitchParseException("Response body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!data.isArray()) {
            throw new TwitchParseException("Response body has no data array");
        }

        List<T> records = new ArrayList<>(data.size());
        for (JsonNode node : data) {
            try {
                records.add(objectMapper.treeToValue(node, type));
            } catch (JsonProcessingException e) {
                throw new TwitchParseException("Failed to parse " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
            }
        }
        return Collections.unmodifiableList(records);
    }

    private String extractErrorCode(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(responseBody);
            if (node.hasNonNull("error")) {
                return node.get("error").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error response body is not JSON: {}", e.getOriginalMessage());
        }
        return null;
    }

    private static void requireIds(List<String> ids, String name) {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }

    private void logRequest(TwitchRequest request) {
        if (log.isDebugEnabled()) {
            log.debug("Making {} request to {}\nHeaders: {}\nBody: {}",
                    request.getMethod(), request.getUri(), maskHeaders(request.getHeaders()), request.getBody());
        }
    }

    private void logResponse(TwitchRequest request, TwitchResponse response) {
        if (log.isDebugEnabled()) {
            log.debug("{} request to {} returned {} in {} ms.\nHeaders: {}\nBody: {}",
                    request.getMethod(), request.getUri(), response.getStatusCode(),
                    response.getElapsed().toMillis(), response.getHeaders(), response.getBody());
        }
    }

    private static Map<String, String> maskHeaders(Map<String, String> headers) {
        Map<String, String> masked = new LinkedHashMap<>(headers);
        masked.computeIfPresent("Authorization", (name, value) -> "Bearer ****");
        return masked;
    }

    /**
     * Close the underlying transport. Calling this more than once has no further effect.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Shutting down Twitch API client");
            transport.close();
        }
    }

    // ========================================================================
    // Builder
    // ========================================================================

    /**
     * Builder for TwitchApiClient
     */
    public static class Builder {
        private Credentials credentials;
        private TokenCache tokenCache;
        private String baseUrl = DEFAULT_BASE_URL;
        private String tokenUrl = TokenManager.DEFAULT_TOKEN_URL;
        private String cacheKey = TokenManager.DEFAULT_CACHE_KEY;
        private Duration safetyMargin = TokenManager.DEFAULT_SAFETY_MARGIN;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private ObjectMapper objectMapper;
        private HttpClient httpClient;
        private TwitchTransport transport;
        private Clock clock = Clock.systemUTC();

        /**
         * Client id and secret (required)
         *
         * @see Credentials#fromEnvironment()
         */
        public Builder credentials(Credentials credentials) {
            this.credentials = credentials;
            return this;
        }

        /**
         * Shared token cache, typically a {@link com.twitchapi.sdk.cache.RedisTokenCache}
         * (default: process-local in-memory cache)
         */
        public Builder tokenCache(TokenCache tokenCache) {
            this.tokenCache = tokenCache;
            return this;
        }

        /**
         * Helix API base URL (default: {@value TwitchApiClient#DEFAULT_BASE_URL})
         */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        /**
         * OAuth token endpoint (default: {@value TokenManager#DEFAULT_TOKEN_URL})
         */
        public Builder tokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
            return this;
        }

        /**
         * Key the token is shared under (default: {@value TokenManager#DEFAULT_CACHE_KEY})
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
         * Set the connection timeout (default: 10 seconds)
         */
        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        /**
         * Set the per-request timeout (default: 30 seconds)
         */
        public Builder requestTimeout(Duration timeout) {
            this.requestTimeout = timeout;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Provide a pre-configured HttpClient (connectTimeout will be ignored if set)
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        /**
         * Provide a custom transport (overrides any HttpClient settings)
         */
        public Builder transport(TwitchTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Build the TwitchApiClient
         *
         * @throws IllegalStateException if credentials or baseUrl are missing
         */
        public TwitchApiClient build() {
            if (credentials == null) {
                throw new IllegalStateException("credentials are required");
            }
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalStateException("baseUrl is required");
            }
            return new TwitchApiClient(this);
        }
    }
}
