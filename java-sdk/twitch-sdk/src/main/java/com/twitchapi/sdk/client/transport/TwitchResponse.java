package com.twitchapi.sdk.client.transport;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Raw HTTP response returned by the verb methods of {@code TwitchApiClient}.
 */
public final class TwitchResponse {
    private final int statusCode;
    private final String body;
    private final Map<String, List<String>> headers;
    private final Duration elapsed;

    public TwitchResponse(int statusCode, String body) {
        this(statusCode, body, Map.of(), Duration.ZERO);
    }

    public TwitchResponse(int statusCode, String body, Map<String, List<String>> headers, Duration elapsed) {
        this.statusCode = statusCode;
        this.body = body;
        this.headers = headers != null ? headers : Map.of();
        this.elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    /**
     * First value of a response header, matched case-insensitively
     */
    public String getHeader(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)
                    && entry.getValue() != null && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 400;
    }
}
