package com.twitchapi.sdk.client;

/**
 * Outcome of a {@link TokenManager} operation.
 *
 * <p>Auth-provider errors are reported here instead of being thrown, so a caller can decide
 * how to react to repeated failures while requests keep flowing with the previous token.</p>
 */
public final class TokenRefreshResult {

    public enum Outcome {
        /** Held token is still valid; nothing was requested */
        REUSED,
        /** Token adopted from the shared cache */
        CACHE_HIT,
        /** New token issued by the token endpoint */
        REFRESHED,
        /** Token endpoint answered without a token; previous state kept */
        PROVIDER_ERROR
    }

    private static final TokenRefreshResult REUSED = new TokenRefreshResult(Outcome.REUSED, 0, null);
    private static final TokenRefreshResult CACHE_HIT = new TokenRefreshResult(Outcome.CACHE_HIT, 0, null);

    private final Outcome outcome;
    private final int statusCode;
    private final String message;

    private TokenRefreshResult(Outcome outcome, int statusCode, String message) {
        this.outcome = outcome;
        this.statusCode = statusCode;
        this.message = message;
    }

    public static TokenRefreshResult reused() {
        return REUSED;
    }

    public static TokenRefreshResult cacheHit() {
        return CACHE_HIT;
    }

    public static TokenRefreshResult refreshed(int statusCode) {
        return new TokenRefreshResult(Outcome.REFRESHED, statusCode, null);
    }

    public static TokenRefreshResult providerError(int statusCode, String message) {
        return new TokenRefreshResult(Outcome.PROVIDER_ERROR, statusCode, message);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    /**
     * Status code of the token endpoint response, or 0 when no request was made
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Error message reported by the token endpoint, for {@link Outcome#PROVIDER_ERROR}
     */
    public String getMessage() {
        return message;
    }

    public boolean isProviderError() {
        return outcome == Outcome.PROVIDER_ERROR;
    }

    @Override
    public String toString() {
        return "TokenRefreshResult[" + outcome
                + (statusCode != 0 ? ", status=" + statusCode : "")
                + (message != null ? ", message=" + message : "") + "]";
    }
}
