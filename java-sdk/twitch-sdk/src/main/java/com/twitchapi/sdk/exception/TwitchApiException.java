package com.twitchapi.sdk.exception;

/**
 * Base exception for Twitch SDK errors
 */
public class TwitchApiException extends RuntimeException {

    private final int statusCode;
    private final String errorCode;

    public TwitchApiException(String message) {
        super(message);
        this.statusCode = 0;
        this.errorCode = null;
    }

    public TwitchApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.errorCode = null;
    }

    public TwitchApiException(String message, int statusCode, String errorCode) {
        super(message);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    /**
     * HTTP status associated with the failure, or 0 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
