package com.twitchapi.sdk.exception;

/**
 * Thrown when a request could not reach the token endpoint or the Helix API
 * (connection refused, DNS failure, timeout, interruption).
 */
public class TwitchTransportException extends TwitchApiException {

    public TwitchTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
