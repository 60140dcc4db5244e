package com.twitchapi.sdk.exception;

/**
 * Thrown when a response body does not have the structure a typed call expects.
 */
public class TwitchParseException extends TwitchApiException {

    public TwitchParseException(String message) {
        super(message);
    }

    public TwitchParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
