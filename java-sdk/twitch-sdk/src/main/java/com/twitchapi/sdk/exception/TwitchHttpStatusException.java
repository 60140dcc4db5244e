package com.twitchapi.sdk.exception;

/**
 * Thrown when the Helix API answers with a status outside 2xx/3xx.
 */
public class TwitchHttpStatusException extends TwitchApiException {

    private final String method;
    private final String url;
    private final String responseBody;

    public TwitchHttpStatusException(int statusCode, String method, String url, String responseBody, String errorCode) {
        super("API error: " + statusCode + " for " + method + " " + url + " - " + responseBody, statusCode, errorCode);
        this.method = method;
        this.url = url;
        this.responseBody = responseBody;
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
