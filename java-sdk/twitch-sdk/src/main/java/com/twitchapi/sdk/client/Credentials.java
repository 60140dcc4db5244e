package com.twitchapi.sdk.client;

import java.util.function.Function;

/**
 * Application credentials used for the client-credentials grant and the {@code Client-ID} header.
 *
 * @param clientId     Twitch application client id
 * @param clientSecret Twitch application client secret
 */
public record Credentials(String clientId, String clientSecret) {

    public static final String CLIENT_ID_VARIABLE = "TWITCH_CLIENT_ID";
    public static final String CLIENT_SECRET_VARIABLE = "TWITCH_CLIENT_SECRET";

    public Credentials {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId cannot be null or blank");
        }
        if (clientSecret == null || clientSecret.isBlank()) {
            throw new IllegalArgumentException("clientSecret cannot be null or blank");
        }
    }

    /**
     * Read credentials from {@code TWITCH_CLIENT_ID} and {@code TWITCH_CLIENT_SECRET}
     *
     * @throws IllegalStateException if either variable is missing or blank
     */
    public static Credentials fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static Credentials fromEnvironment(Function<String, String> environment) {
        String clientId = environment.apply(CLIENT_ID_VARIABLE);
        String clientSecret = environment.apply(CLIENT_SECRET_VARIABLE);
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalStateException(CLIENT_ID_VARIABLE + " is not set");
        }
        if (clientSecret == null || clientSecret.isBlank()) {
            throw new IllegalStateException(CLIENT_SECRET_VARIABLE + " is not set");
        }
        return new Credentials(clientId, clientSecret);
    }

    @Override
    public String toString() {
        return "Credentials[clientId=" + clientId + ", clientSecret=****]";
    }
}
