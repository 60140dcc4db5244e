package com.twitchapi.sdk.client.transport;

import java.util.concurrent.CompletableFuture;

public interface TwitchTransport extends AutoCloseable {
    TwitchResponse send(TwitchRequest request) throws Exception;

    CompletableFuture<TwitchResponse> sendAsync(TwitchRequest request);

    /**
     * Release pooled connections and threads held by this transport
     */
    @Override
    default void close() {
    }
}
