package com.twitchapi.sdk.autoconfigure.transport;

import com.twitchapi.sdk.client.transport.TwitchRequest;
import com.twitchapi.sdk.client.transport.TwitchResponse;
import com.twitchapi.sdk.client.transport.TwitchTransport;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link TwitchTransport} backed by Spring's {@link RestClient}. Error statuses are returned as
 * responses so the client can raise its own status exception.
 */
public final class RestClientTransport implements TwitchTransport {
    private final RestClient restClient;
    private final Executor asyncExecutor;

    public RestClientTransport(RestClient restClient, Executor asyncExecutor) {
        this.restClient = restClient;
        this.asyncExecutor = asyncExecutor;
    }

    @Override
    public TwitchResponse send(TwitchRequest request) {
        Instant start = Instant.now();
        try {
            RestClient.RequestBodySpec spec = restClient.method(HttpMethod.valueOf(request.getMethod()))
                    .uri(request.getUri());
            request.getHeaders().forEach(spec::header);
            if (request.getBody() != null) {
                spec.body(request.getBody());
            }
            ResponseEntity<String> response = spec.retrieve().toEntity(String.class);
            return new TwitchResponse(
                    response.getStatusCode().value(),
                    response.getBody(),
                    copyHeaders(response.getHeaders()),
                    Duration.between(start, Instant.now()));
        } catch (RestClientResponseException ex) {
            return new TwitchResponse(
                    ex.getStatusCode().value(),
                    ex.getResponseBodyAsString(),
                    ex.getResponseHeaders() != null ? copyHeaders(ex.getResponseHeaders()) : Map.of(),
                    Duration.between(start, Instant.now()));
        }
    }

    @Override
    public CompletableFuture<TwitchResponse> sendAsync(TwitchRequest request) {
        if (asyncExecutor != null) {
            return CompletableFuture.supplyAsync(() -> send(request), asyncExecutor);
        }
        return CompletableFuture.supplyAsync(() -> send(request));
    }

    private static Map<String, List<String>> copyHeaders(Map<String, List<String>> headers) {
        return Map.copyOf(headers);
    }
}
