package com.twitchapi.sdk.autoconfigure.transport;

import com.twitchapi.sdk.client.transport.TwitchRequest;
import com.twitchapi.sdk.client.transport.TwitchResponse;
import com.twitchapi.sdk.client.transport.TwitchTransport;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

public final class WebClientTransport implements TwitchTransport {
    private final WebClient webClient;

    public WebClientTransport(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public TwitchResponse send(TwitchRequest request) {
        try {
            return sendAsync(request).join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        }
    }

    @Override
    public CompletableFuture<TwitchResponse> sendAsync(TwitchRequest request) {
        WebClient.RequestBodySpec spec = webClient.method(HttpMethod.valueOf(request.getMethod()))
                .uri(request.getUri());
        request.getHeaders().forEach(spec::header);

        WebClient.RequestHeadersSpec<?> headersSpec = request.getBody() != null
                ? spec.bodyValue(request.getBody())
                : spec;

        Instant start = Instant.now();
        Mono<TwitchResponse> exchange = headersSpec
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new TwitchResponse(
                                response.statusCode().value(),
                                body,
                                Map.copyOf(response.headers().asHttpHeaders()),
                                Duration.between(start, Instant.now()))));

        if (request.getTimeout() != null) {
            exchange = exchange.timeout(request.getTimeout());
        }
        return exchange.toFuture();
    }
}
