package com.twitchapi.sdk.client.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public final class JdkHttpTransport implements TwitchTransport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final HttpClient httpClient;
    private final ExecutorService ownedExecutor;

    public JdkHttpTransport(HttpClient httpClient) {
        this(httpClient, null);
    }

    private JdkHttpTransport(HttpClient httpClient, ExecutorService ownedExecutor) {
        this.httpClient = httpClient;
        this.ownedExecutor = ownedExecutor;
    }

    /**
     * Create a transport backed by its own {@link HttpClient} and executor; both are released by {@link #close()}
     */
    public static JdkHttpTransport create(Duration connectTimeout) {
        ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "twitch-http");
            thread.setDaemon(true);
            return thread;
        });
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .executor(executor)
                .build();
        return new JdkHttpTransport(httpClient, executor);
    }

    @Override
    public TwitchResponse send(TwitchRequest request) throws Exception {
        HttpRequest httpRequest = buildRequest(request);
        Instant start = Instant.now();
        HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        return toResponse(response, start);
    }

    @Override
    public CompletableFuture<TwitchResponse> sendAsync(TwitchRequest request) {
        HttpRequest httpRequest = buildRequest(request);
        Instant start = Instant.now();
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> toResponse(response, start));
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            log.debug("JdkHttpTransport executor shut down");
        }
    }

    private TwitchResponse toResponse(HttpResponse<String> response, Instant start) {
        return new TwitchResponse(
                response.statusCode(),
                response.body(),
                response.headers().map(),
                Duration.between(start, Instant.now()));
    }

    private HttpRequest buildRequest(TwitchRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.getUri());

        if (request.getTimeout() != null) {
            builder.timeout(request.getTimeout());
        }

        request.getHeaders().forEach(builder::header);

        String method = request.getMethod();
        String body = request.getBody();
        if ("POST".equals(method)) {
            builder.POST(body != null
                    ? HttpRequest.BodyPublishers.ofString(body)
                    : HttpRequest.BodyPublishers.noBody());
        } else if ("DELETE".equals(method)) {
            builder.DELETE();
        } else {
            builder.GET();
        }

        return builder.build();
    }
}
