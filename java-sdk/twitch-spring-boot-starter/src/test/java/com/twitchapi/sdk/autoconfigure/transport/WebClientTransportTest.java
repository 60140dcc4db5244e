package com.twitchapi.sdk.autoconfigure.transport;

import com.twitchapi.sdk.client.transport.TwitchRequest;
import com.twitchapi.sdk.client.transport.TwitchResponse;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebClientTransportTest {

    private ExchangeFunction exchangeFunction;

    private WebClientTransport createTransport(int statusCode, String body) {
        exchangeFunction = mock(ExchangeFunction.class);
        ClientResponse clientResponse = ClientResponse.create(HttpStatus.valueOf(statusCode))
                .header("Ratelimit-Remaining", "799")
                .body(body)
                .build();
        when(exchangeFunction.exchange(any())).thenReturn(Mono.just(clientResponse));
        WebClient webClient = WebClient.builder().exchangeFunction(exchangeFunction).build();
        return new WebClientTransport(webClient);
    }

    private static TwitchRequest request(String method, String body) {
        return new TwitchRequest(
                URI.create("https://api.twitch.test/helix/channels?broadcaster_id=42"), method, body,
                Map.of("Client-ID", "client-id", "Authorization", "Bearer abc"), Duration.ofSeconds(10));
    }

    @Test
    void sendAsyncReturnsSuccessResponse() throws Exception {
        WebClientTransport transport = createTransport(200, "{\"data\":[]}");

        CompletableFuture<TwitchResponse> future = transport.sendAsync(request("GET", null));
        TwitchResponse response = future.get();

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getBody()).isEqualTo("{\"data\":[]}");
        assertThat(response.getHeader("ratelimit-remaining")).isEqualTo("799");
        assertThat(response.getElapsed()).isNotNull();
    }

    @Test
    void requestCarriesMethodAndHeaders() throws Exception {
        WebClientTransport transport = createTransport(200, "{}");

        transport.sendAsync(request("DELETE", null)).get();

        ArgumentCaptor<ClientRequest> captor = ArgumentCaptor.forClass(ClientRequest.class);
        verify(exchangeFunction).exchange(captor.capture());
        ClientRequest sent = captor.getValue();
        assertThat(sent.method()).isEqualTo(HttpMethod.DELETE);
        assertThat(sent.url().toString()).isEqualTo("https://api.twitch.test/helix/channels?broadcaster_id=42");
        assertThat(sent.headers().getFirst("Client-ID")).isEqualTo("client-id");
        assertThat(sent.headers().getFirst("Authorization")).isEqualTo("Bearer abc");
    }

    @Test
    void sendAsyncWithBody() throws Exception {
        WebClientTransport transport = createTransport(202, "{\"data\":[]}");

        TwitchResponse response = transport.sendAsync(request("POST", "{\"type\":\"stream.online\"}")).get();

        assertThat(response.getStatusCode()).isEqualTo(202);
    }

    @Test
    void sendAsyncHandlesEmptyResponseBody() throws Exception {
        WebClientTransport transport = createTransport(204, "");

        TwitchResponse response = transport.sendAsync(request("DELETE", null)).get();

        assertThat(response.getStatusCode()).isEqualTo(204);
        assertThat(response.getBody()).isEmpty();
    }

    @Test
    void errorStatusIsReturnedAsResponse() throws Exception {
        WebClientTransport transport = createTransport(404, "{\"error\":\"Not Found\"}");

        TwitchResponse response = transport.sendAsync(request("GET", null)).get();

        assertThat(response.getStatusCode()).isEqualTo(404);
        assertThat(response.getBody()).isEqualTo("{\"error\":\"Not Found\"}");
    }

    @Test
    void sendDelegatesToSendAsync() {
        WebClientTransport transport = createTransport(500, "Internal Server Error");

        TwitchResponse response = transport.send(request("GET", null));

        assertThat(response.getStatusCode()).isEqualTo(500);
    }

    @Test
    void requestTimeoutFailsFuture() {
        ExchangeFunction never = mock(ExchangeFunction.class);
        when(never.exchange(any())).thenReturn(Mono.never());
        WebClientTransport transport = new WebClientTransport(WebClient.builder().exchangeFunction(never).build());

        TwitchRequest request = new TwitchRequest(
                URI.create("https://api.twitch.test/helix/users"), "GET", null, Map.of(), Duration.ofMillis(50));

        assertThatThrownBy(() -> transport.sendAsync(request).get())
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(TimeoutException.class);
    }
}
