package com.twitchapi.sdk.autoconfigure;

import com.twitchapi.sdk.autoconfigure.transport.RestClientTransport;
import com.twitchapi.sdk.autoconfigure.transport.WebClientTransport;
import com.twitchapi.sdk.cache.InMemoryTokenCache;
import com.twitchapi.sdk.cache.RedisTokenCache;
import com.twitchapi.sdk.cache.TokenCache;
import com.twitchapi.sdk.client.Credentials;
import com.twitchapi.sdk.client.TwitchApiClient;
import com.twitchapi.sdk.client.transport.JdkHttpTransport;
import com.twitchapi.sdk.client.transport.TwitchTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.http.HttpClient;
import java.util.concurrent.Executor;

@AutoConfiguration
@EnableConfigurationProperties(TwitchApiProperties.class)
@ConditionalOnClass(TwitchApiClient.class)
@ConditionalOnProperty(prefix = "twitch", name = "enabled", havingValue = "true")
public class TwitchApiAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TwitchApiAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(TokenCache.class)
    public TokenCache twitchTokenCache(TwitchApiProperties properties) {
        TwitchApiProperties.Cache cache = properties.getCache();
        if (cache.isRedis()) {
            log.info("Sharing Twitch access token through Redis under key {}", cache.getKey());
            return RedisTokenCache.create(cache.getRedisUrl());
        }
        log.info("Using in-memory Twitch token cache; the token is not shared between instances");
        return new InMemoryTokenCache();
    }

    @Bean
    @ConditionalOnClass(name = "org.springframework.web.reactive.function.client.WebClient")
    @ConditionalOnProperty(prefix = "twitch", name = "transport", havingValue = "webclient")
    @ConditionalOnMissingBean(TwitchTransport.class)
    public TwitchTransport twitchWebClientTransport(
            ObjectProvider<WebClient.Builder> webClientBuilderProvider) {
        WebClient.Builder builder = webClientBuilderProvider.getIfUnique();
        WebClient webClient = builder != null ? builder.build() : WebClient.builder().build();
        return new WebClientTransport(webClient);
    }

    @Bean
    @ConditionalOnClass(name = "org.springframework.web.client.RestClient")
    @ConditionalOnProperty(prefix = "twitch", name = "transport", havingValue = "restclient")
    @ConditionalOnMissingBean(TwitchTransport.class)
    public TwitchTransport twitchRestClientTransport(
            ObjectProvider<RestClient.Builder> restClientBuilderProvider,
            ObjectProvider<Executor> asyncExecutorProvider) {
        RestClient.Builder builder = restClientBuilderProvider.getIfUnique();
        RestClient restClient = builder != null ? builder.build() : RestClient.builder().build();
        return new RestClientTransport(restClient, asyncExecutorProvider.getIfUnique());
    }

    @Bean
    @ConditionalOnProperty(prefix = "twitch", name = "transport", havingValue = "jdk", matchIfMissing = true)
    @ConditionalOnMissingBean(TwitchTransport.class)
    public TwitchTransport twitchJdkTransport(
            TwitchApiProperties properties,
            ObjectProvider<HttpClient> httpClientProvider) {
        HttpClient httpClient = httpClientProvider.getIfUnique();
        if (httpClient != null) {
            return new JdkHttpTransport(httpClient);
        }
        return JdkHttpTransport.create(properties.getConnectTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public TwitchApiClient twitchApiClient(
            TwitchApiProperties properties,
            TokenCache tokenCache,
            TwitchTransport transport,
            ObjectProvider<ObjectMapper> objectMapperProvider) {
        TwitchApiProperties.Cache cache = properties.getCache();

        TwitchApiClient.Builder builder = TwitchApiClient.builder()
                .credentials(resolveCredentials(properties))
                .tokenCache(tokenCache)
                .transport(transport)
                .baseUrl(properties.getBaseUrl())
                .tokenUrl(properties.getTokenUrl())
                .cacheKey(cache.getKey())
                .safetyMargin(cache.getSafetyMargin())
                .connectTimeout(properties.getConnectTimeout())
                .requestTimeout(properties.getRequestTimeout());

        ObjectMapper objectMapper = objectMapperProvider.getIfUnique();
        if (objectMapper != null) {
            builder.objectMapper(objectMapper);
        }

        return builder.build();
    }

    @Bean
    @ConditionalOnBean(TwitchApiClient.class)
    public TwitchApiLifecycle twitchApiLifecycle(TwitchApiClient client, TwitchApiProperties properties) {
        return new TwitchApiLifecycle(client, properties.isAuthorizeOnStartup());
    }

    private static Credentials resolveCredentials(TwitchApiProperties properties) {
        if (properties.hasCredentials()) {
            return new Credentials(properties.getClientId(), properties.getClientSecret());
        }
        log.debug("twitch.client-id not configured, reading credentials from the environment");
        return Credentials.fromEnvironment();
    }
}
