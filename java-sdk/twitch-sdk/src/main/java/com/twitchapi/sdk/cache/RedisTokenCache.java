package com.twitchapi.sdk.cache;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Redis-backed {@link TokenCache} using Lettuce synchronous commands.
 *
 * <p>A Redis outage never fails a token lookup: read errors are logged and reported as a
 * miss, write errors are logged and dropped.</p>
 */
public class RedisTokenCache implements TokenCache, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisTokenCache.class);
    private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(10);

    private final RedisClient client;
    private StatefulRedisConnection<String, String> connection;
    private volatile RedisCommands<String, String> commands;

    public RedisTokenCache(RedisCommands<String, String> commands) {
        this.client = null;
        this.commands = Objects.requireNonNull(commands, "commands");
    }

    private RedisTokenCache(RedisClient client) {
        this.client = client;
    }

    /**
     * Create a cache for a {@code redis://} URL. The connection is opened on first use.
     */
    public static RedisTokenCache create(String redisUrl) {
        if (redisUrl == null || redisUrl.isBlank()) {
            throw new IllegalArgumentException("redisUrl is required");
        }
        return new RedisTokenCache(RedisClient.create(redisUrl));
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(commands().get(key));
        } catch (RedisException e) {
            log.warn("Redis read of {} failed, treating as cache miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        long seconds = ttl != null ? ttl.toSeconds() : 0;
        try {
            if (seconds > 0) {
                commands().setex(key, seconds, value);
            } else {
                log.warn("Refusing to store {} without expiry (ttl={}), removing it instead", key, ttl);
                commands().del(key);
            }
        } catch (RedisException e) {
            log.warn("Redis write of {} failed, token not shared: {}", key, e.getMessage());
        }
    }

    @Override
    public Optional<Duration> getTtl(String key) {
        try {
            Long seconds = commands().ttl(key);
            // -2 missing key, -1 no expiry
            if (seconds == null || seconds < 0) {
                return Optional.empty();
            }
            return Optional.of(Duration.ofSeconds(seconds));
        } catch (RedisException e) {
            log.warn("Redis TTL lookup of {} failed: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private RedisCommands<String, String> commands() {
        RedisCommands<String, String> current = commands;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (commands == null) {
                connection = client.connect();
                connection.setTimeout(COMMAND_TIMEOUT);
                commands = connection.sync();
            }
            return commands;
        }
    }

    @Override
    public synchronized void close() {
        if (connection != null) {
            connection.close();
            connection = null;
            commands = null;
        }
        if (client != null) {
            client.shutdown();
            log.debug("Redis token cache closed");
        }
    }
}
