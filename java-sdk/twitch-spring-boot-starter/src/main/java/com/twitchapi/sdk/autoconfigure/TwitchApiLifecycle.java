package com.twitchapi.sdk.autoconfigure;

import com.twitchapi.sdk.client.TokenRefreshResult;
import com.twitchapi.sdk.client.TwitchApiClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Authorizes the client when the context starts and closes it when the context stops.
 */
final class TwitchApiLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TwitchApiLifecycle.class);

    // Starts before and stops after the embedded web server
    static final int PHASE = SmartLifecycle.DEFAULT_PHASE - 4096;

    private final TwitchApiClient client;
    private final boolean authorizeOnStartup;
    private volatile boolean running;

    TwitchApiLifecycle(TwitchApiClient client, boolean authorizeOnStartup) {
        this.client = client;
        this.authorizeOnStartup = authorizeOnStartup;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        running = true;
        if (authorizeOnStartup) {
            TokenRefreshResult result = client.authorize();
            if (result.isProviderError()) {
                log.warn("Twitch authorization at startup failed with status {}: {}. Requests will retry.",
                        result.getStatusCode(), result.getMessage());
            }
        }
    }

    @Override
    public void stop() {
        if (running) {
            running = false;
            client.close();
        }
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
