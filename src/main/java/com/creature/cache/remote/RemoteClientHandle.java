package com.creature.cache.remote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Process-wide handle to the remote client, created once at startup and passed to
 * whoever needs it.
 *
 * <p>Initialization either yields a usable client or records why it failed.
 * A failed handle stays failed for the life of the process; nothing retries it.</p>
 */
public final class RemoteClientHandle {
    private static final Logger log = LoggerFactory.getLogger(RemoteClientHandle.class);

    private final RemoteClient client;
    private final String failureReason;

    private RemoteClientHandle(RemoteClient client, String failureReason) {
        this.client = client;
        this.failureReason = failureReason;
    }

    /**
     * Runs the one-time client setup. Any exception it throws marks the handle unavailable.
     */
    public static RemoteClientHandle initialize(Supplier<? extends RemoteClient> setup) {
        Objects.requireNonNull(setup, "setup is required");
        try {
            RemoteClient client = Objects.requireNonNull(setup.get(), "setup returned no client");
            log.info("Remote client ready: {}", client.getEndpoint());
            return new RemoteClientHandle(client, null);
        } catch (RuntimeException e) {
            log.error("CRITICAL: remote client setup failed, creature lookups are disabled: {}", e.getMessage(), e);
            return new RemoteClientHandle(null, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Wraps an already constructed client.
     */
    public static RemoteClientHandle of(RemoteClient client) {
        return new RemoteClientHandle(Objects.requireNonNull(client, "client is required"), null);
    }

    /**
     * A handle whose setup is known to have failed.
     */
    public static RemoteClientHandle failed(String reason) {
        return new RemoteClientHandle(null, Objects.requireNonNull(reason, "reason is required"));
    }

    public boolean isAvailable() {
        return client != null;
    }

    /**
     * Returns the client.
     *
     * @throws IllegalStateException if setup failed
     */
    public RemoteClient client() {
        if (client == null) {
            throw new IllegalStateException("Remote client unavailable: " + failureReason);
        }
        return client;
    }

    /**
     * Why setup failed, or null when the client is available.
     */
    public String failureReason() {
        return failureReason;
    }
}
