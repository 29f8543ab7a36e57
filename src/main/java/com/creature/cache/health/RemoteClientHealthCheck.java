package com.creature.cache.health;

import com.creature.cache.remote.RemoteClientHandle;

/**
 * DOWN when the remote client failed its one-time setup, since no lookup can succeed.
 */
public class RemoteClientHealthCheck implements HealthCheck {

    private final RemoteClientHandle handle;

    public RemoteClientHealthCheck(RemoteClientHandle handle) {
        this.handle = handle;
    }

    @Override
    public String getName() {
        return "remoteClient";
    }

    @Override
    public HealthStatus check() {
        if (!handle.isAvailable()) {
            return HealthStatus.down("Remote client unavailable: " + handle.failureReason());
        }
        return HealthStatus.up().withDetail("endpoint", handle.client().getEndpoint());
    }
}
