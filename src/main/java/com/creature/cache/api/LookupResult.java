package com.creature.cache.api;

import com.creature.cache.core.model.CreatureRecord;

import java.util.Objects;

/**
 * Outcome of {@link CreatureCache#getCreature(int)}.
 *
 * <p>Only {@link Status#FOUND} carries a record, together with the {@link Source}
 * that produced it. Every other status carries a human-readable reason.</p>
 */
public record LookupResult(Status status, Source source, CreatureRecord record, String reason) {

    public enum Status {
        FOUND,
        NOT_FOUND,
        REMOTE_ERROR,
        CLIENT_UNAVAILABLE
    }

    public enum Source {
        CACHE,
        REMOTE
    }

    public LookupResult {
        Objects.requireNonNull(status, "status is required");
        if (status == Status.FOUND && (record == null || source == null)) {
            throw new IllegalArgumentException("FOUND requires a record and a source");
        }
        if (status != Status.FOUND && record != null) {
            throw new IllegalArgumentException(status + " cannot carry a record");
        }
    }

    public static LookupResult fromCache(CreatureRecord record) {
        return new LookupResult(Status.FOUND, Source.CACHE, record, null);
    }

    public static LookupResult fromRemote(CreatureRecord record) {
        return new LookupResult(Status.FOUND, Source.REMOTE, record, null);
    }

    public static LookupResult notFound(int id) {
        return new LookupResult(Status.NOT_FOUND, null, null, "No creature with id " + id);
    }

    public static LookupResult remoteError(String reason) {
        return new LookupResult(Status.REMOTE_ERROR, null, null, reason);
    }

    public static LookupResult clientUnavailable(String reason) {
        return new LookupResult(Status.CLIENT_UNAVAILABLE, null, null, reason);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }
}
