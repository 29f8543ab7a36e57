package com.creature.cache.remote;

import com.creature.cache.core.model.CreatureRecord;

import java.util.Objects;

/**
 * Outcome of a remote fetch.
 *
 * @param status outcome
 * @param record normalized record, set only on {@link Status#FOUND}
 * @param reason failure description, set only on {@link Status#ERROR}
 */
public record FetchResult(Status status, CreatureRecord record, String reason) {

    public enum Status {
        FOUND,
        /** The source answered and has no such creature. */
        NOT_FOUND,
        /** The source could not be queried or answered with something unusable. */
        ERROR
    }

    public FetchResult {
        Objects.requireNonNull(status, "status is required");
    }

    public static FetchResult found(CreatureRecord record) {
        return new FetchResult(Status.FOUND, Objects.requireNonNull(record, "record is required"), null);
    }

    public static FetchResult notFound() {
        return new FetchResult(Status.NOT_FOUND, null, null);
    }

    public static FetchResult error(String reason) {
        return new FetchResult(Status.ERROR, null, reason);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }
}
