package com.creature.cache.cache;

import com.creature.cache.core.model.CreatureRecord;

import java.util.Objects;

/**
 * Outcome of a cache read.
 *
 * @param status outcome
 * @param record the cached record, set only on {@link Status#HIT}
 * @param reason why the cache could not be used, set on {@link Status#CORRUPT} and {@link Status#UNAVAILABLE}
 */
public record ReadResult(Status status, CreatureRecord record, String reason) {

    public enum Status {
        /** A valid row was found. */
        HIT,
        /** No row for the id. */
        MISS,
        /** A row exists but its fields could not be decoded. Handled like a miss. */
        CORRUPT,
        /** The store could not be reached or queried. The cache check is skipped. */
        UNAVAILABLE
    }

    public ReadResult {
        Objects.requireNonNull(status, "status is required");
    }

    public static ReadResult hit(CreatureRecord record) {
        return new ReadResult(Status.HIT, Objects.requireNonNull(record, "record is required"), null);
    }

    public static ReadResult miss() {
        return new ReadResult(Status.MISS, null, null);
    }

    public static ReadResult corrupt(String reason) {
        return new ReadResult(Status.CORRUPT, null, reason);
    }

    public static ReadResult unavailable(String reason) {
        return new ReadResult(Status.UNAVAILABLE, null, reason);
    }

    public boolean isHit() {
        return status == Status.HIT;
    }
}
