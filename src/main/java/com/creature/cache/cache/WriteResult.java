package com.creature.cache.cache;

import java.util.Objects;

/**
 * Outcome of a cache write.
 *
 * @param status outcome
 * @param reason failure description, set only on {@link Status#FAILED}
 * @param cause  underlying exception, set only on {@link Status#FAILED}
 */
public record WriteResult(Status status, String reason, Throwable cause) {

    public enum Status {
        /** A new row was inserted. */
        WRITTEN,
        /** A row with the same id already existed and was left untouched. */
        ALREADY_PRESENT,
        /** The row could not be written. The cache is best-effort, so callers carry on. */
        FAILED
    }

    public WriteResult {
        Objects.requireNonNull(status, "status is required");
    }

    public static WriteResult written() {
        return new WriteResult(Status.WRITTEN, null, null);
    }

    public static WriteResult alreadyPresent() {
        return new WriteResult(Status.ALREADY_PRESENT, null, null);
    }

    public static WriteResult failed(String reason, Throwable cause) {
        return new WriteResult(Status.FAILED, reason, cause);
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }
}
