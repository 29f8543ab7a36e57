package com.creature.cache.remote;

/**
 * Raised by a {@link RemoteClient} when a query cannot produce data.
 */
public class RemoteClientException extends RuntimeException {

    public RemoteClientException(String message) {
        super(message);
    }

    public RemoteClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
