package com.creature.cache.store;

/**
 * Thrown when no connection to the store can be acquired.
 * Treated as transient: lookups skip the cache and go to the remote source.
 */
public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreUnavailableException(String message) {
        super(message);
    }
}
