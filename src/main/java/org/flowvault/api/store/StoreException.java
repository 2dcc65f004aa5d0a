package org.flowvault.api.store;

/**
 * Thrown when a store operation fails at the database level.
 * <p>
 * Writes are applied in a single transaction and rolled back on failure, so a batch that
 * failed with this exception left no trace and can be retried as a whole.
 */
public class StoreException extends Exception {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
