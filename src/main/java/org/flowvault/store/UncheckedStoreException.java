package org.flowvault.store;

import java.util.Objects;

import org.flowvault.api.store.StoreException;

/**
 * Wraps a {@link StoreException} where the calling interface cannot declare it.
 */
public class UncheckedStoreException extends RuntimeException {

    public UncheckedStoreException(String message, StoreException cause) {
        super(message, Objects.requireNonNull(cause));
    }

    @Override
    public synchronized StoreException getCause() {
        return (StoreException) super.getCause();
    }
}
