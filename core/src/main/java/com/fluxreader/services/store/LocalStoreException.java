package com.fluxreader.services.store;

/**
 * A local write that must abort the entry being processed.
 */
public class LocalStoreException extends RuntimeException {

    public LocalStoreException(String message) {
        super(message);
    }

    public LocalStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
