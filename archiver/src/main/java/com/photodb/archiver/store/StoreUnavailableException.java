package com.photodb.archiver.store;

/**
 * A key-value table could not be opened. Unrecoverable: the run aborts.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
