package com.geotable.exception;

/**
 * Failure reported by the underlying table. Passed through to the caller, never retried here.
 */
public class StoreException extends GeoTableException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
