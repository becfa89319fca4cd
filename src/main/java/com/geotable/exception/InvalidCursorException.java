package com.geotable.exception;

/**
 * Continuation token that does not decode to a cursor for the current query
 */
public class InvalidCursorException extends GeoTableException {

    public InvalidCursorException(String message) {
        super(message);
    }

    public InvalidCursorException(String message, Throwable cause) {
        super(message, cause);
    }
}
