package com.geotable.exception;

/**
 * Base class for all errors raised by the geo table engine
 */
public class GeoTableException extends RuntimeException {

    public GeoTableException(String message) {
        super(message);
    }

    public GeoTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
