package com.geotable.exception;

/**
 * Item lacks the configured position attribute, or the attribute is malformed
 */
public class MissingPositionException extends GeoTableException {

    public MissingPositionException(String message) {
        super(message);
    }

    public MissingPositionException(String message, Throwable cause) {
        super(message, cause);
    }
}
