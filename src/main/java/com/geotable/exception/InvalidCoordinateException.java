package com.geotable.exception;

/**
 * Latitude or longitude outside of the coordinate domain
 */
public class InvalidCoordinateException extends GeoTableException {

    public InvalidCoordinateException(double latitude, double longitude) {
        super(String.format("Coordinate out of range: lat=%s, lon=%s", latitude, longitude));
    }
}
