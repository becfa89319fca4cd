package com.geotable.exception;

/**
 * A geohash string that cannot be decoded. Indicates index corruption or a coding bug.
 */
public class InvalidGeohashException extends GeoTableException {

    public InvalidGeohashException(String geohash, String reason) {
        super("Invalid geohash '" + geohash + "': " + reason);
    }
}
