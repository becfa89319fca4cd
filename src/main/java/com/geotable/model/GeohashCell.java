package com.geotable.model;

import com.geotable.geohash.Geohash;
import lombok.Value;

/**
 * Rectangular region identified by a geohash prefix
 */
@Value
public class GeohashCell {

    String prefix;
    BoundingBox boundingBox;

    public static GeohashCell of(String prefix) {
        return new GeohashCell(prefix, Geohash.decodeBoundingBox(prefix));
    }
}
