package com.geotable.model;

import lombok.Value;
import org.locationtech.jts.geom.Coordinate;

import java.math.BigDecimal;

/**
 * Exact position of an item as stored in the table
 */
@Value
public class GeoPosition {

    BigDecimal latitude;
    BigDecimal longitude;

    /**
     * JTS coordinate, x = longitude, y = latitude
     */
    public Coordinate toCoordinate() {
        return new Coordinate(longitude.doubleValue(), latitude.doubleValue());
    }
}
