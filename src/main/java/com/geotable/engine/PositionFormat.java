package com.geotable.engine;

import com.geotable.exception.MissingPositionException;
import com.geotable.model.GeoPosition;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Layout of the position attribute of an item
 */
public enum PositionFormat {

    /**
     * {@code {"latitude": 48.1, "longitude": 11.5}}
     */
    LATITUDE_LONGITUDE("latitude", "longitude"),

    /**
     * {@code {"lat": 48.1, "long": 11.5}}
     */
    LAT_LONG("lat", "long");

    private final String latitudeKey;
    private final String longitudeKey;

    PositionFormat(String latitudeKey, String longitudeKey) {
        this.latitudeKey = latitudeKey;
        this.longitudeKey = longitudeKey;
    }

    public GeoPosition read(Object value) {
        if (!(value instanceof Map)) {
            throw new MissingPositionException("Position attribute is not a map: " + value);
        }
        Map<?, ?> map = (Map<?, ?>) value;
        return new GeoPosition(toDecimal(map.get(latitudeKey), latitudeKey), toDecimal(map.get(longitudeKey), longitudeKey));
    }

    public Map<String, Object> write(GeoPosition position) {
        return Map.of(latitudeKey, position.getLatitude(), longitudeKey, position.getLongitude());
    }

    private static BigDecimal toDecimal(Object value, String key) {
        if (value == null) {
            throw new MissingPositionException("Position attribute lacks '" + key + "'");
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        try {
            if (value instanceof Double || value instanceof Float) {
                return BigDecimal.valueOf(((Number) value).doubleValue());
            }
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new MissingPositionException("Position attribute '" + key + "' is not a number: " + value, e);
        }
    }
}
