package com.geotable.engine;

import com.geotable.config.GeoTableProperties;
import com.geotable.exception.InvalidCoordinateException;
import com.geotable.exception.MissingPositionException;
import com.geotable.geohash.Geohash;
import com.geotable.model.GeoItem;
import com.geotable.model.GeoPosition;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes the geohash index attributes of an item before it is written.
 * The only component that sets those attributes.
 */
@Component
public class GeoItemEnricher {

    private final GeoTableProperties properties;

    public GeoItemEnricher(GeoTableProperties properties) {
        this.properties = properties;
    }

    /**
     * Copy of the item with geohash and geohash prefix set
     *
     * @param overwriteExisting whether geohash attributes already on the item may be replaced
     * @throws MissingPositionException if the position attribute is absent or malformed
     * @throws IllegalArgumentException if a geohash attribute exists and overwriting is not allowed
     */
    public GeoItem enrich(GeoItem item, boolean overwriteExisting) {
        GeoPosition position = readPosition(item);
        String geohash = Geohash.encode(position.getLatitude().doubleValue(),
                position.getLongitude().doubleValue(), properties.getFullPrecision());
        String prefix = geohash.substring(0, properties.getPrefixLength());

        if (!overwriteExisting) {
            checkAbsent(item, properties.getGeohashField());
            checkAbsent(item, properties.getGeohashPrefixField());
        }

        Map<String, Object> updates = new LinkedHashMap<>();
        updates.put(properties.getGeohashField(), geohash);
        updates.put(properties.getGeohashPrefixField(), prefix);
        return item.withAttributes(updates);
    }

    /**
     * Position of an item as stored in its position attribute
     *
     * @throws MissingPositionException if the attribute is absent or malformed
     */
    public GeoPosition readPosition(GeoItem item) {
        Object value = item.get(properties.getPositionField());
        if (value == null) {
            throw new MissingPositionException("Item lacks position attribute '" + properties.getPositionField() + "'");
        }
        GeoPosition position = properties.getPositionFormat().read(value);
        double lat = position.getLatitude().doubleValue();
        double lon = position.getLongitude().doubleValue();
        if (Math.abs(lat) > 90.0 || Math.abs(lon) > 180.0) {
            throw new InvalidCoordinateException(lat, lon);
        }
        return position;
    }

    private static void checkAbsent(GeoItem item, String field) {
        if (item.has(field)) {
            throw new IllegalArgumentException("Field " + field + " already exists");
        }
    }
}
