package com.geotable.engine;

import com.geotable.config.GeoTableProperties;
import com.geotable.geohash.Geohash;
import com.geotable.model.CellCursor;
import com.geotable.model.RangeQuery;
import org.springframework.stereotype.Component;

/**
 * Turns a covering cell into a range query on the geohash index
 */
@Component
public class RangeQueryTranslator {

    private final int prefixLength;
    private final int fullPrecision;

    public RangeQueryTranslator(GeoTableProperties properties) {
        this.prefixLength = properties.getPrefixLength();
        this.fullPrecision = properties.getFullPrecision();
    }

    public RangeQuery translate(String cell, CellCursor cursor, int limit) {
        if (cell.length() < prefixLength || cell.length() > fullPrecision) {
            throw new IllegalArgumentException(String.format(
                    "Cell '%s' must have between %d and %d characters", cell, prefixLength, fullPrecision));
        }
        int remaining = fullPrecision - cell.length();
        return RangeQuery.builder()
                .partitionKey(cell.substring(0, prefixLength))
                .sortKeyFrom(cell + String.valueOf(Geohash.MIN_CHAR).repeat(remaining))
                .sortKeyTo(cell + String.valueOf(Geohash.MAX_CHAR).repeat(remaining))
                .exclusiveStartKey(cursor != null ? cursor.getToken() : null)
                .limit(limit)
                .build();
    }
}
