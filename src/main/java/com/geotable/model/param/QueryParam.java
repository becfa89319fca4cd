package com.geotable.model.param;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Geometry;

/**
 * Body of a polygon query request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryParam {

    /**
     * Query area, given as {@code {"wkt": ...}} or {@code {"bbox": [lonMin, latMin, lonMax, latMax]}}
     */
    private Geometry polygon;

    @Builder.Default
    private int limit = 100;

    /**
     * Continuation token of the previous page
     */
    private String exclusiveStartKey;
}
