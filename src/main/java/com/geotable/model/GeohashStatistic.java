package com.geotable.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Number of items in one geohash cell
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GeohashStatistic {

    String geohashPrefix;
    String geohash;
    long itemCount;
    Instant updatedAt;

    /**
     * Center of the cell, only set on query results
     */
    GeoPosition center;

    /**
     * Bounds of the cell, only set on query results
     */
    BoundingBox boundaries;
}
