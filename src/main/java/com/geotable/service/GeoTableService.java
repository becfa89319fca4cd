package com.geotable.service;

import com.geotable.model.GeoItem;
import com.geotable.model.QueryResult;
import org.locationtech.jts.geom.Geometry;

import java.util.Map;
import java.util.Optional;

/**
 * Geo table operations: geohash indexed writes and paginated polygon queries
 */
public interface GeoTableService {

    /**
     * One page of the items lying inside a polygon.
     * Pass the {@code lastEvaluatedKey} of a page, together with the same polygon,
     * to get the next one.
     *
     * @param polygon           query area, in lon/lat coordinates
     * @param limit             maximum number of items in the page, at least 1
     * @param exclusiveStartKey continuation token of the previous page, or null or empty for the first page
     */
    QueryResult query(Geometry polygon, int limit, String exclusiveStartKey);

    /**
     * Store an item, adding its geohash index attributes
     *
     * @return the item as stored
     */
    GeoItem putItem(Map<String, Object> item);

    /**
     * Get an item by primary key attributes
     */
    Optional<GeoItem> getItem(Map<String, Object> key);

    /**
     * Delete an item by primary key attributes
     */
    boolean deleteItem(Map<String, Object> key);
}
