package com.geotable.repository;

import com.geotable.model.GeoItem;
import com.geotable.model.IndexPage;
import com.geotable.model.RangeQuery;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The key-value table holding the items, with its geohash secondary index.
 * Failures surface as {@link com.geotable.exception.StoreException}.
 */
public interface GeoIndexStore {

    /**
     * Insert or replace an item by primary key
     */
    void putItem(GeoItem item);

    /**
     * Get an item by its primary key attributes
     */
    Optional<GeoItem> getItem(Map<String, Object> key);

    /**
     * Delete an item by its primary key attributes
     *
     * @return true if an item was removed
     */
    boolean deleteItem(Map<String, Object> key);

    /**
     * Query the geohash index: rows of one partition within a sort key range, ascending.
     * Continuation tokens are opaque to callers and must be passed back verbatim.
     */
    IndexPage query(RangeQuery query);

    /**
     * All items of the table
     */
    List<GeoItem> scan();

    /**
     * Subscribe to the change records of the table
     */
    void addChangeListener(ItemChangeListener listener);
}
