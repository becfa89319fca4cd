package com.geotable.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Cells covering a query box, all of the same precision.
 * Computed once per logical query and carried through every page.
 */
@Value
@Builder
@Jacksonized
public class QueryPlan {

    int precision;

    /**
     * Geohash prefixes of the covering cells, in query order
     */
    List<String> cells;

    /**
     * The clamped box the plan was computed for
     */
    BoundingBox boundingBox;

    public int size() {
        return cells.size();
    }
}
