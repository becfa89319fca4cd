package com.geotable.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Continuation state of a whole query: the fixed plan plus the state of every pending cell.
 * Cells missing from {@code cells} are exhausted.
 */
@Value
@Builder
@Jacksonized
public class GeoQueryCursor {

    public static final String TYPE = "geo-query-cursor";
    public static final int CURRENT_VERSION = 1;

    String type;
    int version;
    QueryPlan plan;
    Map<String, CellCursor> cells;
}
