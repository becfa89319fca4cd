package com.geotable.model;

import lombok.Builder;
import lombok.Value;

/**
 * Range query against the geohash index: partition equality plus an inclusive sort key range
 */
@Value
@Builder
public class RangeQuery {

    String partitionKey;
    String sortKeyFrom;
    String sortKeyTo;

    /**
     * Store token to resume after, or null to start at {@code sortKeyFrom}
     */
    String exclusiveStartKey;

    int limit;
}
