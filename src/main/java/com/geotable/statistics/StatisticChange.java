package com.geotable.statistics;

import lombok.Value;

/**
 * Increment of the item count of one statistics entry
 */
@Value
public class StatisticChange {

    String geohashPrefix;
    String geohash;
    long delta;
}
