package com.geotable.statistics;

import com.geotable.model.GeohashStatistic;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Table of item counts keyed by geohash prefix and cell geohash
 */
public interface StatisticsStore {

    /**
     * Apply all changes of one change record atomically, at most once per event id
     *
     * @return false if the event was applied before
     */
    boolean applyOnce(String eventId, List<StatisticChange> changes, Instant updatedAt);

    /**
     * Delete the entry if its count dropped to zero or below
     */
    void deleteIfEmpty(String geohashPrefix, String geohash);

    Optional<GeohashStatistic> get(String geohashPrefix, String geohash);

    List<GeohashStatistic> findAll();

    void clear();
}
