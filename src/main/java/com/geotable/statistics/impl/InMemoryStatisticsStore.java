package com.geotable.statistics.impl;

import com.geotable.config.GeoTableProperties;
import com.geotable.model.GeohashStatistic;
import com.geotable.statistics.StatisticChange;
import com.geotable.statistics.StatisticsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process statistics table. Remembers the ids of the most recent events only,
 * so a replay is detected as long as it arrives within the last {@code dedupCapacity} events.
 */
@Repository
public class InMemoryStatisticsStore implements StatisticsStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryStatisticsStore.class);

    private final Map<String, GeohashStatistic> entries = new ConcurrentHashMap<>();

    // Most recent event ids, oldest evicted first; guarded by this
    private final Map<String, Instant> appliedEvents;

    @Autowired
    public InMemoryStatisticsStore(GeoTableProperties properties) {
        this(properties.getStatistics().getDedupCapacity());
    }

    public InMemoryStatisticsStore(int dedupCapacity) {
        if (dedupCapacity < 1) {
            throw new IllegalArgumentException("Dedup capacity must be positive: " + dedupCapacity);
        }
        this.appliedEvents = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Instant> eldest) {
                return size() > dedupCapacity;
            }
        };
    }

    @Override
    public synchronized boolean applyOnce(String eventId, List<StatisticChange> changes, Instant updatedAt) {
        if (appliedEvents.putIfAbsent(eventId, updatedAt) != null) {
            logger.debug("Event {} already applied", eventId);
            return false;
        }
        for (StatisticChange change : changes) {
            String key = key(change.getGeohashPrefix(), change.getGeohash());
            GeohashStatistic current = entries.get(key);
            long count = (current != null ? current.getItemCount() : 0) + change.getDelta();
            entries.put(key, GeohashStatistic.builder()
                    .geohashPrefix(change.getGeohashPrefix())
                    .geohash(change.getGeohash())
                    .itemCount(count)
                    .updatedAt(updatedAt)
                    .build());
        }
        return true;
    }

    @Override
    public synchronized void deleteIfEmpty(String geohashPrefix, String geohash) {
        String key = key(geohashPrefix, geohash);
        GeohashStatistic current = entries.get(key);
        if (current != null && current.getItemCount() <= 0) {
            entries.remove(key);
        }
    }

    @Override
    public Optional<GeohashStatistic> get(String geohashPrefix, String geohash) {
        return Optional.ofNullable(entries.get(key(geohashPrefix, geohash)));
    }

    @Override
    public List<GeohashStatistic> findAll() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public synchronized void clear() {
        entries.clear();
        appliedEvents.clear();
    }

    private static String key(String geohashPrefix, String geohash) {
        return geohashPrefix + ':' + geohash;
    }
}
