package com.geotable.statistics;

import com.geotable.config.GeoTableProperties;
import com.geotable.model.GeoItem;
import com.geotable.model.ItemChangeEvent;
import com.geotable.repository.GeoIndexStore;
import com.geotable.repository.ItemChangeListener;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Keeps per-cell item counts in sync with the item table by consuming its change records.
 * Counts are kept at every configured precision step.
 */
@Component
@Slf4j
public class StatisticsStreamHandler implements ItemChangeListener {

    private final GeoIndexStore sourceStore;
    private final StatisticsStore statisticsStore;
    private final GeoTableProperties properties;
    private final Clock clock;

    public StatisticsStreamHandler(GeoIndexStore sourceStore,
                                   StatisticsStore statisticsStore,
                                   GeoTableProperties properties,
                                   Clock clock) {
        this.sourceStore = sourceStore;
        this.statisticsStore = statisticsStore;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void subscribe() {
        if (properties.getStatistics().isEnabled()) {
            sourceStore.addChangeListener(this);
            log.info("Maintaining item statistics at precisions {}", properties.getStatistics().getPrecisionSteps());
        }
    }

    @Override
    public void onChanges(List<ItemChangeEvent> events) {
        handleEvents(events);
    }

    public void handleEvents(List<ItemChangeEvent> events) {
        log.debug("Handling {} change records", events.size());
        for (ItemChangeEvent event : events) {
            handleEvent(event);
        }
    }

    /**
     * Drop all statistics and recount them from a full scan of the item table
     */
    public void reprocessFullTable() {
        log.info("Rebuilding item statistics from a full table scan");
        statisticsStore.clear();
        int counted = 0;
        for (GeoItem item : sourceStore.scan()) {
            String geohash = geohashOf(item);
            if (geohash == null) {
                continue;
            }
            List<StatisticChange> changes = new ArrayList<>();
            for (int precision : properties.getStatistics().getPrecisionSteps()) {
                changes.add(change(geohash, precision, 1));
            }
            statisticsStore.applyOnce(UUID.randomUUID().toString(), changes, Instant.now(clock));
            counted++;
        }
        log.info("Rebuilt item statistics from {} items", counted);
    }

    private void handleEvent(ItemChangeEvent event) {
        String oldGeohash = geohashOf(event.getOldImage());
        String newGeohash = geohashOf(event.getNewImage());

        List<StatisticChange> updates = new ArrayList<>();
        List<StatisticChange> emptied = new ArrayList<>();
        for (int precision : properties.getStatistics().getPrecisionSteps()) {
            if (oldGeohash != null && newGeohash != null
                    && cell(oldGeohash, precision).equals(cell(newGeohash, precision))) {
                continue;
            }
            if (oldGeohash != null) {
                StatisticChange decrement = change(oldGeohash, precision, -1);
                updates.add(decrement);
                emptied.add(decrement);
            }
            if (newGeohash != null) {
                updates.add(change(newGeohash, precision, 1));
            }
        }

        if (!updates.isEmpty()) {
            statisticsStore.applyOnce(event.getEventId(), updates, Instant.now(clock));
        }
        for (StatisticChange change : emptied) {
            statisticsStore.deleteIfEmpty(change.getGeohashPrefix(), change.getGeohash());
        }
    }

    private StatisticChange change(String geohash, int precision, long delta) {
        int prefixLength = properties.getPrefixLength();
        if (geohash.length() < precision) {
            throw new IllegalArgumentException(String.format(
                    "Cannot create key with precision %d from too short geohash \"%s\"", precision, geohash));
        }
        if (precision < prefixLength) {
            throw new IllegalArgumentException(String.format(
                    "Cannot create key with precision=%d smaller than prefix_length=%d", precision, prefixLength));
        }
        return new StatisticChange(geohash.substring(0, prefixLength), cell(geohash, precision), delta);
    }

    private static String cell(String geohash, int precision) {
        return geohash.substring(0, Math.min(precision, geohash.length()));
    }

    private String geohashOf(GeoItem image) {
        if (image == null) {
            return null;
        }
        Object geohash = image.get(properties.getGeohashField());
        return geohash instanceof String ? (String) geohash : null;
    }
}
