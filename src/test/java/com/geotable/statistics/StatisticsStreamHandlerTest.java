package com.geotable.statistics;

import com.geotable.config.GeoTableProperties;
import com.geotable.model.GeoItem;
import com.geotable.model.GeohashStatistic;
import com.geotable.model.ItemChangeEvent;
import com.geotable.repository.impl.InMemoryGeoIndexStore;
import com.geotable.statistics.impl.InMemoryStatisticsStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class StatisticsStreamHandlerTest {

    private static final String GEOHASH = "u281z7j7ppzs";
    private static final String OTHER_GEOHASH = "u281hsd54tnu";
    private static final Instant TIME = Instant.parse("2020-03-29T13:17:01Z");
    private static final Instant OLD_TIME = Instant.parse("2020-03-26T13:17:01Z");

    private InMemoryGeoIndexStore sourceStore;
    private InMemoryStatisticsStore statisticsStore;
    private StatisticsStreamHandler handler;

    @BeforeEach
    void setUp() {
        GeoTableProperties properties = new GeoTableProperties();
        properties.getStatistics().setPrecisionSteps(List.of(3, 7));
        sourceStore = new InMemoryGeoIndexStore(properties);
        statisticsStore = new InMemoryStatisticsStore(properties);
        handler = new StatisticsStreamHandler(sourceStore, statisticsStore, properties,
                Clock.fixed(TIME, ZoneOffset.UTC));
    }

    private static GeoItem located(String id, String geohash) {
        return GeoItem.of(Map.of("id", id, "_geohash", geohash, "_geohash_prefix", geohash.substring(0, 3)));
    }

    private static GeoItem unlocated(String id) {
        return GeoItem.of(Map.of("id", id));
    }

    private static ItemChangeEvent event(GeoItem oldImage, GeoItem newImage) {
        ItemChangeEvent.Type type;
        if (oldImage != null && newImage != null) {
            type = ItemChangeEvent.Type.MODIFY;
        } else if (oldImage != null) {
            type = ItemChangeEvent.Type.REMOVE;
        } else {
            type = ItemChangeEvent.Type.INSERT;
        }
        return ItemChangeEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .oldImage(oldImage)
                .newImage(newImage)
                .build();
    }

    private static GeohashStatistic stat(int precision, long count) {
        return stat(precision, count, GEOHASH, TIME);
    }

    private static GeohashStatistic stat(int precision, long count, String geohash, Instant updatedAt) {
        return GeohashStatistic.builder()
                .geohashPrefix(geohash.substring(0, 3))
                .geohash(geohash.substring(0, precision))
                .itemCount(count)
                .updatedAt(updatedAt)
                .build();
    }

    private void insertStat(GeohashStatistic stat) {
        statisticsStore.applyOnce("setup-" + stat.getGeohash(),
                List.of(new StatisticChange(stat.getGeohashPrefix(), stat.getGeohash(), stat.getItemCount())),
                stat.getUpdatedAt());
    }

    @Test
    void testCreateItem() {
        handler.handleEvents(List.of(event(null, located("id-1", GEOHASH))));

        List<GeohashStatistic> items = statisticsStore.findAll();
        assertEquals(2, items.size());
        assertTrue(items.contains(stat(3, 1)));
        assertTrue(items.contains(stat(7, 1)));
    }

    @Test
    void testEventIsHandledIdempotent() {
        List<ItemChangeEvent> events = List.of(event(null, located("id-1", GEOHASH)));

        handler.handleEvents(events);
        handler.handleEvents(events);

        List<GeohashStatistic> items = statisticsStore.findAll();
        assertEquals(2, items.size());
        assertTrue(items.contains(stat(3, 1)));
        assertTrue(items.contains(stat(7, 1)));
    }

    @Test
    void testCreateItemAddsToExistingEntry() {
        insertStat(stat(3, 1));

        handler.handleEvents(List.of(event(null, located("id-1", GEOHASH))));

        List<GeohashStatistic> items = statisticsStore.findAll();
        assertEquals(2, items.size());
        assertTrue(items.contains(stat(3, 2)));
        assertTrue(items.contains(stat(7, 1)));
    }

    @Test
    void testUpdateItemSameLocation() {
        insertStat(stat(3, 1, GEOHASH, OLD_TIME));
        insertStat(stat(7, 1, GEOHASH, OLD_TIME));

        handler.handleEvents(List.of(event(located("id-1", GEOHASH), located("id-1", GEOHASH))));

        List<GeohashStatistic> items = statisticsStore.findAll();
        assertEquals(2, items.size());
        assertTrue(items.contains(stat(3, 1, GEOHASH, OLD_TIME)));
        assertTrue(items.contains(stat(7, 1, GEOHASH, OLD_TIME)));
    }

    @Test
    void testUpdateItemOtherLocation() {
        insertStat(stat(3, 1));
        insertStat(stat(7, 1));

        handler.handleEvents(List.of(event(located("id-1", GEOHASH), located("id-1", OTHER_GEOHASH))));

        List<GeohashStatistic> items = statisticsStore.findAll();
        assertEquals(2, items.size());
        assertTrue(items.contains(stat(3, 1, OTHER_GEOHASH, TIME)));
        assertTrue(items.contains(stat(7, 1, OTHER_GEOHASH, TIME)));
    }

    @Test
    void testDeleteItem() {
        insertStat(stat(3, 2));
        insertStat(stat(7, 1));

        handler.handleEvents(List.of(event(located("id-1", GEOHASH), null)));

        List<GeohashStatistic> items = statisticsStore.findAll();
        assertEquals(1, items.size());
        assertTrue(items.contains(stat(3, 1)));
    }

    @Test
    void testHandlesItemsWithoutGeohashGracefully() {
        insertStat(stat(3, 2));
        insertStat(stat(7, 2));

        handler.handleEvents(List.of(
                event(null, unlocated("id-1")),
                event(located("id-2", GEOHASH), null),
                event(unlocated("id-3"), located("id-3", OTHER_GEOHASH)),
                event(located("id-3", GEOHASH), unlocated("id-3"))));

        List<GeohashStatistic> items = statisticsStore.findAll();
        assertEquals(2, items.size());
        assertTrue(items.contains(stat(3, 1, OTHER_GEOHASH, TIME)));
        assertTrue(items.contains(stat(7, 1, OTHER_GEOHASH, TIME)));
    }

    @Test
    void testFullTableReprocessing() {
        sourceStore.putItem(GeoItem.of(Map.of("id", "id-1", "_geohash", OTHER_GEOHASH)));
        sourceStore.putItem(GeoItem.of(Map.of("id", "id-2", "_geohash", GEOHASH)));
        sourceStore.putItem(GeoItem.of(Map.of("id", "id-3", "_geohash", GEOHASH)));
        sourceStore.putItem(unlocated("id-4"));
        insertStat(stat(3, 42));
        insertStat(stat(5, 42));
        insertStat(stat(7, 42));

        handler.reprocessFullTable();

        List<GeohashStatistic> items = statisticsStore.findAll();
        assertEquals(3, items.size());
        assertTrue(items.contains(stat(3, 3)));
        assertTrue(items.contains(stat(7, 2)));
        assertTrue(items.contains(stat(7, 1, OTHER_GEOHASH, TIME)));
    }

    @Test
    void testSubscribedHandlerFollowsTableWrites() {
        handler.subscribe();

        sourceStore.putItem(located("id-1", GEOHASH));
        sourceStore.putItem(located("id-2", GEOHASH));
        sourceStore.putItem(located("id-2", OTHER_GEOHASH));
        sourceStore.deleteItem(Map.of("id", "id-1"));

        List<GeohashStatistic> items = new ArrayList<>(statisticsStore.findAll());
        assertEquals(2, items.size());
        assertTrue(items.contains(stat(3, 1)));
        assertTrue(items.contains(stat(7, 1, OTHER_GEOHASH, TIME)));
    }

    @Test
    void testKeysRequireLongEnoughGeohash() {
        List<ItemChangeEvent> events = List.of(event(null, GeoItem.of(Map.of("id", "id-1", "_geohash", "u28"))));

        assertThrows(IllegalArgumentException.class, () -> handler.handleEvents(events));
    }
}
