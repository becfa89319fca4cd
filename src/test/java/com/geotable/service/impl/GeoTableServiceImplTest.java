package com.geotable.service.impl;

import com.geotable.config.GeoTableConfiguration;
import com.geotable.config.GeoTableProperties;
import com.geotable.engine.CellCoveringPlanner;
import com.geotable.engine.CursorCodec;
import com.geotable.engine.GeoItemEnricher;
import com.geotable.engine.PositionFormat;
import com.geotable.engine.RangeQueryTranslator;
import com.geotable.engine.ResultMerger;
import com.geotable.exception.InvalidCursorException;
import com.geotable.exception.MissingPositionException;
import com.geotable.exception.QueryTooLargeException;
import com.geotable.model.GeoItem;
import com.geotable.model.GeoPosition;
import com.geotable.model.QueryResult;
import com.geotable.repository.impl.InMemoryGeoIndexStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.WKTReader;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class GeoTableServiceImplTest {

    private static final BigDecimal LAT = new BigDecimal("48.137154");
    private static final BigDecimal LON = new BigDecimal("11.576124");

    private final GeometryFactory geometryFactory = new GeometryFactory();

    private GeoTableProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private InMemoryGeoIndexStore store;
    private ExecutorService executor;
    private GeoTableServiceImpl service;

    @BeforeEach
    void setUp() {
        properties = new GeoTableProperties();
        meterRegistry = new SimpleMeterRegistry();
        store = new InMemoryGeoIndexStore(properties);
        executor = Executors.newFixedThreadPool(4);

        GeoItemEnricher enricher = new GeoItemEnricher(properties);
        service = new GeoTableServiceImpl(meterRegistry);
        service.geoIndexStore = store;
        service.planner = new CellCoveringPlanner(properties);
        service.enricher = enricher;
        service.merger = new ResultMerger(store, new RangeQueryTranslator(properties), enricher, executor, geometryFactory);
        service.cursorCodec = new CursorCodec(new GeoTableConfiguration().objectMapper(), properties);
        service.properties = properties;
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private Geometry box(double lonMin, double latMin, double lonMax, double latMax) {
        return geometryFactory.toGeometry(new Envelope(lonMin, lonMax, latMin, latMax));
    }

    private static Map<String, Object> item(String id, BigDecimal lat, BigDecimal lon) {
        Map<String, Object> item = new HashMap<>();
        item.put("id", id);
        item.put("position", PositionFormat.LATITUDE_LONGITUDE.write(new GeoPosition(lat, lon)));
        return item;
    }

    // 10 x 10 items at 48.03..48.93 / 10.03..10.93
    private void putGrid() {
        for (int i = 0; i < 10; i++) {
            for (int j = 0; j < 10; j++) {
                BigDecimal lat = new BigDecimal("48.03").add(new BigDecimal("0.1").multiply(BigDecimal.valueOf(i)));
                BigDecimal lon = new BigDecimal("10.03").add(new BigDecimal("0.1").multiply(BigDecimal.valueOf(j)));
                service.putItem(item(i + "-" + j, lat, lon));
            }
        }
    }

    private List<GeoItem> queryAll(Geometry polygon, int limit) {
        List<GeoItem> all = new ArrayList<>();
        String lastEvaluatedKey = null;
        int pages = 0;
        do {
            QueryResult page = service.query(polygon, limit, lastEvaluatedKey);
            assertTrue(page.getItems().size() <= limit);
            all.addAll(page.getItems());
            lastEvaluatedKey = page.getLastEvaluatedKey();
            assertTrue(++pages < 10_000, "query does not terminate");
        } while (lastEvaluatedKey != null);
        return all;
    }

    private static Set<String> ids(List<GeoItem> items) {
        Set<String> ids = new HashSet<>();
        for (GeoItem item : items) {
            assertTrue(ids.add(item.getString("id")), "duplicate item " + item.getString("id"));
        }
        return ids;
    }

    @Test
    void testSave() {
        // Given
        Map<String, Object> input = item("1", LAT, LON);
        input.put("foo", "bar");

        // When
        service.putItem(input);

        // Then
        GeoItem stored = store.getItem(Map.of("id", "1")).orElseThrow();
        assertEquals(1, store.scan().size());
        assertEquals("1", stored.get("id"));
        assertEquals(Map.of("latitude", LAT, "longitude", LON), stored.get("position"));
        assertEquals("bar", stored.get("foo"));
        assertEquals("u28", stored.get("_geohash_prefix"));
        assertEquals("u281z7j7ppzs", stored.get("_geohash"));
        assertEquals(1.0, meterRegistry.counter("geotable.items.written").count());
    }

    @Test
    void testPutItemWithoutPositionFails() {
        assertThrows(MissingPositionException.class, () -> service.putItem(Map.of("id", "1")));
        assertTrue(store.scan().isEmpty());
    }

    @Test
    void testPutItemKeepsExistingGeohashUnlessOverwriteIsEnabled() {
        Map<String, Object> input = item("1", LAT, LON);
        input.put("_geohash", "stale");

        assertThrows(IllegalArgumentException.class, () -> service.putItem(input));

        properties.setOverwriteExisting(true);
        assertEquals("u281z7j7ppzs", service.putItem(input).get("_geohash"));
    }

    @Test
    void testGetAndDeleteItem() {
        service.putItem(item("1", LAT, LON));

        assertTrue(service.getItem(Map.of("id", "1")).isPresent());
        assertTrue(service.deleteItem(Map.of("id", "1")));
        assertFalse(service.deleteItem(Map.of("id", "1")));
        assertTrue(service.getItem(Map.of("id", "1")).isEmpty());
    }

    @Test
    void testQueryReturnsItemInsideBox() {
        // Given
        service.putItem(item("1", LAT, LON));

        // When
        QueryResult result = service.query(box(11.0, 48.0, 12.0, 49.0), 10, null);

        // Then
        assertEquals(1, result.getItems().size());
        assertEquals("1", result.getItems().get(0).get("id"));
        assertNull(result.getLastEvaluatedKey());
    }

    @Test
    void testEmptyContinuationTokenStartsFirstPage() {
        // Given
        service.putItem(item("1", LAT, LON));
        Geometry area = box(11.0, 48.0, 12.0, 49.0);

        // When
        QueryResult result = service.query(area, 10, "");

        // Then
        assertEquals(1, result.getItems().size());
        assertEquals("1", result.getItems().get(0).get("id"));
        assertNull(result.getLastEvaluatedKey());
    }

    @Test
    void testQueryDisjointBoxReturnsEmptyPageWithoutContinuation() {
        service.putItem(item("1", LAT, LON));

        QueryResult result = service.query(box(0.0, 0.0, 1.0, 1.0), 10, null);

        assertTrue(result.getItems().isEmpty());
        assertNull(result.getLastEvaluatedKey());
    }

    @Test
    void testLimitOneWithTwoItemsInDifferentCells() {
        // Given
        service.putItem(item("1", LAT, LON));
        service.putItem(item("2", new BigDecimal("48.9"), new BigDecimal("11.1")));
        Geometry area = box(11.0, 48.0, 12.0, 49.0);

        // When
        QueryResult first = service.query(area, 1, null);
        QueryResult second = service.query(area, 1, first.getLastEvaluatedKey());

        // Then
        assertEquals(1, first.getItems().size());
        assertNotNull(first.getLastEvaluatedKey());
        assertEquals(1, second.getItems().size());
        assertNull(second.getLastEvaluatedKey());
        Set<String> ids = ids(List.of(first.getItems().get(0), second.getItems().get(0)));
        assertEquals(Set.of("1", "2"), ids);
    }

    @Test
    void testPaginationReturnsSameItemsForAnyLimit() {
        putGrid();
        Geometry area = box(10.0, 48.0, 11.0, 49.0);

        for (int limit : new int[]{1, 3, 10, 64, 1000}) {
            Set<String> ids = ids(queryAll(area, limit));
            assertEquals(100, ids.size(), "limit " + limit);
        }
    }

    @Test
    void testQueryReturnsOnlyItemsInsidePolygon() throws Exception {
        // Given
        putGrid();
        Geometry triangle = new WKTReader(geometryFactory).read("POLYGON ((10 48, 11 48, 10 49, 10 48))");

        // When
        List<GeoItem> items = queryAll(triangle, 7);

        // Then
        Set<String> ids = ids(items);
        assertEquals(55, ids.size());
        for (String id : ids) {
            String[] ij = id.split("-");
            assertTrue(Integer.parseInt(ij[0]) + Integer.parseInt(ij[1]) <= 9, "item " + id + " outside polygon");
        }
        assertTrue(meterRegistry.counter("geotable.query.false_positives").count() > 0);
    }

    @Test
    void testContinuationForOtherAreaIsRejected() {
        putGrid();
        QueryResult first = service.query(box(10.0, 48.0, 11.0, 49.0), 5, null);
        assertNotNull(first.getLastEvaluatedKey());

        assertThrows(InvalidCursorException.class,
                () -> service.query(box(10.0, 48.0, 10.5, 49.0), 5, first.getLastEvaluatedKey()));
        assertThrows(InvalidCursorException.class,
                () -> service.query(box(10.0, 48.0, 11.0, 49.0), 5, "garbage"));
    }

    @Test
    void testContinuationAcceptsDifferentLimit() {
        putGrid();
        Geometry area = box(10.0, 48.0, 11.0, 49.0);

        QueryResult first = service.query(area, 30, null);
        List<GeoItem> rest = new ArrayList<>(first.getItems());
        String lastEvaluatedKey = first.getLastEvaluatedKey();
        while (lastEvaluatedKey != null) {
            QueryResult page = service.query(area, 17, lastEvaluatedKey);
            rest.addAll(page.getItems());
            lastEvaluatedKey = page.getLastEvaluatedKey();
        }

        assertEquals(30, first.getItems().size());
        assertEquals(100, ids(rest).size());
    }

    @Test
    void testInvalidArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.query(box(10.0, 48.0, 11.0, 49.0), 0, null));
        assertThrows(IllegalArgumentException.class, () -> service.query(geometryFactory.createPolygon(), 10, null));
        assertThrows(QueryTooLargeException.class, () -> service.query(box(-180.0, -90.0, 180.0, 90.0), 10, null));
    }

    @Test
    void testQueryMetricsAreRecorded() {
        putGrid();

        service.query(box(10.0, 48.0, 11.0, 49.0), 1000, null);

        assertEquals(1.0, meterRegistry.counter("geotable.query.requests").count());
        assertEquals(24.0, meterRegistry.counter("geotable.query.cell_queries").count());
        assertEquals(100.0, meterRegistry.counter("geotable.query.rows_scanned").count());
        assertEquals(0.0, meterRegistry.counter("geotable.query.false_positives").count());
    }
}
