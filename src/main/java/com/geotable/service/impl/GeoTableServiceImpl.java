package com.geotable.service.impl;

import com.geotable.aspect.Timed;
import com.geotable.config.GeoTableProperties;
import com.geotable.engine.CellCoveringPlanner;
import com.geotable.engine.CursorCodec;
import com.geotable.engine.GeoItemEnricher;
import com.geotable.engine.MergeResult;
import com.geotable.engine.ResultMerger;
import com.geotable.exception.InvalidCursorException;
import com.geotable.model.BoundingBox;
import com.geotable.model.CellCursor;
import com.geotable.model.GeoItem;
import com.geotable.model.GeoQueryCursor;
import com.geotable.model.QueryPlan;
import com.geotable.model.QueryResult;
import com.geotable.repository.GeoIndexStore;
import com.geotable.service.GeoTableService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Geo table service over the geohash index of a {@link GeoIndexStore}
 */
@Service
public class GeoTableServiceImpl implements GeoTableService {

    private static final Logger logger = LoggerFactory.getLogger(GeoTableServiceImpl.class);

    @Autowired
    GeoIndexStore geoIndexStore;

    @Autowired
    CellCoveringPlanner planner;

    @Autowired
    ResultMerger merger;

    @Autowired
    CursorCodec cursorCodec;

    @Autowired
    GeoItemEnricher enricher;

    @Autowired
    GeoTableProperties properties;

    private final Counter queryCounter;
    private final Counter cellQueryCounter;
    private final Counter rowsScannedCounter;
    private final Counter falsePositiveCounter;
    private final Counter unreadableRowCounter;
    private final Counter itemsWrittenCounter;

    public GeoTableServiceImpl(MeterRegistry meterRegistry) {
        this.queryCounter = Counter.builder("geotable.query.requests")
                .description("Number of polygon query pages requested")
                .register(meterRegistry);

        this.cellQueryCounter = Counter.builder("geotable.query.cell_queries")
                .description("Number of range queries issued against the geohash index")
                .register(meterRegistry);

        this.rowsScannedCounter = Counter.builder("geotable.query.rows_scanned")
                .description("Number of index rows read by polygon queries")
                .register(meterRegistry);

        this.falsePositiveCounter = Counter.builder("geotable.query.false_positives")
                .description("Number of index rows dropped for lying outside the query polygon")
                .register(meterRegistry);

        this.unreadableRowCounter = Counter.builder("geotable.query.unreadable_rows")
                .description("Number of indexed rows dropped for lacking a readable position")
                .register(meterRegistry);

        this.itemsWrittenCounter = Counter.builder("geotable.items.written")
                .description("Number of items written")
                .register(meterRegistry);
    }

    @Override
    @Timed("query")
    public QueryResult query(Geometry polygon, int limit, String exclusiveStartKey) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1: " + limit);
        }
        if (polygon == null || polygon.isEmpty()) {
            throw new IllegalArgumentException("Query polygon must not be empty");
        }
        queryCounter.increment();

        BoundingBox box = BoundingBox.fromEnvelope(polygon.getEnvelopeInternal()).clamped();
        QueryPlan plan;
        Map<String, CellCursor> cursors;
        if (exclusiveStartKey == null || exclusiveStartKey.isEmpty()) {
            plan = planner.plan(box);
            cursors = new LinkedHashMap<>();
            for (String cell : plan.getCells()) {
                cursors.put(cell, CellCursor.start(cell));
            }
        } else {
            GeoQueryCursor cursor = cursorCodec.decode(exclusiveStartKey);
            if (!box.equals(cursor.getPlan().getBoundingBox())) {
                throw new InvalidCursorException("Continuation token belongs to a different query area");
            }
            plan = cursor.getPlan();
            cursors = cursor.getCells();
        }

        MergeResult result = merger.advance(plan, cursors, polygon, limit);

        cellQueryCounter.increment(result.getCellQueries());
        rowsScannedCounter.increment(result.getRowsScanned());
        falsePositiveCounter.increment(result.getFalsePositives());
        unreadableRowCounter.increment(result.getUnreadableRows());
        logger.debug("Query page: limit={}, cells={}, precision={}, queries={}, scanned={}, filtered={}, returned={}",
                limit, plan.size(), plan.getPrecision(), result.getCellQueries(), result.getRowsScanned(),
                result.getFalsePositives(), result.getItems().size());

        String lastEvaluatedKey = null;
        if (result.isHasMore()) {
            lastEvaluatedKey = cursorCodec.encode(GeoQueryCursor.builder()
                    .type(GeoQueryCursor.TYPE)
                    .version(GeoQueryCursor.CURRENT_VERSION)
                    .plan(plan)
                    .cells(result.pendingCells())
                    .build());
        }
        return new QueryResult(result.getItems(), lastEvaluatedKey);
    }

    @Override
    @Timed("putItem")
    public GeoItem putItem(Map<String, Object> item) {
        GeoItem enriched = enricher.enrich(GeoItem.of(item), properties.isOverwriteExisting());
        geoIndexStore.putItem(enriched);
        itemsWrittenCounter.increment();
        logger.debug("Stored item {} at geohash {}", enriched.get(properties.getPartitionKeyField()),
                enriched.get(properties.getGeohashField()));
        return enriched;
    }

    @Override
    @Timed("getItem")
    public Optional<GeoItem> getItem(Map<String, Object> key) {
        return geoIndexStore.getItem(key);
    }

    @Override
    @Timed("deleteItem")
    public boolean deleteItem(Map<String, Object> key) {
        boolean removed = geoIndexStore.deleteItem(key);
        if (removed) {
            logger.debug("Deleted item {}", key);
        }
        return removed;
    }
}
