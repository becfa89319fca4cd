package com.geotable.engine;

import com.geotable.exception.GeoTableException;
import com.geotable.exception.InvalidCoordinateException;
import com.geotable.exception.MissingPositionException;
import com.geotable.exception.StoreException;
import com.geotable.model.CellCursor;
import com.geotable.model.GeoItem;
import com.geotable.model.GeoPosition;
import com.geotable.model.IndexPage;
import com.geotable.model.IndexRow;
import com.geotable.model.QueryPlan;
import com.geotable.model.RangeQuery;
import com.geotable.repository.GeoIndexStore;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs the range queries of one page, drops geohash false positives and merges
 * the surviving rows of all cells into a single page.
 *
 * <p>Rows are consumed per cell in index order. A cell stops where the page filled
 * up and resumes from the token of its last consumed row on the next call; a cell
 * whose range was read to the end is exhausted and never queried again.</p>
 */
@Component
public class ResultMerger {

    private static final Logger logger = LoggerFactory.getLogger(ResultMerger.class);

    private final GeoIndexStore geoIndexStore;
    private final RangeQueryTranslator translator;
    private final GeoItemEnricher enricher;
    private final Executor executor;
    private final GeometryFactory geometryFactory;

    public ResultMerger(GeoIndexStore geoIndexStore,
                        RangeQueryTranslator translator,
                        GeoItemEnricher enricher,
                        @Qualifier("geoQueryExecutor") Executor executor,
                        GeometryFactory geometryFactory) {
        this.geoIndexStore = geoIndexStore;
        this.translator = translator;
        this.enricher = enricher;
        this.executor = executor;
        this.geometryFactory = geometryFactory;
    }

    /**
     * Read the next page of a query
     *
     * @param plan    the fixed covering of the query
     * @param cursors state of pending cells; cells missing here or marked exhausted are skipped
     * @param polygon the query area rows must lie in
     * @param limit   maximum number of items in the page
     * @throws GeoTableException if any cell query fails; no partial page is returned
     */
    public MergeResult advance(QueryPlan plan, Map<String, CellCursor> cursors, Geometry polygon, int limit) {
        Map<String, CompletableFuture<IndexPage>> pages = new LinkedHashMap<>();
        for (String cell : plan.getCells()) {
            CellCursor cursor = cursors.get(cell);
            if (cursor == null || cursor.isExhausted()) {
                continue;
            }
            RangeQuery query = translator.translate(cell, cursor, limit);
            try {
                pages.put(cell, CompletableFuture.supplyAsync(() -> geoIndexStore.query(query), executor));
            } catch (RejectedExecutionException e) {
                pages.values().forEach(page -> page.cancel(true));
                throw new StoreException("Range query for cell " + cell + " rejected by the query executor", e);
            }
        }
        awaitAll(pages);

        PreparedGeometry area = PreparedGeometryFactory.prepare(polygon);
        List<GeoItem> items = new ArrayList<>();
        Map<String, CellCursor> nextCursors = new LinkedHashMap<>();
        int rowsScanned = 0;
        int falsePositives = 0;
        int unreadableRows = 0;
        boolean hasMore = false;

        for (String cell : plan.getCells()) {
            CompletableFuture<IndexPage> future = pages.get(cell);
            if (future == null) {
                nextCursors.put(cell, CellCursor.exhausted(cell));
                continue;
            }
            CellCursor cursor = cursors.get(cell);
            IndexPage page = future.join();
            List<IndexRow> rows = page.getRows();

            String lastConsumedToken = null;
            int consumed = 0;
            for (IndexRow row : rows) {
                GeoPosition position = positionOf(row.getItem());
                boolean inside = position != null
                        && area.contains(geometryFactory.createPoint(position.toCoordinate()));
                if (inside && items.size() >= limit) {
                    break;
                }
                if (inside) {
                    items.add(row.getItem());
                } else if (position == null) {
                    unreadableRows++;
                } else {
                    falsePositives++;
                }
                lastConsumedToken = row.getResumeToken();
                consumed++;
            }
            rowsScanned += rows.size();

            CellCursor next;
            if (consumed < rows.size()) {
                next = consumed == 0 ? cursor : CellCursor.resumeAt(cell, lastConsumedToken);
            } else if (page.getLastEvaluatedKey() == null || rows.size() < limit) {
                next = CellCursor.exhausted(cell);
            } else {
                next = CellCursor.resumeAt(cell, page.getLastEvaluatedKey());
            }
            nextCursors.put(cell, next);
            hasMore |= !next.isExhausted();
        }

        logger.debug("Merged {} items from {} cell queries, scanned {} rows, dropped {} false positives "
                        + "and {} unreadable rows, more: {}",
                items.size(), pages.size(), rowsScanned, falsePositives, unreadableRows, hasMore);

        return MergeResult.builder()
                .items(items)
                .cells(nextCursors)
                .hasMore(hasMore)
                .cellQueries(pages.size())
                .rowsScanned(rowsScanned)
                .falsePositives(falsePositives)
                .unreadableRows(unreadableRows)
                .build();
    }

    // Null for indexed rows whose position cannot be read
    private GeoPosition positionOf(GeoItem item) {
        try {
            return enricher.readPosition(item);
        } catch (MissingPositionException | InvalidCoordinateException e) {
            logger.warn("Skipping indexed item without readable position: {}", e.getMessage());
            return null;
        }
    }

    private static void awaitAll(Map<String, CompletableFuture<IndexPage>> pages) {
        try {
            CompletableFuture.allOf(pages.values().toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof GeoTableException) {
                throw (GeoTableException) cause;
            }
            throw new StoreException("Range query failed: " + cause.getMessage(), cause);
        }
    }
}
