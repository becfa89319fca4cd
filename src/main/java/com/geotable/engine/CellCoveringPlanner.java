package com.geotable.engine;

import com.geotable.config.GeoTableProperties;
import com.geotable.exception.QueryTooLargeException;
import com.geotable.geohash.Geohash;
import com.geotable.model.BoundingBox;
import com.geotable.model.QueryPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Chooses the geohash cells a query reads.
 *
 * <p>Finer cells mean fewer false positives but more range queries, so the planner
 * picks the finest precision whose covering still fits the cell budget. Planning never
 * goes below the index prefix length since every range query needs a full partition key.</p>
 */
@Component
public class CellCoveringPlanner {

    private static final Logger logger = LoggerFactory.getLogger(CellCoveringPlanner.class);

    private final int prefixLength;
    private final int fullPrecision;
    private final int maxCells;

    public CellCoveringPlanner(GeoTableProperties properties) {
        this.prefixLength = properties.getPrefixLength();
        this.fullPrecision = properties.getFullPrecision();
        this.maxCells = properties.getMaxCellsPerQuery();
    }

    /**
     * Compute the covering of a query box
     *
     * @throws QueryTooLargeException if even index partitions are too many
     */
    public QueryPlan plan(BoundingBox boundingBox) {
        BoundingBox box = boundingBox.clamped();

        long count = countCells(box, prefixLength);
        if (count > maxCells) {
            throw new QueryTooLargeException(count, maxCells);
        }

        int precision = prefixLength;
        while (precision < fullPrecision) {
            long finer = countCells(box, precision + 1);
            if (finer > maxCells) {
                break;
            }
            precision++;
            count = finer;
        }

        List<String> cells = coveringCells(box, precision);
        logger.debug("Planned {} cells at precision {} for box {}", count, precision, box);
        return QueryPlan.builder()
                .precision(precision)
                .cells(cells)
                .boundingBox(box)
                .build();
    }

    /**
     * Number of cells of the given precision intersecting the box
     */
    public long countCells(BoundingBox boundingBox, int precision) {
        long[][] corners = cornerIndexes(boundingBox.clamped(), precision);
        return (corners[1][0] - corners[0][0] + 1) * (corners[1][1] - corners[0][1] + 1);
    }

    /**
     * All cells of the given precision intersecting the box, in lexicographic order
     */
    public List<String> coveringCells(BoundingBox boundingBox, int precision) {
        long[][] corners = cornerIndexes(boundingBox.clamped(), precision);
        List<String> cells = new ArrayList<>();
        for (long y = corners[0][1]; y <= corners[1][1]; y++) {
            for (long x = corners[0][0]; x <= corners[1][0]; x++) {
                cells.add(Geohash.fromGridIndex(x, y, precision));
            }
        }
        Collections.sort(cells);
        return cells;
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    public int getMaxCells() {
        return maxCells;
    }

    // South-west and north-east corner cells; every cell in between is a neighbor along both axes
    private static long[][] cornerIndexes(BoundingBox box, int precision) {
        long[] southWest = Geohash.toGridIndex(Geohash.encode(box.getLatMin(), box.getLonMin(), precision));
        long[] northEast = Geohash.toGridIndex(Geohash.encode(box.getLatMax(), box.getLonMax(), precision));
        return new long[][]{
                {Math.min(southWest[0], northEast[0]), Math.min(southWest[1], northEast[1])},
                {Math.max(southWest[0], northEast[0]), Math.max(southWest[1], northEast[1])}
        };
    }
}
