package com.geotable.statistics;

import com.geotable.config.GeoTableProperties;
import com.geotable.engine.CellCoveringPlanner;
import com.geotable.exception.QueryTooLargeException;
import com.geotable.model.BoundingBox;
import com.geotable.model.GeoPosition;
import com.geotable.model.GeohashCell;
import com.geotable.model.GeohashStatistic;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Reads item counts for an area, at the finest precision step the cell budget allows
 */
@Service
public class StatisticsQueryService {

    private static final Logger logger = LoggerFactory.getLogger(StatisticsQueryService.class);

    private final StatisticsStore statisticsStore;
    private final CellCoveringPlanner planner;
    private final GeoTableProperties properties;
    private final GeometryFactory geometryFactory;

    public StatisticsQueryService(StatisticsStore statisticsStore,
                                  CellCoveringPlanner planner,
                                  GeoTableProperties properties,
                                  GeometryFactory geometryFactory) {
        this.statisticsStore = statisticsStore;
        this.planner = planner;
        this.properties = properties;
        this.geometryFactory = geometryFactory;
    }

    /**
     * Item counts of the cells intersecting the polygon
     *
     * @throws QueryTooLargeException if even the coarsest step needs too many cells
     */
    public List<GeohashStatistic> query(Geometry polygon) {
        BoundingBox box = BoundingBox.fromEnvelope(polygon.getEnvelopeInternal()).clamped();
        int precision = choosePrecision(box);
        int prefixLength = properties.getPrefixLength();

        PreparedGeometry area = PreparedGeometryFactory.prepare(polygon);
        List<GeohashStatistic> results = new ArrayList<>();
        for (String cell : planner.coveringCells(box, precision)) {
            Optional<GeohashStatistic> entry = statisticsStore.get(cell.substring(0, prefixLength), cell);
            if (entry.isEmpty()) {
                continue;
            }
            BoundingBox bounds = GeohashCell.of(cell).getBoundingBox();
            if (!area.intersects(geometryFactory.toGeometry(bounds.toEnvelope()))) {
                continue;
            }
            results.add(entry.get().toBuilder()
                    .center(new GeoPosition(BigDecimal.valueOf(bounds.getCenterLat()), BigDecimal.valueOf(bounds.getCenterLon())))
                    .boundaries(bounds)
                    .build());
        }
        results.sort(Comparator.comparing(GeohashStatistic::getGeohash));
        logger.debug("Statistics query at precision {} returned {} cells", precision, results.size());
        return results;
    }

    private int choosePrecision(BoundingBox box) {
        List<Integer> steps = new ArrayList<>(properties.getStatistics().getPrecisionSteps());
        steps.sort(Comparator.reverseOrder());
        long coarsestCount = 0;
        for (int step : steps) {
            coarsestCount = planner.countCells(box, step);
            if (coarsestCount <= planner.getMaxCells()) {
                return step;
            }
        }
        throw new QueryTooLargeException(coarsestCount, planner.getMaxCells());
    }
}
