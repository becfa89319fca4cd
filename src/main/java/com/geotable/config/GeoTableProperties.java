package com.geotable.config;

import com.geotable.engine.PositionFormat;
import com.geotable.geohash.Geohash;
import lombok.Data;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Table layout and query limits, bound from {@code geotable.*}
 */
@Data
@ConfigurationProperties(prefix = "geotable")
public class GeoTableProperties implements InitializingBean {

    /**
     * Primary key attribute of the table
     */
    private String partitionKeyField = "id";

    /**
     * Optional sort key attribute of the table
     */
    private String sortKeyField;

    private String positionField = "position";

    private PositionFormat positionFormat = PositionFormat.LATITUDE_LONGITUDE;

    private String geohashPrefixField = "_geohash_prefix";

    private String geohashField = "_geohash";

    /**
     * Length of the geohash prefix used as index partition key
     */
    private int prefixLength = 3;

    /**
     * Length of the geohash stored as index sort key
     */
    private int fullPrecision = 12;

    /**
     * Upper bound on covering cells, and therefore range queries, per page
     */
    private int maxCellsPerQuery = 128;

    /**
     * Whether writes may replace geohash attributes already present on the item
     */
    private boolean overwriteExisting = false;

    private int queryThreads = 16;

    private Statistics statistics = new Statistics();

    @Data
    public static class Statistics {

        /**
         * Whether item counts are maintained from the change records of the table
         */
        private boolean enabled = true;

        /**
         * Geohash precisions at which item counts are kept
         */
        private List<Integer> precisionSteps = new ArrayList<>(List.of(3, 5, 7));

        /**
         * Number of recent change record ids remembered to skip replays
         */
        private int dedupCapacity = 100_000;
    }

    @Override
    public void afterPropertiesSet() {
        validate();
    }

    /**
     * Check the settings against each other
     *
     * @throws IllegalStateException when the settings are inconsistent
     */
    public void validate() {
        if (prefixLength < 1 || prefixLength > fullPrecision || fullPrecision > Geohash.MAX_PRECISION) {
            throw new IllegalStateException(String.format(
                    "Require 1 <= prefix-length (%d) <= full-precision (%d) <= %d",
                    prefixLength, fullPrecision, Geohash.MAX_PRECISION));
        }
        if (maxCellsPerQuery < 1) {
            throw new IllegalStateException("max-cells-per-query must be positive: " + maxCellsPerQuery);
        }
        if (queryThreads < 1) {
            throw new IllegalStateException("query-threads must be positive: " + queryThreads);
        }
        if (statistics.getDedupCapacity() < 1) {
            throw new IllegalStateException("statistics.dedup-capacity must be positive: " + statistics.getDedupCapacity());
        }
        for (Integer step : statistics.getPrecisionSteps()) {
            if (step == null || step < prefixLength || step > fullPrecision) {
                throw new IllegalStateException(String.format(
                        "Statistics precision step %s outside [%d, %d]", step, prefixLength, fullPrecision));
            }
        }
    }
}
