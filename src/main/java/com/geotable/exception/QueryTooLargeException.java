package com.geotable.exception;

/**
 * The query area needs more index partitions than the configured cell budget allows
 */
public class QueryTooLargeException extends GeoTableException {

    private final long cellCount;
    private final int maxCells;

    public QueryTooLargeException(long cellCount, int maxCells) {
        super(String.format("The given polygon covers %d partitions. No more than %d are supported. "
                + "Please use a shorter prefix length to support querying larger areas.", cellCount, maxCells));
        this.cellCount = cellCount;
        this.maxCells = maxCells;
    }

    public long getCellCount() {
        return cellCount;
    }

    public int getMaxCells() {
        return maxCells;
    }
}
