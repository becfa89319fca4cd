package com.geotable.engine;

import com.geotable.model.CellCursor;
import com.geotable.model.GeoItem;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Output of one {@link ResultMerger#advance} call
 */
@Value
@Builder
public class MergeResult {

    List<GeoItem> items;

    /**
     * State of every plan cell after this page, in plan order
     */
    Map<String, CellCursor> cells;

    boolean hasMore;

    int cellQueries;
    int rowsScanned;
    int falsePositives;

    /**
     * Indexed rows dropped because their position attribute is missing or malformed
     */
    int unreadableRows;

    /**
     * Cells that still have rows to read
     */
    public Map<String, CellCursor> pendingCells() {
        return cells.entrySet().stream()
                .filter(entry -> !entry.getValue().isExhausted())
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                        (a, b) -> a, LinkedHashMap::new));
    }
}
