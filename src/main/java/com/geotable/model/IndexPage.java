package com.geotable.model;

import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Rows of one index query in ascending sort key order.
 * {@code lastEvaluatedKey} is null when the queried range has no further rows.
 */
@Value
public class IndexPage {

    List<IndexRow> rows;
    String lastEvaluatedKey;

    public static IndexPage empty() {
        return new IndexPage(Collections.emptyList(), null);
    }
}
