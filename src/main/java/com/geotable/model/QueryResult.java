package com.geotable.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.List;

/**
 * One page of a polygon query. A null {@code lastEvaluatedKey} means there are no further pages.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResult {

    List<GeoItem> items;
    String lastEvaluatedKey;
}
