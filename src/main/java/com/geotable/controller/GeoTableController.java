package com.geotable.controller;

import com.geotable.aspect.TimingAspect;
import com.geotable.config.GeoTableProperties;
import com.geotable.exception.InvalidCoordinateException;
import com.geotable.exception.InvalidCursorException;
import com.geotable.exception.MissingPositionException;
import com.geotable.exception.QueryTooLargeException;
import com.geotable.exception.StoreException;
import com.geotable.model.GeoItem;
import com.geotable.model.GeohashStatistic;
import com.geotable.model.QueryResult;
import com.geotable.model.param.QueryParam;
import com.geotable.model.param.StatisticsQueryParam;
import com.geotable.model.result.ApiResponse;
import com.geotable.service.GeoTableService;
import com.geotable.statistics.StatisticsQueryService;
import com.geotable.statistics.StatisticsStreamHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP REST API for items, polygon queries and item statistics
 */
@RestController
@RequestMapping("/api/v1")
@Slf4j
public class GeoTableController {

    @Autowired
    private GeoTableService geoTableService;

    @Autowired
    private StatisticsQueryService statisticsQueryService;

    @Autowired
    private StatisticsStreamHandler statisticsStreamHandler;

    @Autowired
    private GeoTableProperties properties;

    /**
     * Store an item
     * HTTP: PUT /api/v1/items
     */
    @PutMapping("/items")
    public ResponseEntity<ApiResponse<GeoItem>> putItem(@RequestBody Map<String, Object> item) {
        try {
            GeoItem stored = geoTableService.putItem(item);
            return ResponseEntity.ok(ApiResponse.success(stored, TimingAspect.getAndClearExecutionTime()));
        } catch (Exception e) {
            log.error("Error storing item", e);
            return errorResponse(e);
        }
    }

    /**
     * Get an item by primary key
     * HTTP: GET /api/v1/items/{key}?sortKey=...
     */
    @GetMapping("/items/{key}")
    public ResponseEntity<ApiResponse<GeoItem>> getItem(@PathVariable String key,
                                                        @RequestParam(required = false) String sortKey) {
        try {
            Optional<GeoItem> item = geoTableService.getItem(primaryKey(key, sortKey));
            if (item.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error("Item not found: " + key));
            }
            return ResponseEntity.ok(ApiResponse.success(item.get(), TimingAspect.getAndClearExecutionTime()));
        } catch (Exception e) {
            log.error("Error getting item {}", key, e);
            return errorResponse(e);
        }
    }

    /**
     * Delete an item by primary key
     * HTTP: DELETE /api/v1/items/{key}?sortKey=...
     */
    @DeleteMapping("/items/{key}")
    public ResponseEntity<ApiResponse<Boolean>> deleteItem(@PathVariable String key,
                                                           @RequestParam(required = false) String sortKey) {
        try {
            boolean deleted = geoTableService.deleteItem(primaryKey(key, sortKey));
            if (!deleted) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error("Item not found: " + key));
            }
            return ResponseEntity.ok(ApiResponse.success(true, TimingAspect.getAndClearExecutionTime()));
        } catch (Exception e) {
            log.error("Error deleting item {}", key, e);
            return errorResponse(e);
        }
    }

    /**
     * One page of the items inside a polygon
     * HTTP: POST /api/v1/query
     */
    @PostMapping("/query")
    public ResponseEntity<ApiResponse<QueryResult>> query(@RequestBody QueryParam param) {
        if (param.getPolygon() == null) {
            return ResponseEntity.badRequest().body(ApiResponse.error("polygon is required"));
        }
        try {
            QueryResult result = geoTableService.query(param.getPolygon(), param.getLimit(), param.getExclusiveStartKey());
            return ResponseEntity.ok(ApiResponse.success(result, TimingAspect.getAndClearExecutionTime()));
        } catch (Exception e) {
            log.error("Error querying polygon", e);
            return errorResponse(e);
        }
    }

    /**
     * Item counts of the cells intersecting a polygon
     * HTTP: POST /api/v1/statistics/query
     */
    @PostMapping("/statistics/query")
    public ResponseEntity<ApiResponse<List<GeohashStatistic>>> queryStatistics(@RequestBody StatisticsQueryParam param) {
        if (param.getPolygon() == null) {
            return ResponseEntity.badRequest().body(ApiResponse.error("polygon is required"));
        }
        try {
            long startTime = System.currentTimeMillis();
            List<GeohashStatistic> statistics = statisticsQueryService.query(param.getPolygon());
            long duration = System.currentTimeMillis() - startTime;
            return ResponseEntity.ok(ApiResponse.success(statistics, duration + "ms"));
        } catch (Exception e) {
            log.error("Error querying statistics", e);
            return errorResponse(e);
        }
    }

    /**
     * Rebuild the item statistics from the whole table
     * HTTP: POST /api/v1/statistics/reprocess
     */
    @PostMapping("/statistics/reprocess")
    public ResponseEntity<ApiResponse<Boolean>> reprocessStatistics() {
        try {
            long startTime = System.currentTimeMillis();
            statisticsStreamHandler.reprocessFullTable();
            long duration = System.currentTimeMillis() - startTime;
            return ResponseEntity.ok(ApiResponse.success(true, duration + "ms"));
        } catch (Exception e) {
            log.error("Error rebuilding statistics", e);
            return errorResponse(e);
        }
    }

    private Map<String, Object> primaryKey(String key, String sortKey) {
        Map<String, Object> primaryKey = new HashMap<>();
        primaryKey.put(properties.getPartitionKeyField(), key);
        if (properties.getSortKeyField() != null) {
            if (sortKey == null) {
                throw new IllegalArgumentException("sortKey is required");
            }
            primaryKey.put(properties.getSortKeyField(), sortKey);
        }
        return primaryKey;
    }

    private static <T> ResponseEntity<ApiResponse<T>> errorResponse(Exception e) {
        return ResponseEntity.status(statusOf(e)).body(ApiResponse.error(e.getMessage()));
    }

    static HttpStatus statusOf(Exception e) {
        if (e instanceof InvalidCursorException
                || e instanceof InvalidCoordinateException
                || e instanceof MissingPositionException
                || e instanceof QueryTooLargeException
                || e instanceof IllegalArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof StoreException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
