package com.geotable.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geotable.config.GeoTableProperties;
import com.geotable.exception.InvalidCursorException;
import com.geotable.geohash.Geohash;
import com.geotable.model.CellCursor;
import com.geotable.model.GeoQueryCursor;
import com.geotable.model.QueryPlan;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Converts query cursors to and from the opaque continuation token handed to callers.
 * The token is Base64-URL encoded JSON carrying a type tag and a version.
 */
@Component
public class CursorCodec {

    private final ObjectMapper objectMapper;
    private final int prefixLength;
    private final int fullPrecision;

    public CursorCodec(ObjectMapper objectMapper, GeoTableProperties properties) {
        this.objectMapper = objectMapper;
        this.prefixLength = properties.getPrefixLength();
        this.fullPrecision = properties.getFullPrecision();
    }

    public String encode(GeoQueryCursor cursor) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(cursor);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize query cursor", e);
        }
    }

    /**
     * @throws InvalidCursorException if the token is not a cursor this codec produced
     */
    public GeoQueryCursor decode(String token) {
        GeoQueryCursor cursor;
        try {
            byte[] json = Base64.getUrlDecoder().decode(token.getBytes(StandardCharsets.US_ASCII));
            cursor = objectMapper.readValue(json, GeoQueryCursor.class);
        } catch (IllegalArgumentException | IOException e) {
            throw new InvalidCursorException("Continuation token cannot be decoded", e);
        }
        validate(cursor);
        return cursor;
    }

    private void validate(GeoQueryCursor cursor) {
        if (cursor == null || !GeoQueryCursor.TYPE.equals(cursor.getType())) {
            throw new InvalidCursorException("Continuation token is not a query cursor");
        }
        if (cursor.getVersion() != GeoQueryCursor.CURRENT_VERSION) {
            throw new InvalidCursorException("Unsupported cursor version " + cursor.getVersion());
        }
        QueryPlan plan = cursor.getPlan();
        if (plan == null || plan.getCells() == null || plan.getCells().isEmpty() || plan.getBoundingBox() == null) {
            throw new InvalidCursorException("Cursor carries no query plan");
        }
        int precision = plan.getPrecision();
        if (precision < prefixLength || precision > fullPrecision) {
            throw new InvalidCursorException("Cursor plan precision " + precision + " does not match the index");
        }
        Set<String> planCells = new HashSet<>();
        for (String cell : plan.getCells()) {
            if (cell == null || cell.length() != precision || !Geohash.isValid(cell)) {
                throw new InvalidCursorException("Cursor plan contains invalid cell '" + cell + "'");
            }
            planCells.add(cell);
        }
        if (cursor.getCells() == null || cursor.getCells().isEmpty()) {
            throw new InvalidCursorException("Cursor has no pending cells");
        }
        for (Map.Entry<String, CellCursor> entry : cursor.getCells().entrySet()) {
            CellCursor cell = entry.getValue();
            if (!planCells.contains(entry.getKey()) || cell == null || !entry.getKey().equals(cell.getPrefix())) {
                throw new InvalidCursorException("Cursor cell '" + entry.getKey() + "' is not part of its plan");
            }
            if (cell.isExhausted()) {
                throw new InvalidCursorException("Cursor lists exhausted cell '" + entry.getKey() + "' as pending");
            }
        }
    }
}
