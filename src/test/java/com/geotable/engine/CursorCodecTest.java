package com.geotable.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geotable.config.GeoTableConfiguration;
import com.geotable.config.GeoTableProperties;
import com.geotable.exception.InvalidCursorException;
import com.geotable.model.BoundingBox;
import com.geotable.model.CellCursor;
import com.geotable.model.GeoQueryCursor;
import com.geotable.model.QueryPlan;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CursorCodecTest {

    private final ObjectMapper objectMapper = new GeoTableConfiguration().objectMapper();
    private final CursorCodec codec = new CursorCodec(objectMapper, new GeoTableProperties());

    private static final QueryPlan PLAN = QueryPlan.builder()
            .precision(4)
            .cells(List.of("u0xy", "u281", "u283"))
            .boundingBox(new BoundingBox(48.0, 49.0, 11.0, 12.0))
            .build();

    private static GeoQueryCursor cursor(QueryPlan plan, Map<String, CellCursor> cells) {
        return GeoQueryCursor.builder()
                .type(GeoQueryCursor.TYPE)
                .version(GeoQueryCursor.CURRENT_VERSION)
                .plan(plan)
                .cells(cells)
                .build();
    }

    @Test
    void testDecodeRestoresEncodedCursor() {
        GeoQueryCursor original = cursor(PLAN, Map.of(
                "u281", CellCursor.resumeAt("u281", "dTI4MXo3ajdwcHpzADE"),
                "u283", CellCursor.start("u283")));

        String token = codec.encode(original);
        GeoQueryCursor decoded = codec.decode(token);

        assertEquals(original, decoded);
        assertFalse(token.contains("="));
        assertFalse(token.contains("+"));
    }

    @Test
    void testDecodeRejectsGarbage() {
        assertThrows(InvalidCursorException.class, () -> codec.decode("not a token!"));
        assertThrows(InvalidCursorException.class, () -> codec.decode(encodeJson("{\"foo\": 1}")));
        assertThrows(InvalidCursorException.class, () -> codec.decode(encodeJson("[1, 2, 3]")));
    }

    @Test
    void testDecodeRejectsWrongTypeOrVersion() {
        GeoQueryCursor wrongType = GeoQueryCursor.builder()
                .type("something-else")
                .version(GeoQueryCursor.CURRENT_VERSION)
                .plan(PLAN)
                .cells(Map.of("u281", CellCursor.start("u281")))
                .build();
        GeoQueryCursor wrongVersion = GeoQueryCursor.builder()
                .type(GeoQueryCursor.TYPE)
                .version(99)
                .plan(PLAN)
                .cells(Map.of("u281", CellCursor.start("u281")))
                .build();

        assertThrows(InvalidCursorException.class, () -> codec.decode(codec.encode(wrongType)));
        assertThrows(InvalidCursorException.class, () -> codec.decode(codec.encode(wrongVersion)));
    }

    @Test
    void testDecodeRejectsCellsOutsidePlan() {
        String token = codec.encode(cursor(PLAN, Map.of("u28k", CellCursor.start("u28k"))));

        assertThrows(InvalidCursorException.class, () -> codec.decode(token));
    }

    @Test
    void testDecodeRejectsExhaustedPendingCell() {
        String token = codec.encode(cursor(PLAN, Map.of("u281", CellCursor.exhausted("u281"))));

        assertThrows(InvalidCursorException.class, () -> codec.decode(token));
    }

    @Test
    void testDecodeRejectsPlanWithInvalidCells() {
        QueryPlan badPlan = QueryPlan.builder()
                .precision(4)
                .cells(List.of("u28"))
                .boundingBox(PLAN.getBoundingBox())
                .build();
        QueryPlan tooCoarse = QueryPlan.builder()
                .precision(2)
                .cells(List.of("u2"))
                .boundingBox(PLAN.getBoundingBox())
                .build();

        assertThrows(InvalidCursorException.class,
                () -> codec.decode(codec.encode(cursor(badPlan, Map.of("u28", CellCursor.start("u28"))))));
        assertThrows(InvalidCursorException.class,
                () -> codec.decode(codec.encode(cursor(tooCoarse, Map.of("u2", CellCursor.start("u2"))))));
    }

    private static String encodeJson(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }
}
