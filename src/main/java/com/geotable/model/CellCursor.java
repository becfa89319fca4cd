package com.geotable.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Pagination state of one covering cell.
 * A null token on a cell that is not exhausted means the cell has not been read yet.
 */
@Value
@Builder
@Jacksonized
public class CellCursor {

    String prefix;

    /**
     * Store continuation token, passed back verbatim
     */
    String token;

    boolean exhausted;

    public static CellCursor start(String prefix) {
        return new CellCursor(prefix, null, false);
    }

    public static CellCursor resumeAt(String prefix, String token) {
        return new CellCursor(prefix, token, false);
    }

    public static CellCursor exhausted(String prefix) {
        return new CellCursor(prefix, null, true);
    }
}
