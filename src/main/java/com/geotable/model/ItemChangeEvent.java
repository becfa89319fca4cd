package com.geotable.model;

import lombok.Builder;
import lombok.Value;

/**
 * Change record of one item, as published by the table after a write.
 * {@code oldImage} is null for inserts and {@code newImage} is null for removals.
 */
@Value
@Builder
public class ItemChangeEvent {

    public enum Type {
        INSERT,
        MODIFY,
        REMOVE
    }

    String eventId;
    Type type;
    GeoItem oldImage;
    GeoItem newImage;
}
