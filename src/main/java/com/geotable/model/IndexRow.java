package com.geotable.model;

import lombok.Value;

/**
 * Row returned by an index query together with the store token that resumes right after it
 */
@Value
public class IndexRow {

    GeoItem item;
    String resumeToken;
}
