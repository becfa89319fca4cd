package com.geotable;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Geo table application: geohash indexed items with paginated polygon queries
 */
@SpringBootApplication
public class GeoTableApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeoTableApplication.class, args);
    }
}
