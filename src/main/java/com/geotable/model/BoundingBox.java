package com.geotable.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Envelope;

/**
 * Rectangular lat/lon region. Edges are inclusive.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BoundingBox {

    public static final double MIN_LAT = -90.0;
    public static final double MAX_LAT = 90.0;
    public static final double MIN_LON = -180.0;
    public static final double MAX_LON = 180.0;

    private double latMin;
    private double latMax;
    private double lonMin;
    private double lonMax;

    /**
     * Build from a JTS envelope, where x is longitude and y is latitude
     */
    public static BoundingBox fromEnvelope(Envelope envelope) {
        return new BoundingBox(envelope.getMinY(), envelope.getMaxY(), envelope.getMinX(), envelope.getMaxX());
    }

    /**
     * Copy of this box restricted to the coordinate domain.
     * A box wider than the whole longitude range collapses to the full range.
     */
    public BoundingBox clamped() {
        double newLonMin = lonMin;
        double newLonMax = lonMax;
        if (newLonMax - newLonMin >= MAX_LON - MIN_LON) {
            newLonMin = MIN_LON;
            newLonMax = MAX_LON;
        }
        return new BoundingBox(
                clamp(latMin, MIN_LAT, MAX_LAT),
                clamp(latMax, MIN_LAT, MAX_LAT),
                clamp(newLonMin, MIN_LON, MAX_LON),
                clamp(newLonMax, MIN_LON, MAX_LON));
    }

    public boolean contains(double lat, double lon) {
        return lat >= latMin && lat <= latMax && lon >= lonMin && lon <= lonMax;
    }

    @JsonIgnore
    public double getCenterLat() {
        return (latMin + latMax) / 2.0;
    }

    @JsonIgnore
    public double getCenterLon() {
        return (lonMin + lonMax) / 2.0;
    }

    public Envelope toEnvelope() {
        return new Envelope(lonMin, lonMax, latMin, latMax);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
