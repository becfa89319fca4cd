package com.geotable.geohash;

import com.geotable.exception.InvalidCoordinateException;
import com.geotable.exception.InvalidGeohashException;
import com.geotable.model.BoundingBox;

import java.util.Arrays;

/**
 * Base-32 geohash encoding and decoding.
 *
 * <p>Bits alternate between longitude and latitude, starting with longitude.
 * A geohash of precision {@code p} carries {@code 5p} bits, of which {@code ceil(5p/2)}
 * belong to longitude and {@code floor(5p/2)} to latitude. The cells of one precision
 * form a uniform grid, which {@link #toGridIndex} and {@link #fromGridIndex} expose.</p>
 */
public final class Geohash {

    public static final int MAX_PRECISION = 12;

    private static final char[] BASE_32 = {
            '0', '1', '2', '3', '4', '5', '6', '7',
            '8', '9', 'b', 'c', 'd', 'e', 'f', 'g',
            'h', 'j', 'k', 'm', 'n', 'p', 'q', 'r',
            's', 't', 'u', 'v', 'w', 'x', 'y', 'z'};

    public static final char MIN_CHAR = BASE_32[0];
    public static final char MAX_CHAR = BASE_32[BASE_32.length - 1];

    private static final int[] BASE_32_IDX = new int['z' + 1];

    static {
        Arrays.fill(BASE_32_IDX, -1);
        for (int i = 0; i < BASE_32.length; i++) {
            BASE_32_IDX[BASE_32[i]] = i;
        }
    }

    private Geohash() {
    }

    /**
     * Encode a coordinate into a geohash of the given length
     *
     * @throws InvalidCoordinateException if the coordinate is outside the domain
     */
    public static String encode(double latitude, double longitude, int precision) {
        checkPrecision(precision);
        if (!(latitude >= BoundingBox.MIN_LAT && latitude <= BoundingBox.MAX_LAT)
                || !(longitude >= BoundingBox.MIN_LON && longitude <= BoundingBox.MAX_LON)) {
            throw new InvalidCoordinateException(latitude, longitude);
        }

        double latLow = BoundingBox.MIN_LAT;
        double latHigh = BoundingBox.MAX_LAT;
        double lonLow = BoundingBox.MIN_LON;
        double lonHigh = BoundingBox.MAX_LON;
        StringBuilder geohash = new StringBuilder(precision);
        boolean isLon = true;
        int bit = 0;
        int ch = 0;

        while (geohash.length() < precision) {
            if (isLon) {
                double mid = (lonLow + lonHigh) / 2.0;
                if (longitude > mid) {
                    ch |= 1 << (4 - bit);
                    lonLow = mid;
                } else {
                    lonHigh = mid;
                }
            } else {
                double mid = (latLow + latHigh) / 2.0;
                if (latitude > mid) {
                    ch |= 1 << (4 - bit);
                    latLow = mid;
                } else {
                    latHigh = mid;
                }
            }
            isLon = !isLon;
            if (bit < 4) {
                bit++;
            } else {
                geohash.append(BASE_32[ch]);
                bit = 0;
                ch = 0;
            }
        }
        return geohash.toString();
    }

    /**
     * Bounding box of the cell identified by a geohash or geohash prefix
     *
     * @throws InvalidGeohashException if the string is empty, too long or not base-32
     */
    public static BoundingBox decodeBoundingBox(String geohash) {
        long[] index = toGridIndex(geohash);
        int precision = geohash.length();
        double width = cellWidth(precision);
        double height = cellHeight(precision);
        double lonMin = BoundingBox.MIN_LON + index[0] * width;
        double latMin = BoundingBox.MIN_LAT + index[1] * height;
        return new BoundingBox(latMin, latMin + height, lonMin, lonMin + width);
    }

    /**
     * Column and row of the cell in the grid of its precision: {@code {x, y}},
     * where x counts longitude steps eastwards and y latitude steps northwards
     */
    public static long[] toGridIndex(String geohash) {
        validate(geohash);
        long x = 0;
        long y = 0;
        int bitIndex = 0;
        for (int i = 0; i < geohash.length(); i++) {
            int value = BASE_32_IDX[geohash.charAt(i)];
            for (int shift = 4; shift >= 0; shift--) {
                long bit = (value >> shift) & 1;
                if (bitIndex % 2 == 0) {
                    x = (x << 1) | bit;
                } else {
                    y = (y << 1) | bit;
                }
                bitIndex++;
            }
        }
        return new long[]{x, y};
    }

    /**
     * Geohash of the grid cell at column {@code x} and row {@code y}
     */
    public static String fromGridIndex(long x, long y, int precision) {
        checkPrecision(precision);
        int lonBits = lonBits(precision);
        int latBits = latBits(precision);
        if (x < 0 || x >= (1L << lonBits) || y < 0 || y >= (1L << latBits)) {
            throw new IllegalArgumentException(
                    String.format("Grid index (%d, %d) out of range for precision %d", x, y, precision));
        }
        char[] chars = new char[precision];
        int lonShift = lonBits - 1;
        int latShift = latBits - 1;
        int bitIndex = 0;
        for (int i = 0; i < precision; i++) {
            int value = 0;
            for (int b = 0; b < 5; b++) {
                long bit;
                if (bitIndex % 2 == 0) {
                    bit = (x >> lonShift--) & 1;
                } else {
                    bit = (y >> latShift--) & 1;
                }
                value = (value << 1) | (int) bit;
                bitIndex++;
            }
            chars[i] = BASE_32[value];
        }
        return new String(chars);
    }

    /**
     * Number of grid columns at the given precision
     */
    public static long columns(int precision) {
        return 1L << lonBits(precision);
    }

    /**
     * Number of grid rows at the given precision
     */
    public static long rows(int precision) {
        return 1L << latBits(precision);
    }

    public static double cellWidth(int precision) {
        return (BoundingBox.MAX_LON - BoundingBox.MIN_LON) / columns(precision);
    }

    public static double cellHeight(int precision) {
        return (BoundingBox.MAX_LAT - BoundingBox.MIN_LAT) / rows(precision);
    }

    public static boolean isValid(String geohash) {
        if (geohash == null || geohash.isEmpty() || geohash.length() > MAX_PRECISION) {
            return false;
        }
        for (int i = 0; i < geohash.length(); i++) {
            char c = geohash.charAt(i);
            if (c >= BASE_32_IDX.length || BASE_32_IDX[c] < 0) {
                return false;
            }
        }
        return true;
    }

    private static void validate(String geohash) {
        if (geohash == null || geohash.isEmpty()) {
            throw new InvalidGeohashException(String.valueOf(geohash), "empty");
        }
        if (geohash.length() > MAX_PRECISION) {
            throw new InvalidGeohashException(geohash, "longer than " + MAX_PRECISION + " characters");
        }
        if (!isValid(geohash)) {
            throw new InvalidGeohashException(geohash, "contains characters outside the base-32 alphabet");
        }
    }

    private static void checkPrecision(int precision) {
        if (precision < 1 || precision > MAX_PRECISION) {
            throw new IllegalArgumentException("Precision must be between 1 and " + MAX_PRECISION + ": " + precision);
        }
    }

    private static int lonBits(int precision) {
        return (5 * precision + 1) / 2;
    }

    private static int latBits(int precision) {
        return 5 * precision / 2;
    }
}
