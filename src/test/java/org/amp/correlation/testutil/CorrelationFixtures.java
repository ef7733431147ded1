package org.amp.correlation.testutil;

import org.amp.core.geo.AddressRecord;
import org.amp.core.geo.Point;
import org.amp.core.geo.ZoneSegment;
import org.amp.correlation.geometry.GeoMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Shared fixture factory for correlation tests.
 *
 * <p>Geographic fixtures sit around central Malmö. Offsets north/south are exact in
 * haversine meters because they only change latitude.</p>
 */
public final class CorrelationFixtures {
    public static final double BASE_LON = 13.0d;
    public static final double BASE_LAT = 55.6d;

    /** Bounding box used by the random fixtures, roughly 2 km x 2 km. */
    public static final double MIN_LON = 13.0d;
    public static final double MAX_LON = 13.03d;
    public static final double MIN_LAT = 55.59d;
    public static final double MAX_LAT = 55.61d;

    private CorrelationFixtures() {
    }

    /**
     * Latitude delta in degrees that moves a point {@code meters} north.
     */
    public static double northDegrees(double meters) {
        return meters / GeoMath.METERS_PER_DEGREE;
    }

    /**
     * Horizontal (east-west) segment from {@code fromLon} to {@code toLon} at {@code lat}.
     */
    public static ZoneSegment eastWest(double fromLon, double toLon, double lat) {
        return ZoneSegment.of(Point.of(fromLon, lat), Point.of(toLon, lat));
    }

    /**
     * East-west segment of 0.001 degrees starting at {@link #BASE_LON}, shifted {@code metersNorth}.
     */
    public static ZoneSegment baseSegment(double metersNorth) {
        return eastWest(BASE_LON, BASE_LON + 0.001d, BASE_LAT + northDegrees(metersNorth));
    }

    /**
     * Address on the middle of {@link #baseSegment(double)} with zero offset.
     */
    public static AddressRecord baseAddress() {
        return address(BASE_LON + 0.0005d, BASE_LAT);
    }

    public static AddressRecord address(double lon, double lat) {
        return AddressRecord.builder()
                .point(Point.of(lon, lat))
                .street("Testgatan")
                .number("1")
                .postalCode("211 34")
                .build();
    }

    public static List<ZoneSegment> randomZones(long seed, int count, double maxLengthDegrees) {
        Random random = new Random(seed);
        List<ZoneSegment> zones = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double ax = random.nextDouble(MIN_LON, MAX_LON);
            double ay = random.nextDouble(MIN_LAT, MAX_LAT);
            double bx = ax + random.nextDouble(-maxLengthDegrees, maxLengthDegrees);
            double by = ay + random.nextDouble(-maxLengthDegrees, maxLengthDegrees) * 0.5d;
            zones.add(ZoneSegment.of(Point.of(ax, ay), Point.of(bx, by), "zone-" + i));
        }
        return zones;
    }

    public static List<AddressRecord> randomAddresses(long seed, int count) {
        Random random = new Random(seed);
        List<AddressRecord> addresses = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            addresses.add(AddressRecord.builder()
                    .point(Point.of(random.nextDouble(MIN_LON, MAX_LON), random.nextDouble(MIN_LAT, MAX_LAT)))
                    .street("Street " + i)
                    .number(Integer.toString(1 + i % 40))
                    .postalCode("2" + (1000 + i % 900))
                    .build());
        }
        return addresses;
    }

    /**
     * Random segments in a projected meter plane of {@code extentMeters} x {@code extentMeters}.
     */
    public static List<ZoneSegment> randomProjectedZones(long seed, int count, double extentMeters, double maxLengthMeters) {
        Random random = new Random(seed);
        List<ZoneSegment> zones = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double ax = random.nextDouble(0.0d, extentMeters);
            double ay = random.nextDouble(0.0d, extentMeters);
            double bx = ax + random.nextDouble(-maxLengthMeters, maxLengthMeters);
            double by = ay + random.nextDouble(-maxLengthMeters, maxLengthMeters);
            zones.add(ZoneSegment.of(Point.of(ax, ay), Point.of(bx, by)));
        }
        return zones;
    }

    public static List<Point> randomProjectedPoints(long seed, int count, double extentMeters) {
        Random random = new Random(seed);
        List<Point> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            points.add(Point.of(random.nextDouble(0.0d, extentMeters), random.nextDouble(0.0d, extentMeters)));
        }
        return points;
    }
}
