package org.amp.correlation.core;

import lombok.experimental.UtilityClass;
import org.amp.core.geo.Point;
import org.amp.core.geo.ZoneSegment;

import java.util.List;

/**
 * Argument checks applied at every public correlation entry point.
 */
@UtilityClass
public final class CorrelationContracts {

    /**
     * Rejects zero, negative and non-finite cutoffs before any search starts.
     */
    public static double requireCutoff(double cutoffMeters) {
        if (!Double.isFinite(cutoffMeters) || cutoffMeters <= 0.0d) {
            throw new CorrelationException(
                    CorrelationException.REASON_CUTOFF_NOT_POSITIVE,
                    "cutoffMeters must be finite and > 0, got " + cutoffMeters
            );
        }
        return cutoffMeters;
    }

    public static Point requirePoint(Point point) {
        if (point == null) {
            throw new CorrelationException(CorrelationException.REASON_POINT_REQUIRED, "point must be provided");
        }
        return point;
    }

    public static List<ZoneSegment> requireZones(List<ZoneSegment> zones) {
        if (zones == null) {
            throw new CorrelationException(CorrelationException.REASON_ZONES_REQUIRED, "zones must be provided");
        }
        return zones;
    }

    /**
     * Ensures an indexed algorithm is queried against the zone list it was built from.
     */
    public static void requireIndexedZones(List<ZoneSegment> zones, int indexedZoneCount) {
        requireZones(zones);
        if (zones.size() != indexedZoneCount) {
            throw new CorrelationException(
                    CorrelationException.REASON_ZONE_SET_MISMATCH,
                    "index was built over " + indexedZoneCount + " zones but query supplied " + zones.size()
            );
        }
    }

    /**
     * Narrows a query coordinate and rejects NaN and infinities.
     */
    public static double requireFiniteCoordinate(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite, got " + value);
        }
        return value;
    }
}
