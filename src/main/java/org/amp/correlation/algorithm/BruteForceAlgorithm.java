package org.amp.correlation.algorithm;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.amp.core.geo.CoordinateSystem;
import org.amp.core.geo.Point;
import org.amp.core.geo.ZoneSegment;
import org.amp.correlation.core.CorrelationContracts;
import org.amp.correlation.geometry.GeoMath;

import java.util.List;
import java.util.Optional;

/**
 * Linear scan over every zone. O(m) per query with no build phase.
 *
 * <p>Reference result for all other strategies.</p>
 */
@RequiredArgsConstructor
public final class BruteForceAlgorithm implements CorrelationAlgorithm {
    @Getter
    @Accessors(fluent = true)
    @lombok.NonNull
    private final CoordinateSystem coordinateSystem;

    public BruteForceAlgorithm() {
        this(CoordinateSystem.WGS84_DEGREES);
    }

    @Override
    public AlgorithmType type() {
        return AlgorithmType.BRUTE_FORCE;
    }

    @Override
    public Optional<ZoneMatch> correlate(Point point, List<ZoneSegment> zones, double cutoffMeters) {
        CorrelationContracts.requireCutoff(cutoffMeters);
        CorrelationContracts.requireZones(zones);
        double px = ZoneGeometry.queryX(point);
        double py = ZoneGeometry.queryY(point);

        NearestZoneCollector collector = new NearestZoneCollector(cutoffMeters);
        for (int i = 0; i < zones.size(); i++) {
            ZoneSegment zone = zones.get(i);
            double distance = GeoMath.pointToSegmentDistance(
                    coordinateSystem,
                    px, py,
                    zone.getStart().xAsDouble(), zone.getStart().yAsDouble(),
                    zone.getEnd().xAsDouble(), zone.getEnd().yAsDouble()
            );
            collector.offer(i, distance);
        }
        return collector.result();
    }

    @Override
    public String toString() {
        return "BruteForceAlgorithm[coordinateSystem=" + coordinateSystem + "]";
    }
}
