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
 * Boundary-crossing strategy with nearest-edge fallback.
 *
 * <p>Zones are read as boundary edges in list order. Consecutive segments where
 * {@code end[i] == start[i + 1]} form a chain; a chain of at least three edges whose last
 * end returns to its first start is a closed ring. A point inside a ring (even-odd rule,
 * ray cast toward +x) matches that ring's nearest edge at distance 0. Everything else is
 * matched by plain nearest-edge distance within the cutoff.</p>
 *
 * <p>Vertex hits use the half-open rule {@code (yi > py) != (yj > py)}, so a ray through a
 * shared vertex counts exactly one crossing. Points on an edge are inside.</p>
 *
 * <p>The crossing test runs in coordinate space without longitude wrapping; rings spanning
 * the antimeridian are classified as outside and fall back to edge distance.</p>
 */
@RequiredArgsConstructor
public final class RaycastingAlgorithm implements CorrelationAlgorithm {
    private static final int MIN_RING_EDGES = 3;

    @Getter
    @Accessors(fluent = true)
    @lombok.NonNull
    private final CoordinateSystem coordinateSystem;

    public RaycastingAlgorithm() {
        this(CoordinateSystem.WGS84_DEGREES);
    }

    @Override
    public AlgorithmType type() {
        return AlgorithmType.RAYCASTING;
    }

    @Override
    public Optional<ZoneMatch> correlate(Point point, List<ZoneSegment> zones, double cutoffMeters) {
        CorrelationContracts.requireCutoff(cutoffMeters);
        CorrelationContracts.requireZones(zones);
        double px = ZoneGeometry.queryX(point);
        double py = ZoneGeometry.queryY(point);

        NearestZoneCollector collector = new NearestZoneCollector(cutoffMeters);
        RingState ring = new RingState();

        double previousEndX = Double.NaN;
        double previousEndY = Double.NaN;
        for (int i = 0; i < zones.size(); i++) {
            ZoneSegment zone = zones.get(i);
            double ax = zone.getStart().xAsDouble();
            double ay = zone.getStart().yAsDouble();
            double bx = zone.getEnd().xAsDouble();
            double by = zone.getEnd().yAsDouble();

            if (i == 0 || ax != previousEndX || ay != previousEndY) {
                closeChain(ring, previousEndX, previousEndY, collector);
                ring.reset(ax, ay);
            }

            double distance = GeoMath.pointToSegmentDistance(coordinateSystem, px, py, ax, ay, bx, by);
            collector.offer(i, distance);
            ring.addEdge(i, distance, crosses(px, py, ax, ay, bx, by));

            if (ring.edgeCount >= MIN_RING_EDGES && bx == ring.firstX && by == ring.firstY) {
                // Ring closed here; the next segment starts a new chain even if it shares this vertex.
                closeChain(ring, bx, by, collector);
                previousEndX = Double.NaN;
                previousEndY = Double.NaN;
            } else {
                previousEndX = bx;
                previousEndY = by;
            }
        }
        if (!zones.isEmpty()) {
            closeChain(ring, previousEndX, previousEndY, collector);
        }
        return collector.result();
    }

    /**
     * Half-open even-odd crossing test for a ray cast from (px, py) toward +x.
     */
    static boolean crosses(double px, double py, double ax, double ay, double bx, double by) {
        if ((ay > py) == (by > py)) {
            return false;
        }
        double intersectionX = ax + (bx - ax) * (py - ay) / (by - ay);
        return px < intersectionX;
    }

    private static void closeChain(RingState ring, double endX, double endY, NearestZoneCollector collector) {
        if (ring.edgeCount >= MIN_RING_EDGES
                && endX == ring.firstX
                && endY == ring.firstY
                && ring.oddCrossings
                && ring.nearestEdge >= 0) {
            collector.offer(ring.nearestEdge, 0.0d);
        }
    }

    /**
     * Per-chain accumulator, reused across chains within one query.
     */
    private static final class RingState {
        private double firstX;
        private double firstY;
        private int edgeCount;
        private boolean oddCrossings;
        private int nearestEdge;
        private double nearestDistance;

        private void reset(double startX, double startY) {
            firstX = startX;
            firstY = startY;
            edgeCount = 0;
            oddCrossings = false;
            nearestEdge = -1;
            nearestDistance = Double.POSITIVE_INFINITY;
        }

        private void addEdge(int zoneIndex, double distance, boolean crossing) {
            edgeCount++;
            if (crossing) {
                oddCrossings = !oddCrossings;
            }
            if (ZoneMatch.isCloser(zoneIndex, distance, nearestEdge, nearestDistance)) {
                nearestEdge = zoneIndex;
                nearestDistance = distance;
            }
        }
    }

    @Override
    public String toString() {
        return "RaycastingAlgorithm[coordinateSystem=" + coordinateSystem + "]";
    }
}
