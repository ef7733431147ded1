package org.amp.correlation.algorithm;

import org.amp.core.geo.CoordinateSystem;
import org.amp.core.geo.Point;
import org.amp.core.geo.ZoneSegment;
import org.amp.correlation.core.CorrelationContracts;
import org.amp.correlation.geometry.GeoMath;

import java.util.List;

/**
 * Zone endpoints narrowed to primitive arrays once per build.
 *
 * <p>Index i holds zone i of the caller's list. Read-only after construction.</p>
 */
final class ZoneGeometry {
    final CoordinateSystem system;
    final double[] startX;
    final double[] startY;
    final double[] endX;
    final double[] endY;

    private ZoneGeometry(CoordinateSystem system, int size) {
        this.system = system;
        this.startX = new double[size];
        this.startY = new double[size];
        this.endX = new double[size];
        this.endY = new double[size];
    }

    static ZoneGeometry of(List<ZoneSegment> zones, CoordinateSystem system) {
        CorrelationContracts.requireZones(zones);
        ZoneGeometry geometry = new ZoneGeometry(system, zones.size());
        for (int i = 0; i < zones.size(); i++) {
            ZoneSegment zone = zones.get(i);
            if (zone == null) {
                throw new IllegalArgumentException("zones[" + i + "] is null");
            }
            geometry.startX[i] = zone.getStart().xAsDouble();
            geometry.startY[i] = zone.getStart().yAsDouble();
            geometry.endX[i] = zone.getEnd().xAsDouble();
            geometry.endY[i] = zone.getEnd().yAsDouble();
        }
        return geometry;
    }

    int size() {
        return startX.length;
    }

    double distance(int zoneIndex, double px, double py) {
        return GeoMath.pointToSegmentDistance(
                system,
                px, py,
                startX[zoneIndex], startY[zoneIndex],
                endX[zoneIndex], endY[zoneIndex]
        );
    }

    double minX(int zoneIndex) {
        return Math.min(startX[zoneIndex], endX[zoneIndex]);
    }

    double maxX(int zoneIndex) {
        return Math.max(startX[zoneIndex], endX[zoneIndex]);
    }

    double minY(int zoneIndex) {
        return Math.min(startY[zoneIndex], endY[zoneIndex]);
    }

    double maxY(int zoneIndex) {
        return Math.max(startY[zoneIndex], endY[zoneIndex]);
    }

    double midX(int zoneIndex) {
        return (startX[zoneIndex] + endX[zoneIndex]) * 0.5d;
    }

    double midY(int zoneIndex) {
        return (startY[zoneIndex] + endY[zoneIndex]) * 0.5d;
    }

    /**
     * Largest absolute y over all endpoints, used to size longitude margins.
     */
    double maxAbsY() {
        double max = 0.0d;
        for (int i = 0; i < startY.length; i++) {
            max = Math.max(max, Math.max(Math.abs(startY[i]), Math.abs(endY[i])));
        }
        return max;
    }

    /**
     * Validated query x coordinate.
     */
    static double queryX(Point point) {
        return CorrelationContracts.requireFiniteCoordinate(CorrelationContracts.requirePoint(point).xAsDouble(), "point.x");
    }

    /**
     * Validated query y coordinate.
     */
    static double queryY(Point point) {
        return CorrelationContracts.requireFiniteCoordinate(point.yAsDouble(), "point.y");
    }
}
