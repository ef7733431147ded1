package org.amp.correlation.geometry;

import lombok.experimental.UtilityClass;
import org.amp.core.geo.CoordinateSystem;
import org.amp.core.geo.Point;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Distance and grid-cell primitives shared by every correlation algorithm.
 *
 * <p>Geographic input uses {@code x = longitude, y = latitude} in degrees. Distances are
 * great-circle meters on a sphere of radius {@link #EARTH_RADIUS_METERS}; the haversine
 * error stays around 0.5% below 100 m, which is within tolerance at the 50 m cutoffs
 * callers use. Ellipsoidal (Vincenty) correction is not applied.</p>
 *
 * <p>All functions have primitive overloads used in the hot query loops. The {@link Point}
 * overloads narrow the decimal coordinates once and delegate.</p>
 */
@UtilityClass
public final class GeoMath {
    public static final double EARTH_RADIUS_METERS = 6_371_000.0d;
    public static final double METERS_PER_DEGREE = EARTH_RADIUS_METERS * Math.PI / 180.0d;

    /**
     * Widening applied to metric search boxes so float rounding never excludes a boundary hit.
     */
    private static final double EXTENT_SLACK = 1.001d;
    private static final double MIN_COSINE = 1e-9d;

    /**
     * Great-circle distance in meters between two WGS84 points.
     */
    public static double haversineDistance(Point p1, Point p2) {
        return haversineDistance(p1.xAsDouble(), p1.yAsDouble(), p2.xAsDouble(), p2.yAsDouble());
    }

    /**
     * Great-circle distance in meters using the haversine formulation.
     *
     * @param lon1Deg first longitude.
     * @param lat1Deg first latitude.
     * @param lon2Deg second longitude.
     * @param lat2Deg second latitude.
     */
    public static double haversineDistance(double lon1Deg, double lat1Deg, double lon2Deg, double lat2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double c = 2.0d * Math.asin(Math.sqrt(clamp(a, 0.0d, 1.0d)));
        return EARTH_RADIUS_METERS * c;
    }

    /**
     * Metric distance between two coordinates under the given coordinate system.
     */
    public static double distanceMeters(CoordinateSystem system, double x1, double y1, double x2, double y2) {
        if (system == CoordinateSystem.PROJECTED_METERS) {
            return Math.hypot(x2 - x1, y2 - y1);
        }
        return haversineDistance(x1, y1, x2, y2);
    }

    /**
     * Distance in meters from {@code p} to the segment {@code (a, b)} under WGS84.
     */
    public static double pointToSegmentDistance(Point p, Point a, Point b) {
        return pointToSegmentDistance(
                CoordinateSystem.WGS84_DEGREES,
                p.xAsDouble(), p.yAsDouble(),
                a.xAsDouble(), a.yAsDouble(),
                b.xAsDouble(), b.yAsDouble()
        );
    }

    /**
     * Distance in meters from {@code p} to the segment {@code (a, b)} under the given system.
     */
    public static double pointToSegmentDistance(CoordinateSystem system, Point p, Point a, Point b) {
        return pointToSegmentDistance(
                system,
                p.xAsDouble(), p.yAsDouble(),
                a.xAsDouble(), a.yAsDouble(),
                b.xAsDouble(), b.yAsDouble()
        );
    }

    /**
     * Projects {@code p} onto the line through {@code a} and {@code b} in coordinate space,
     * clamps the projection parameter to {@code [0, 1]} and measures from {@code p} to the
     * clamped point.
     *
     * <p>When {@code a == b} the result is exactly {@code distance(p, a)}; the zero-length
     * direction vector is never used as a divisor.</p>
     */
    public static double pointToSegmentDistance(
            CoordinateSystem system,
            double px,
            double py,
            double ax,
            double ay,
            double bx,
            double by
    ) {
        if (ax == bx && ay == by) {
            return distanceMeters(system, px, py, ax, ay);
        }
        double segmentX = bx - ax;
        double segmentY = by - ay;
        double lengthSquared = segmentX * segmentX + segmentY * segmentY;
        if (lengthSquared == 0.0d) {
            return distanceMeters(system, px, py, ax, ay);
        }

        double t = ((px - ax) * segmentX + (py - ay) * segmentY) / lengthSquared;
        t = clamp(t, 0.0d, 1.0d);
        double closestX = ax + t * segmentX;
        double closestY = ay + t * segmentY;
        return distanceMeters(system, px, py, closestX, closestY);
    }

    /**
     * Cell containing {@code p} for square cells of {@code cellSize} coordinate units.
     */
    public static GridCell gridCell(Point p, double cellSize) {
        return gridCell(p.xAsDouble(), p.yAsDouble(), cellSize);
    }

    /**
     * Cell containing {@code (x, y)} computed by floor division.
     */
    public static GridCell gridCell(double x, double y, double cellSize) {
        return GridCell.of(cellIndex(x, cellSize), cellIndex(y, cellSize));
    }

    /**
     * Floor-division cell index of one coordinate component.
     */
    public static int cellIndex(double value, double cellSize) {
        return (int) Math.floor(value / cellSize);
    }

    /**
     * Returns the 3x3 neighbourhood: {@code cell} itself plus its 8 immediate neighbours.
     */
    public static GridCell[] neighborCells(GridCell cell) {
        return neighborCells(cell, 1);
    }

    /**
     * Returns the {@code (2 * radius + 1)^2} cells within Chebyshev distance {@code radius}.
     */
    public static GridCell[] neighborCells(GridCell cell, int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("radius must be >= 0, got " + radius);
        }
        int side = 2 * radius + 1;
        GridCell[] cells = new GridCell[side * side];
        int cursor = 0;
        for (int dx = -radius; dx <= radius; dx++) {
            for (int dy = -radius; dy <= radius; dy++) {
                cells[cursor++] = GridCell.of(cell.x() + dx, cell.y() + dy);
            }
        }
        return cells;
    }

    /**
     * Cells touched by the segment {@code (a, b)}.
     */
    public static Set<GridCell> segmentCells(Point a, Point b, double cellSize) {
        return segmentCells(a.xAsDouble(), a.yAsDouble(), b.xAsDouble(), b.yAsDouble(), cellSize);
    }

    /**
     * Walks the grid incrementally from the start cell to the end cell (DDA traversal),
     * collecting every cell the segment passes through. Cells are deduplicated as they are
     * inserted; iteration order follows the walk.
     *
     * <p>When the segment passes exactly through a cell corner, both cells adjacent to the
     * corner are included.</p>
     */
    public static Set<GridCell> segmentCells(double ax, double ay, double bx, double by, double cellSize) {
        Set<GridCell> cells = new LinkedHashSet<>();

        int cellX = cellIndex(ax, cellSize);
        int cellY = cellIndex(ay, cellSize);
        int endX = cellIndex(bx, cellSize);
        int endY = cellIndex(by, cellSize);
        cells.add(GridCell.of(cellX, cellY));

        double deltaX = bx - ax;
        double deltaY = by - ay;
        int stepX = endX > cellX ? 1 : (endX < cellX ? -1 : 0);
        int stepY = endY > cellY ? 1 : (endY < cellY ? -1 : 0);

        double tDeltaX = stepX != 0 ? cellSize / Math.abs(deltaX) : Double.POSITIVE_INFINITY;
        double tDeltaY = stepY != 0 ? cellSize / Math.abs(deltaY) : Double.POSITIVE_INFINITY;
        double tMaxX = stepX > 0
                ? ((cellX + 1) * cellSize - ax) / deltaX
                : (stepX < 0 ? (cellX * cellSize - ax) / deltaX : Double.POSITIVE_INFINITY);
        double tMaxY = stepY > 0
                ? ((cellY + 1) * cellSize - ay) / deltaY
                : (stepY < 0 ? (cellY * cellSize - ay) / deltaY : Double.POSITIVE_INFINITY);

        while (cellX != endX || cellY != endY) {
            double nextX = cellX == endX ? Double.POSITIVE_INFINITY : tMaxX;
            double nextY = cellY == endY ? Double.POSITIVE_INFINITY : tMaxY;

            if (nextX < nextY) {
                cellX += stepX;
                tMaxX += tDeltaX;
            } else if (nextY < nextX) {
                cellY += stepY;
                tMaxY += tDeltaY;
            } else {
                cells.add(GridCell.of(cellX + stepX, cellY));
                cells.add(GridCell.of(cellX, cellY + stepY));
                cellX += stepX;
                cellY += stepY;
                tMaxX += tDeltaX;
                tMaxY += tDeltaY;
            }
            cells.add(GridCell.of(cellX, cellY));
        }
        return cells;
    }

    /**
     * Half-widths in coordinate units enclosing a metric radius around {@code (x, y)}.
     *
     * <p>For WGS84 the longitude half-width is computed at the latitude closest to the
     * pole inside the box, so the extent never under-covers the radius.</p>
     */
    public static SearchExtent searchExtent(CoordinateSystem system, double x, double y, double radiusMeters) {
        if (system == CoordinateSystem.PROJECTED_METERS) {
            double halfWidth = radiusMeters * EXTENT_SLACK;
            return new SearchExtent(halfWidth, halfWidth);
        }
        double halfWidthY = radiusMeters / METERS_PER_DEGREE * EXTENT_SLACK;
        double poleward = Math.min(90.0d, Math.abs(y) + halfWidthY);
        double cosine = Math.cos(Math.toRadians(poleward));
        double halfWidthX = cosine < MIN_COSINE
                ? 180.0d
                : Math.min(180.0d, radiusMeters / (METERS_PER_DEGREE * cosine) * EXTENT_SLACK);
        return new SearchExtent(halfWidthX, halfWidthY);
    }

    /**
     * Local meters per coordinate unit along x at latitude {@code y}.
     */
    public static double metersPerUnitX(CoordinateSystem system, double y) {
        if (system == CoordinateSystem.PROJECTED_METERS) {
            return 1.0d;
        }
        return METERS_PER_DEGREE * Math.cos(Math.toRadians(y));
    }

    /**
     * Local meters per coordinate unit along y.
     */
    public static double metersPerUnitY(CoordinateSystem system) {
        return system == CoordinateSystem.PROJECTED_METERS ? 1.0d : METERS_PER_DEGREE;
    }

    /**
     * Normalizes delta-longitude into the principal range {@code (-180, 180]}.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        if (deltaLonDeg > -180.0d && deltaLonDeg <= 180.0d) {
            return deltaLonDeg;
        }
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    /**
     * Clamps a value into inclusive {@code [min, max]} bounds.
     */
    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
