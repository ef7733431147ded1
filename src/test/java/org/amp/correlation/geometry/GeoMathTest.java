package org.amp.correlation.geometry;

import org.amp.core.geo.CoordinateSystem;
import org.amp.core.geo.Point;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GeoMath Tests")
class GeoMathTest {

    // =====================================================================
    // DISTANCE
    // =====================================================================

    @Test
    @DisplayName("Haversine: one degree of latitude is R * pi / 180 meters")
    void testHaversineOneDegree() {
        double distance = GeoMath.haversineDistance(13.0d, 55.0d, 13.0d, 56.0d);
        assertEquals(GeoMath.METERS_PER_DEGREE, distance, 1e-6);
        assertEquals(111_194.93d, distance, 0.01d);
    }

    @Test
    @DisplayName("Haversine: symmetric, zero on identity, wraps the antimeridian")
    void testHaversineSymmetryAndWrap() {
        Point a = Point.of("13.0003", "55.6001");
        Point b = Point.of("13.0107", "55.5989");

        assertEquals(GeoMath.haversineDistance(a, b), GeoMath.haversineDistance(b, a), 1e-9);
        assertEquals(0.0d, GeoMath.haversineDistance(a, a));

        double acrossDateLine = GeoMath.haversineDistance(179.9995d, 0.0d, -179.9995d, 0.0d);
        assertEquals(0.001d * GeoMath.METERS_PER_DEGREE, acrossDateLine, 1e-3);
    }

    @Test
    @DisplayName("Point-to-segment: degenerate segment equals point distance exactly")
    void testDegenerateSegmentExact() {
        Random random = new Random(42L);
        for (int i = 0; i < 1_000; i++) {
            Point p = Point.of(random.nextDouble(12.9d, 13.1d), random.nextDouble(55.5d, 55.7d));
            Point a = Point.of(random.nextDouble(12.9d, 13.1d), random.nextDouble(55.5d, 55.7d));

            assertEquals(GeoMath.haversineDistance(p, a), GeoMath.pointToSegmentDistance(p, a, a));
        }
    }

    @Test
    @DisplayName("Point-to-segment: interior projection, clamped endpoints, never negative")
    void testPointToSegmentProjection() {
        double north = 30.0d / GeoMath.METERS_PER_DEGREE;
        Point a = Point.of(13.0d, 55.6d);
        Point b = Point.of(13.001d, 55.6d);

        Point above = Point.of(13.0005d, 55.6d + north);
        assertEquals(30.0d, GeoMath.pointToSegmentDistance(above, a, b), 30.0d * 0.005d);

        Point beyondEnd = Point.of(13.002d, 55.6d);
        assertEquals(GeoMath.haversineDistance(beyondEnd, b), GeoMath.pointToSegmentDistance(beyondEnd, a, b), 1e-9);

        Point beforeStart = Point.of(12.999d, 55.6d);
        assertEquals(GeoMath.haversineDistance(beforeStart, a), GeoMath.pointToSegmentDistance(beforeStart, a, b), 1e-9);

        assertEquals(0.0d, GeoMath.pointToSegmentDistance(a, a, b));

        Random random = new Random(7L);
        for (int i = 0; i < 500; i++) {
            Point p = Point.of(random.nextDouble(12.99d, 13.01d), random.nextDouble(55.59d, 55.61d));
            assertTrue(GeoMath.pointToSegmentDistance(p, a, b) >= 0.0d);
        }
    }

    @Test
    @DisplayName("Projected system uses Euclidean meters")
    void testProjectedDistance() {
        assertEquals(5.0d, GeoMath.distanceMeters(CoordinateSystem.PROJECTED_METERS, 0.0d, 0.0d, 3.0d, 4.0d));
        double distance = GeoMath.pointToSegmentDistance(
                CoordinateSystem.PROJECTED_METERS,
                Point.of(5.0d, 3.0d),
                Point.of(0.0d, 0.0d),
                Point.of(10.0d, 0.0d)
        );
        assertEquals(3.0d, distance, 1e-12);
    }

    // =====================================================================
    // GRID CELLS
    // =====================================================================

    @Test
    @DisplayName("Grid cell: floor division handles negative coordinates")
    void testGridCellFloor() {
        assertEquals(GridCell.of(26_000, 111_200), GeoMath.gridCell(Point.of("13.0001", "55.6001"), 0.0005d));
        assertEquals(GridCell.of(-1, -1), GeoMath.gridCell(-0.0001d, -0.0001d, 0.0005d));
        assertEquals(GridCell.of(2, -3), GeoMath.gridCell(25.0d, -21.0d, 10.0d));
    }

    @Test
    @DisplayName("Grid cell: packed key round-trips negative indices")
    void testGridCellKey() {
        GridCell cell = GridCell.of(-7, 123_456);
        assertEquals(cell, GridCell.unpack(cell.key()));
        assertNotEquals(GridCell.of(1, 2).key(), GridCell.of(2, 1).key());
    }

    @Test
    @DisplayName("Neighbor cells: 3x3 block including the cell itself")
    void testNeighborCells() {
        GridCell center = GridCell.of(10, -4);
        GridCell[] cells = GeoMath.neighborCells(center);

        Set<GridCell> unique = new HashSet<>(List.of(cells));
        assertEquals(9, cells.length);
        assertEquals(9, unique.size());
        assertTrue(unique.contains(center));
        assertTrue(unique.contains(GridCell.of(9, -5)));
        assertTrue(unique.contains(GridCell.of(11, -3)));

        assertEquals(25, GeoMath.neighborCells(center, 2).length);
        assertEquals(1, GeoMath.neighborCells(center, 0).length);
        assertThrows(IllegalArgumentException.class, () -> GeoMath.neighborCells(center, -1));
    }

    @Test
    @DisplayName("Segment cells: single-cell segment yields one cell")
    void testSegmentCellsSingleCell() {
        Set<GridCell> cells = GeoMath.segmentCells(1.1d, 1.1d, 1.8d, 1.9d, 1.0d);
        assertEquals(Set.of(GridCell.of(1, 1)), cells);
    }

    @Test
    @DisplayName("Segment cells: horizontal walk visits each crossed cell once")
    void testSegmentCellsHorizontal() {
        Set<GridCell> cells = GeoMath.segmentCells(0.5d, 0.5d, 3.5d, 0.5d, 1.0d);
        assertEquals(List.of(GridCell.of(0, 0), GridCell.of(1, 0), GridCell.of(2, 0), GridCell.of(3, 0)),
                List.copyOf(cells));

        Set<GridCell> reversed = GeoMath.segmentCells(3.5d, 0.5d, 0.5d, 0.5d, 1.0d);
        assertEquals(cells, reversed);
    }

    @Test
    @DisplayName("Segment cells: diagonal through a corner includes both side cells")
    void testSegmentCellsCorner() {
        Set<GridCell> cells = GeoMath.segmentCells(0.5d, 0.5d, 1.5d, 1.5d, 1.0d);
        assertEquals(Set.of(GridCell.of(0, 0), GridCell.of(1, 0), GridCell.of(0, 1), GridCell.of(1, 1)), cells);
    }

    @Test
    @DisplayName("Segment cells: every sampled point along the segment is covered")
    void testSegmentCellsCoverage() {
        Random random = new Random(99L);
        double cellSize = 0.0005d;
        for (int i = 0; i < 200; i++) {
            double ax = random.nextDouble(13.0d, 13.01d);
            double ay = random.nextDouble(55.6d, 55.61d);
            double bx = ax + random.nextDouble(-0.003d, 0.003d);
            double by = ay + random.nextDouble(-0.003d, 0.003d);
            Set<GridCell> cells = GeoMath.segmentCells(ax, ay, bx, by, cellSize);

            for (int s = 1; s < 50; s++) {
                double t = s / 50.0d;
                GridCell sampled = GeoMath.gridCell(ax + t * (bx - ax), ay + t * (by - ay), cellSize);
                assertTrue(cells.contains(sampled), "missing " + sampled + " for segment " + i);
            }
            assertTrue(cells.contains(GeoMath.gridCell(ax, ay, cellSize)));
            assertTrue(cells.contains(GeoMath.gridCell(bx, by, cellSize)));
        }
    }

    // =====================================================================
    // SEARCH EXTENT
    // =====================================================================

    @Test
    @DisplayName("Search extent: points within the radius lie inside the extent")
    void testSearchExtentConservative() {
        Random random = new Random(1234L);
        double radius = 50.0d;
        double px = 13.0d;
        double py = 55.6d;
        SearchExtent extent = GeoMath.searchExtent(CoordinateSystem.WGS84_DEGREES, px, py, radius);

        for (int i = 0; i < 5_000; i++) {
            double qx = px + random.nextDouble(-0.002d, 0.002d);
            double qy = py + random.nextDouble(-0.002d, 0.002d);
            if (GeoMath.haversineDistance(px, py, qx, qy) <= radius) {
                assertTrue(Math.abs(qx - px) <= extent.halfWidthX());
                assertTrue(Math.abs(qy - py) <= extent.halfWidthY());
            }
        }

        SearchExtent projected = GeoMath.searchExtent(CoordinateSystem.PROJECTED_METERS, 0.0d, 0.0d, radius);
        assertTrue(projected.halfWidthX() >= radius);
        assertEquals(projected.halfWidthX(), projected.halfWidthY());
    }

    @Test
    @DisplayName("Search extent: longitude width grows toward the pole and is capped")
    void testSearchExtentLatitude() {
        SearchExtent equator = GeoMath.searchExtent(CoordinateSystem.WGS84_DEGREES, 0.0d, 0.0d, 1_000.0d);
        SearchExtent malmo = GeoMath.searchExtent(CoordinateSystem.WGS84_DEGREES, 0.0d, 55.6d, 1_000.0d);
        SearchExtent pole = GeoMath.searchExtent(CoordinateSystem.WGS84_DEGREES, 0.0d, 90.0d, 1_000.0d);

        assertTrue(malmo.halfWidthX() > equator.halfWidthX());
        assertEquals(equator.halfWidthY(), malmo.halfWidthY(), 1e-12);
        assertEquals(180.0d, pole.halfWidthX());
    }
}
