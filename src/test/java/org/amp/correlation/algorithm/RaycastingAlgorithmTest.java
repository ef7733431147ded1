package org.amp.correlation.algorithm;

import org.amp.core.geo.CoordinateSystem;
import org.amp.core.geo.Point;
import org.amp.core.geo.ZoneSegment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Raycasting Algorithm Tests")
class RaycastingAlgorithmTest {
    private final RaycastingAlgorithm raycasting = new RaycastingAlgorithm(CoordinateSystem.PROJECTED_METERS);

    private static ZoneSegment edge(double ax, double ay, double bx, double by) {
        return ZoneSegment.of(Point.of(ax, ay), Point.of(bx, by));
    }

    /**
     * Triangle (0,0) -> (2,1) -> (0,2) -> (0,0) as three chained edges.
     */
    private static List<ZoneSegment> triangle() {
        return List.of(
                edge(0.0d, 0.0d, 2.0d, 1.0d),
                edge(2.0d, 1.0d, 0.0d, 2.0d),
                edge(0.0d, 2.0d, 0.0d, 0.0d)
        );
    }

    @Test
    @DisplayName("Point inside a closed ring matches its nearest edge at distance 0")
    void testInsideRing() {
        Optional<ZoneMatch> match = raycasting.correlate(Point.of(0.5d, 1.0d), triangle(), 0.1d);

        assertEquals(Optional.of(new ZoneMatch(2, 0.0d)), match);
        assertTrue(match.get().isExact());
    }

    @Test
    @DisplayName("Point outside a ring falls back to edge distance")
    void testOutsideRing() {
        assertTrue(raycasting.correlate(Point.of(3.0d, 1.0d), triangle(), 0.1d).isEmpty());
        // Both edges meeting at (2, 1) are exactly 1 m away; the lower index wins.
        assertEquals(Optional.of(new ZoneMatch(0, 1.0d)), raycasting.correlate(Point.of(3.0d, 1.0d), triangle(), 2.0d));
    }

    @Test
    @DisplayName("Open chain is never treated as an area")
    void testOpenChain() {
        List<ZoneSegment> open = triangle().subList(0, 2);
        assertTrue(raycasting.correlate(Point.of(0.5d, 1.0d), open, 0.1d).isEmpty());
    }

    @Test
    @DisplayName("Point on a ring edge counts as inside")
    void testOnEdge() {
        assertEquals(Optional.of(new ZoneMatch(2, 0.0d)), raycasting.correlate(Point.of(0.0d, 1.0d), triangle(), 0.1d));
    }

    @Test
    @DisplayName("Ring closes even when the next segment starts at its first vertex")
    void testRingFollowedBySharedVertex() {
        List<ZoneSegment> zones = new ArrayList<>(triangle());
        zones.add(edge(0.0d, 0.0d, 5.0d, 5.0d));

        assertEquals(Optional.of(new ZoneMatch(2, 0.0d)), raycasting.correlate(Point.of(0.5d, 1.0d), zones, 0.1d));
    }

    @Test
    @DisplayName("Separate rings are classified independently")
    void testTwoRings() {
        List<ZoneSegment> zones = new ArrayList<>(triangle());
        zones.add(edge(10.0d, 0.0d, 14.0d, 0.0d));
        zones.add(edge(14.0d, 0.0d, 14.0d, 4.0d));
        zones.add(edge(14.0d, 4.0d, 10.0d, 4.0d));
        zones.add(edge(10.0d, 4.0d, 10.0d, 0.0d));

        assertEquals(Optional.of(new ZoneMatch(6, 0.0d)), raycasting.correlate(Point.of(11.0d, 2.0d), zones, 0.5d));
        assertTrue(raycasting.correlate(Point.of(7.0d, 2.0d), zones, 0.5d).isEmpty());
    }

    @Test
    @DisplayName("Crossing test uses the half-open vertex rule")
    void testCrossingRule() {
        // Edge from (1, 0) to (1, 2) lies right of the point.
        assertTrue(RaycastingAlgorithm.crosses(0.0d, 1.0d, 1.0d, 0.0d, 1.0d, 2.0d));
        // Same edge left of the point.
        assertFalse(RaycastingAlgorithm.crosses(2.0d, 1.0d, 1.0d, 0.0d, 1.0d, 2.0d));
        // Horizontal edge never crosses.
        assertFalse(RaycastingAlgorithm.crosses(0.0d, 1.0d, 1.0d, 1.0d, 3.0d, 1.0d));
        // Shared vertex at the ray's height counts for exactly one of the two edges.
        boolean upper = RaycastingAlgorithm.crosses(0.0d, 1.0d, 1.0d, 1.0d, 2.0d, 2.0d);
        boolean lower = RaycastingAlgorithm.crosses(0.0d, 1.0d, 2.0d, 0.0d, 1.0d, 1.0d);
        assertNotEquals(upper, lower);
    }

    @Test
    @DisplayName("Geographic rings use haversine edge distances")
    void testGeographicRing() {
        RaycastingAlgorithm geographic = new RaycastingAlgorithm();
        List<ZoneSegment> square = List.of(
                ZoneSegment.of(Point.of("13.000", "55.600"), Point.of("13.002", "55.600")),
                ZoneSegment.of(Point.of("13.002", "55.600"), Point.of("13.002", "55.601")),
                ZoneSegment.of(Point.of("13.002", "55.601"), Point.of("13.000", "55.601")),
                ZoneSegment.of(Point.of("13.000", "55.601"), Point.of("13.000", "55.600"))
        );

        Optional<ZoneMatch> inside = geographic.correlate(Point.of("13.0002", "55.6005"), square, 1.0d);
        assertTrue(inside.isPresent());
        assertEquals(3, inside.get().zoneIndex());
        assertEquals(0.0d, inside.get().distanceMeters());
        assertTrue(new BruteForceAlgorithm().correlate(Point.of("13.0002", "55.6005"), square, 1.0d).isEmpty());
    }
}
