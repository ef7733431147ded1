package org.amp.correlation.algorithm;

import org.amp.core.geo.AddressRecord;
import org.amp.core.geo.CoordinateSystem;
import org.amp.core.geo.Point;
import org.amp.core.geo.ZoneSegment;
import org.amp.correlation.core.CorrelationConfig;
import org.amp.correlation.testutil.CorrelationFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Overlapping Chunks Algorithm Tests")
class OverlappingChunksAlgorithmTest {

    private static final CorrelationConfig PROJECTED = CorrelationConfig.projectedMeters();

    private static List<ZoneSegment> twoZones() {
        return List.of(
                ZoneSegment.of(Point.of(10.0d, 10.0d), Point.of(20.0d, 10.0d)),
                ZoneSegment.of(Point.of(180.0d, 150.0d), Point.of(190.0d, 150.0d))
        );
    }

    @Test
    @DisplayName("Build: zones near a chunk border are registered in every overlapping chunk")
    void testOverlapRegistration() {
        OverlappingChunksAlgorithm chunks = OverlappingChunksAlgorithm.build(twoZones(), PROJECTED);

        assertEquals(100.0d, chunks.chunkSize());
        assertTrue(chunks.overlap().halfWidthX() >= 50.0d);

        // Zone 0 widened by the margin: chunks -1..0 on both axes.
        assertArrayEquals(new int[]{0}, chunks.chunkMembers(0, 0));
        assertArrayEquals(new int[]{0}, chunks.chunkMembers(-1, 0));
        assertArrayEquals(new int[]{0}, chunks.chunkMembers(0, -1));
        assertArrayEquals(new int[]{0}, chunks.chunkMembers(-1, -1));
        // Zone 1 widened by the margin: chunks 1..2 by 0..2.
        assertArrayEquals(new int[]{1}, chunks.chunkMembers(2, 2));
        assertArrayEquals(new int[]{1}, chunks.chunkMembers(1, 0));
        assertEquals(0, chunks.chunkMembers(1, -1).length);
        assertEquals(10, chunks.chunkCount());
    }

    @Test
    @DisplayName("Query: larger cutoffs examine more chunks")
    void testExaminedChunks() {
        OverlappingChunksAlgorithm chunks = OverlappingChunksAlgorithm.build(twoZones(), PROJECTED);
        Point query = Point.of(150.0d, 150.0d);

        int small = chunks.examinedChunkCount(query, 50.0d);
        int large = chunks.examinedChunkCount(query, 500.0d);

        assertEquals(7, small);
        assertEquals(chunks.chunkCount(), large);
        assertTrue(large > small);
    }

    @Test
    @DisplayName("Query: zones in distant chunks are found when the cutoff allows it")
    void testCutoffAboveOverlap() {
        List<ZoneSegment> zones = twoZones();
        OverlappingChunksAlgorithm chunks = OverlappingChunksAlgorithm.build(zones, PROJECTED);
        Point query = Point.of(15.0d, 300.0d);

        assertTrue(chunks.correlate(query, zones, 50.0d).isEmpty());
        assertEquals(new BruteForceAlgorithm(CoordinateSystem.PROJECTED_METERS).correlate(query, zones, 400.0d),
                chunks.correlate(query, zones, 400.0d));
    }

    @Test
    @Timeout(value = 20, unit = TimeUnit.SECONDS)
    @DisplayName("Build: kilometre cutoffs widen the chunk edge and keep the index small")
    void testLargeCutoffBuild() {
        List<ZoneSegment> zones = CorrelationFixtures.randomZones(93L, 300, 0.001d);
        List<AddressRecord> addresses = CorrelationFixtures.randomAddresses(94L, 40);
        CorrelationConfig config = CorrelationConfig.builder().cutoffMeters(20_000.0d).build();
        OverlappingChunksAlgorithm chunks = OverlappingChunksAlgorithm.build(zones, config);

        assertTrue(chunks.chunkSize() >= chunks.overlap().maxHalfWidth());
        assertTrue(chunks.chunkSize() > config.getChunkSize());
        // Fixture box is far smaller than one chunk: at most four chunks per axis.
        assertTrue(chunks.chunkCount() <= 16, "chunks=" + chunks.chunkCount());

        BruteForceAlgorithm reference = new BruteForceAlgorithm();
        for (AddressRecord address : addresses) {
            assertEquals(reference.correlate(address.getPoint(), zones, 20_000.0d),
                    chunks.correlate(address.getPoint(), zones, 20_000.0d));
        }
    }

    @Test
    @DisplayName("Build: a chunk size below the margin is widened to it")
    void testChunkSizeWidenedToMargin() {
        CorrelationConfig config = PROJECTED.toBuilder().chunkSize(40.0d).build();
        OverlappingChunksAlgorithm chunks = OverlappingChunksAlgorithm.build(twoZones(), config);

        assertEquals(chunks.overlap().maxHalfWidth(), chunks.chunkSize());
        assertEquals(100.0d, OverlappingChunksAlgorithm.build(twoZones(), PROJECTED).chunkSize());
    }

    @Test
    @Timeout(value = 20, unit = TimeUnit.SECONDS)
    @DisplayName("Parallel chunk search agrees with brute force")
    void testParallelSearch() {
        List<ZoneSegment> zones = CorrelationFixtures.randomProjectedZones(91L, 600, 3_000.0d, 150.0d);
        List<Point> points = CorrelationFixtures.randomProjectedPoints(92L, 200, 3_000.0d);
        CorrelationConfig config = PROJECTED.toBuilder()
                .chunkSize(40.0d)
                .chunkParallelThreshold(0)
                .build();
        OverlappingChunksAlgorithm chunks = OverlappingChunksAlgorithm.build(zones, config);
        BruteForceAlgorithm reference = new BruteForceAlgorithm(CoordinateSystem.PROJECTED_METERS);

        for (Point point : points) {
            assertEquals(reference.correlate(point, zones, 50.0d), chunks.correlate(point, zones, 50.0d));
            assertEquals(reference.correlate(point, zones, 120.0d), chunks.correlate(point, zones, 120.0d));
        }
    }
}
