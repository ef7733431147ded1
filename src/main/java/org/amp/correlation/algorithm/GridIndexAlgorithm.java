package org.amp.correlation.algorithm;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.amp.core.geo.Point;
import org.amp.core.geo.ZoneSegment;
import org.amp.correlation.core.CorrelationConfig;
import org.amp.correlation.core.CorrelationContracts;
import org.amp.correlation.geometry.GeoMath;
import org.amp.correlation.geometry.GridCell;
import org.amp.correlation.geometry.SearchExtent;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed-cell spatial hash over zone segments.
 *
 * <p>Build walks every segment through the grid and records its index once in each
 * touched cell. Query gathers candidates from the point's cell and its neighbours and
 * measures each exactly.</p>
 *
 * <p>The plain 3x3 neighbourhood only guarantees the true nearest zone while the cutoff
 * fits inside one cell. Larger cutoffs widen the neighbour ring to
 * {@code ceil(extent / cellSize)} cells so results stay exact.</p>
 */
@Slf4j
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class GridIndexAlgorithm implements CorrelationAlgorithm {
    private static final int[] NO_CANDIDATES = new int[0];

    private final ZoneGeometry geometry;
    @Getter
    @Accessors(fluent = true)
    private final double cellSize;
    private final Long2ObjectOpenHashMap<int[]> cells;

    /**
     * Builds the cell index for {@code zones} using {@code config.cellSize}.
     */
    public static GridIndexAlgorithm build(List<ZoneSegment> zones, CorrelationConfig config) {
        Objects.requireNonNull(config, "config");
        ZoneGeometry geometry = ZoneGeometry.of(zones, config.getCoordinateSystem());
        double cellSize = config.getCellSize();

        Long2ObjectOpenHashMap<IntArrayList> buckets = new Long2ObjectOpenHashMap<>();
        for (int i = 0; i < geometry.size(); i++) {
            for (GridCell cell : GeoMath.segmentCells(
                    geometry.startX[i], geometry.startY[i],
                    geometry.endX[i], geometry.endY[i],
                    cellSize)) {
                IntArrayList bucket = buckets.get(cell.key());
                if (bucket == null) {
                    bucket = new IntArrayList(4);
                    buckets.put(cell.key(), bucket);
                }
                bucket.add(i);
            }
        }

        Long2ObjectOpenHashMap<int[]> cells = new Long2ObjectOpenHashMap<>(buckets.size());
        int maxOccupancy = 0;
        for (Long2ObjectMap.Entry<IntArrayList> entry : buckets.long2ObjectEntrySet()) {
            int[] members = entry.getValue().toIntArray();
            maxOccupancy = Math.max(maxOccupancy, members.length);
            cells.put(entry.getLongKey(), members);
        }

        GridIndexAlgorithm algorithm = new GridIndexAlgorithm(geometry, cellSize, cells);
        if (log.isDebugEnabled()) {
            log.debug("grid index built: zones={}, cells={}, maxCellOccupancy={}, cellSize={}",
                    geometry.size(), cells.size(), maxOccupancy, cellSize);
            int ring = algorithm.ringRadius(geometry.maxAbsY(), config.getCutoffMeters());
            if (ring > 1) {
                log.debug("cutoff {} m exceeds one grid cell; queries widen the neighbour ring to {}",
                        config.getCutoffMeters(), ring);
            }
        }
        return algorithm;
    }

    @Override
    public AlgorithmType type() {
        return AlgorithmType.GRID;
    }

    @Override
    public Optional<ZoneMatch> correlate(Point point, List<ZoneSegment> zones, double cutoffMeters) {
        CorrelationContracts.requireCutoff(cutoffMeters);
        CorrelationContracts.requireIndexedZones(zones, geometry.size());
        double px = ZoneGeometry.queryX(point);
        double py = ZoneGeometry.queryY(point);

        NearestZoneCollector collector = new NearestZoneCollector(cutoffMeters);
        int radius = ringRadius(py, cutoffMeters);
        long ringCells = (2L * radius + 1L) * (2L * radius + 1L);

        if (ringCells > cells.size()) {
            scanAllZones(px, py, cutoffMeters, collector);
            return collector.result();
        }

        GridCell home = GeoMath.gridCell(px, py, cellSize);
        GridCell[] neighbourhood = radius == 1
                ? GeoMath.neighborCells(home)
                : GeoMath.neighborCells(home, radius);
        for (GridCell cell : neighbourhood) {
            int[] members = cells.get(cell.key());
            if (members == null) {
                continue;
            }
            for (int zoneIndex : members) {
                collector.offer(zoneIndex, geometry.distance(zoneIndex, px, py));
            }
        }
        return collector.result();
    }

    /**
     * Zone indices recorded in {@code cell}, ascending. Empty when the cell holds none.
     */
    public int[] candidates(GridCell cell) {
        int[] members = cells.get(Objects.requireNonNull(cell, "cell").key());
        return members == null ? NO_CANDIDATES : members.clone();
    }

    /**
     * Number of non-empty cells.
     */
    public int cellCount() {
        return cells.size();
    }

    /**
     * Neighbour ring radius needed for {@code cutoffMeters} at latitude {@code y}; never below 1.
     */
    int ringRadius(double y, double cutoffMeters) {
        SearchExtent extent = GeoMath.searchExtent(geometry.system, 0.0d, y, cutoffMeters);
        int rings = (int) Math.min(Integer.MAX_VALUE / 4, Math.ceil(extent.maxHalfWidth() / cellSize));
        return Math.max(1, rings);
    }

    private void scanAllZones(double px, double py, double cutoffMeters, NearestZoneCollector collector) {
        SearchExtent extent = GeoMath.searchExtent(geometry.system, px, py, cutoffMeters);
        for (int zoneIndex = 0; zoneIndex < geometry.size(); zoneIndex++) {
            if (extent.intersects(px, py,
                    geometry.minX(zoneIndex), geometry.minY(zoneIndex),
                    geometry.maxX(zoneIndex), geometry.maxY(zoneIndex))) {
                collector.offer(zoneIndex, geometry.distance(zoneIndex, px, py));
            }
        }
    }

    @Override
    public String toString() {
        return "GridIndexAlgorithm[zones=" + geometry.size() + ", cells=" + cells.size()
                + ", cellSize=" + cellSize + "]";
    }
}
