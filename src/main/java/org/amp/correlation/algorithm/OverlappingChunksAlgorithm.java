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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.RecursiveTask;

/**
 * Spatial partitioning into square chunks with an overlap margin.
 *
 * <p>Each chunk covers {@code chunkSize} coordinate units plus a margin of at least the
 * configured cutoff on every side. The edge is widened to the margin when the configured
 * size is smaller, which bounds the chunks a zone is registered in. A zone is registered in every chunk whose widened bounds
 * meet the zone's bounding box, so the chunk whose core holds a query point already lists
 * every zone within the configured cutoff of it.</p>
 *
 * <p>Queries examine every chunk whose widened bounds hold the point. A query cutoff larger
 * than the built margin widens the examined range to all chunks whose cores meet the query
 * box. When more than one chunk is examined and enough members are involved, chunks are
 * searched as parallel fork/join tasks and merged by minimum distance.</p>
 */
@Slf4j
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class OverlappingChunksAlgorithm implements CorrelationAlgorithm {

    private final ZoneGeometry geometry;
    @Getter
    @Accessors(fluent = true)
    private final double chunkSize;
    @Getter
    @Accessors(fluent = true)
    private final SearchExtent overlap;
    private final int parallelThreshold;
    private final Long2ObjectOpenHashMap<int[]> chunks;

    /**
     * Partitions {@code zones} into overlapping chunks sized by {@code config}.
     */
    public static OverlappingChunksAlgorithm build(List<ZoneSegment> zones, CorrelationConfig config) {
        Objects.requireNonNull(config, "config");
        ZoneGeometry geometry = ZoneGeometry.of(zones, config.getCoordinateSystem());
        SearchExtent overlap = GeoMath.searchExtent(
                geometry.system, 0.0d, geometry.maxAbsY(), config.getCutoffMeters());
        // The edge never drops below the margin, so each zone touches at most three extra chunks per axis.
        double chunkSize = Math.max(config.getChunkSize(), overlap.maxHalfWidth());
        if (chunkSize > config.getChunkSize()) {
            log.debug("chunk edge widened from {} to {} to cover cutoff {} m",
                    config.getChunkSize(), chunkSize, config.getCutoffMeters());
        }

        Long2ObjectOpenHashMap<IntArrayList> buckets = new Long2ObjectOpenHashMap<>();
        long registrations = 0L;
        for (int i = 0; i < geometry.size(); i++) {
            int fromX = GeoMath.cellIndex(geometry.minX(i) - overlap.halfWidthX(), chunkSize);
            int toX = GeoMath.cellIndex(geometry.maxX(i) + overlap.halfWidthX(), chunkSize);
            int fromY = GeoMath.cellIndex(geometry.minY(i) - overlap.halfWidthY(), chunkSize);
            int toY = GeoMath.cellIndex(geometry.maxY(i) + overlap.halfWidthY(), chunkSize);
            for (int cx = fromX; cx <= toX; cx++) {
                for (int cy = fromY; cy <= toY; cy++) {
                    long key = GridCell.pack(cx, cy);
                    IntArrayList bucket = buckets.get(key);
                    if (bucket == null) {
                        bucket = new IntArrayList(8);
                        buckets.put(key, bucket);
                    }
                    bucket.add(i);
                    registrations++;
                }
            }
        }

        // Zones are visited in ascending order, so every bucket is already sorted.
        Long2ObjectOpenHashMap<int[]> chunks = new Long2ObjectOpenHashMap<>(buckets.size());
        for (Long2ObjectMap.Entry<IntArrayList> entry : buckets.long2ObjectEntrySet()) {
            chunks.put(entry.getLongKey(), entry.getValue().toIntArray());
        }

        log.debug("chunk index built: zones={}, chunks={}, registrations={}, chunkSize={}, overlap={}",
                geometry.size(), chunks.size(), registrations, chunkSize, overlap);
        return new OverlappingChunksAlgorithm(
                geometry,
                chunkSize,
                overlap,
                config.getChunkParallelThreshold(),
                chunks
        );
    }

    @Override
    public AlgorithmType type() {
        return AlgorithmType.OVERLAPPING_CHUNKS;
    }

    @Override
    public Optional<ZoneMatch> correlate(Point point, List<ZoneSegment> zones, double cutoffMeters) {
        CorrelationContracts.requireCutoff(cutoffMeters);
        CorrelationContracts.requireIndexedZones(zones, geometry.size());
        double px = ZoneGeometry.queryX(point);
        double py = ZoneGeometry.queryY(point);

        List<int[]> examined = examinedChunks(px, py, cutoffMeters);
        NearestZoneCollector collector = new NearestZoneCollector(cutoffMeters);
        if (examined.isEmpty()) {
            return collector.result();
        }

        if (examined.size() > 1 && memberCount(examined) >= parallelThreshold) {
            List<ChunkSearch> tasks = new ArrayList<>(examined.size());
            for (int[] members : examined) {
                tasks.add(new ChunkSearch(geometry, members, px, py, cutoffMeters));
            }
            ForkJoinTask.invokeAll(tasks);
            for (ChunkSearch task : tasks) {
                collector.merge(task.join());
            }
        } else {
            for (int[] members : examined) {
                searchChunk(geometry, members, px, py, collector);
            }
        }
        return collector.result();
    }

    /**
     * Number of non-empty chunks.
     */
    public int chunkCount() {
        return chunks.size();
    }

    /**
     * Zone indices registered in chunk {@code (chunkX, chunkY)}, ascending.
     */
    public int[] chunkMembers(int chunkX, int chunkY) {
        int[] members = chunks.get(GridCell.pack(chunkX, chunkY));
        return members == null ? new int[0] : members.clone();
    }

    /**
     * Number of chunks a query at {@code point} with {@code cutoffMeters} would examine.
     */
    public int examinedChunkCount(Point point, double cutoffMeters) {
        CorrelationContracts.requireCutoff(cutoffMeters);
        return examinedChunks(ZoneGeometry.queryX(point), ZoneGeometry.queryY(point), cutoffMeters).size();
    }

    private List<int[]> examinedChunks(double px, double py, double cutoffMeters) {
        SearchExtent query = GeoMath.searchExtent(geometry.system, px, py, cutoffMeters);
        double reachX = Math.max(overlap.halfWidthX(), query.halfWidthX());
        double reachY = Math.max(overlap.halfWidthY(), query.halfWidthY());

        int fromX = GeoMath.cellIndex(px - reachX, chunkSize);
        int toX = GeoMath.cellIndex(px + reachX, chunkSize);
        int fromY = GeoMath.cellIndex(py - reachY, chunkSize);
        int toY = GeoMath.cellIndex(py + reachY, chunkSize);

        List<int[]> examined = new ArrayList<>();
        long span = ((long) toX - fromX + 1L) * ((long) toY - fromY + 1L);
        if (span > chunks.size()) {
            for (int[] members : chunks.values()) {
                examined.add(members);
            }
            return examined;
        }
        for (int cx = fromX; cx <= toX; cx++) {
            for (int cy = fromY; cy <= toY; cy++) {
                int[] members = chunks.get(GridCell.pack(cx, cy));
                if (members != null) {
                    examined.add(members);
                }
            }
        }
        return examined;
    }

    private static long memberCount(List<int[]> examined) {
        long total = 0L;
        for (int[] members : examined) {
            total += members.length;
        }
        return total;
    }

    private static void searchChunk(
            ZoneGeometry geometry,
            int[] members,
            double px,
            double py,
            NearestZoneCollector collector
    ) {
        for (int zoneIndex : members) {
            collector.offer(zoneIndex, geometry.distance(zoneIndex, px, py));
        }
    }

    /**
     * Independent search of one chunk, run as a fork/join subtask.
     */
    private static final class ChunkSearch extends RecursiveTask<NearestZoneCollector> {
        private final ZoneGeometry geometry;
        private final int[] members;
        private final double px;
        private final double py;
        private final double cutoffMeters;

        private ChunkSearch(ZoneGeometry geometry, int[] members, double px, double py, double cutoffMeters) {
            this.geometry = geometry;
            this.members = members;
            this.px = px;
            this.py = py;
            this.cutoffMeters = cutoffMeters;
        }

        @Override
        protected NearestZoneCollector compute() {
            NearestZoneCollector local = new NearestZoneCollector(cutoffMeters);
            searchChunk(geometry, members, px, py, local);
            return local;
        }
    }

    @Override
    public String toString() {
        return "OverlappingChunksAlgorithm[zones=" + geometry.size() + ", chunks=" + chunks.size()
                + ", chunkSize=" + chunkSize + "]";
    }
}
