package org.amp.correlation.algorithm;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
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
import org.amp.correlation.geometry.SearchExtent;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Sort-Tile-Recursive packed R-tree over segment bounding boxes.
 *
 * <p>Every node stores its bounding box and a span of {@code entries}: zone indices for
 * leaves, child node indices for internal nodes. Indexing full segment extents means a long
 * segment passing close to the query is found even when its midpoint is far away.</p>
 *
 * <p>Queries search outward in three rounds ({@code cutoff / 4}, {@code cutoff / 2},
 * {@code cutoff}) and stop as soon as the best match lies within the current radius, since
 * every zone outside the searched box is farther than that radius.</p>
 */
@Slf4j
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RTreeAlgorithm implements CorrelationAlgorithm {
    private static final double[] SEARCH_FRACTIONS = {0.25d, 0.5d, 1.0d};

    private final ZoneGeometry geometry;
    @Getter
    @Accessors(fluent = true)
    private final int nodeCapacity;
    @Getter
    @Accessors(fluent = true)
    private final int height;

    private final int rootIndex;
    private final double[] nodeMinX;
    private final double[] nodeMinY;
    private final double[] nodeMaxX;
    private final double[] nodeMaxY;
    private final int[] entryStartIndices;
    private final int[] entryCounts;
    private final byte[] leafFlags;
    private final int[] entries;

    /**
     * Bulk-loads the tree in O(n log n) with node capacity {@code config.rtreeNodeCapacity}.
     */
    public static RTreeAlgorithm build(List<ZoneSegment> zones, CorrelationConfig config) {
        Objects.requireNonNull(config, "config");
        ZoneGeometry geometry = ZoneGeometry.of(zones, config.getCoordinateSystem());
        int capacity = config.getRtreeNodeCapacity();
        TreeBuilder builder = new TreeBuilder(capacity);

        int n = geometry.size();
        int root = -1;
        int height = 0;
        if (n > 0) {
            int[] level = new int[n];
            double[] minX = new double[n];
            double[] minY = new double[n];
            double[] maxX = new double[n];
            double[] maxY = new double[n];
            for (int i = 0; i < n; i++) {
                level[i] = i;
                minX[i] = geometry.minX(i);
                minY[i] = geometry.minY(i);
                maxX[i] = geometry.maxX(i);
                maxY[i] = geometry.maxY(i);
            }

            int[] parents = builder.packLevel(level, minX, minY, maxX, maxY, true);
            height = 1;
            while (parents.length > 1) {
                parents = builder.packLevel(
                        parents,
                        builder.minX.toDoubleArray(),
                        builder.minY.toDoubleArray(),
                        builder.maxX.toDoubleArray(),
                        builder.maxY.toDoubleArray(),
                        false
                );
                height++;
            }
            root = parents[0];
        }

        RTreeAlgorithm tree = new RTreeAlgorithm(
                geometry,
                capacity,
                height,
                root,
                builder.minX.toDoubleArray(),
                builder.minY.toDoubleArray(),
                builder.maxX.toDoubleArray(),
                builder.maxY.toDoubleArray(),
                builder.entryStarts.toIntArray(),
                builder.entryCounts.toIntArray(),
                builder.leafFlags.toByteArray(),
                builder.entries.toIntArray()
        );
        log.debug("r-tree built: zones={}, nodes={}, height={}, capacity={}",
                n, tree.nodeCount(), height, capacity);
        return tree;
    }

    @Override
    public AlgorithmType type() {
        return AlgorithmType.R_TREE;
    }

    @Override
    public Optional<ZoneMatch> correlate(Point point, List<ZoneSegment> zones, double cutoffMeters) {
        CorrelationContracts.requireCutoff(cutoffMeters);
        CorrelationContracts.requireIndexedZones(zones, geometry.size());
        double px = ZoneGeometry.queryX(point);
        double py = ZoneGeometry.queryY(point);

        NearestZoneCollector collector = new NearestZoneCollector(cutoffMeters);
        if (rootIndex < 0) {
            return collector.result();
        }

        for (double fraction : SEARCH_FRACTIONS) {
            double radius = cutoffMeters * fraction;
            SearchExtent box = GeoMath.searchExtent(geometry.system, px, py, radius);
            searchBox(px, py, box, collector);
            if (collector.hasMatch() && collector.bestDistance() <= radius) {
                break;
            }
        }
        return collector.result();
    }

    /**
     * Number of tree nodes, leaves included.
     */
    public int nodeCount() {
        return leafFlags.length;
    }

    private void searchBox(double px, double py, SearchExtent box, NearestZoneCollector collector) {
        int[] stack = new int[Math.max(4, Math.min(64, leafFlags.length))];
        int top = 0;
        stack[top++] = rootIndex;

        while (top > 0) {
            int nodeIndex = stack[--top];
            if (!box.intersects(px, py,
                    nodeMinX[nodeIndex], nodeMinY[nodeIndex],
                    nodeMaxX[nodeIndex], nodeMaxY[nodeIndex])) {
                continue;
            }

            int start = entryStartIndices[nodeIndex];
            int end = start + entryCounts[nodeIndex];
            if (leafFlags[nodeIndex] != 0) {
                for (int i = start; i < end; i++) {
                    int zoneIndex = entries[i];
                    if (box.intersects(px, py,
                            geometry.minX(zoneIndex), geometry.minY(zoneIndex),
                            geometry.maxX(zoneIndex), geometry.maxY(zoneIndex))) {
                        collector.offer(zoneIndex, geometry.distance(zoneIndex, px, py));
                    }
                }
                continue;
            }

            for (int i = start; i < end; i++) {
                if (top == stack.length) {
                    stack = Arrays.copyOf(stack, stack.length << 1);
                }
                stack[top++] = entries[i];
            }
        }
    }

    /**
     * Sort-Tile-Recursive packing into growable primitive lists.
     */
    private static final class TreeBuilder {
        private final int capacity;
        private final DoubleArrayList minX = new DoubleArrayList();
        private final DoubleArrayList minY = new DoubleArrayList();
        private final DoubleArrayList maxX = new DoubleArrayList();
        private final DoubleArrayList maxY = new DoubleArrayList();
        private final IntArrayList entryStarts = new IntArrayList();
        private final IntArrayList entryCounts = new IntArrayList();
        private final ByteArrayList leafFlags = new ByteArrayList();
        private final IntArrayList entries = new IntArrayList();

        private TreeBuilder(int capacity) {
            this.capacity = capacity;
        }

        /**
         * Packs one level of boxes into parent nodes and returns the new node indices.
         *
         * @param ids zone indices (leaf level) or node indices (upper levels); reordered in place.
         * @param boxMinX box lower x bounds indexed by id, likewise the other bound arrays.
         */
        private int[] packLevel(
                int[] ids,
                double[] boxMinX,
                double[] boxMinY,
                double[] boxMaxX,
                double[] boxMaxY,
                boolean leafLevel
        ) {
            int count = ids.length;
            int nodeCount = (count + capacity - 1) / capacity;
            int sliceCount = (int) Math.ceil(Math.sqrt(nodeCount));
            int sliceSize = sliceCount * capacity;

            IntArrays.quickSort(ids, 0, count, (a, b) -> {
                int byCenter = Double.compare(boxMinX[a] + boxMaxX[a], boxMinX[b] + boxMaxX[b]);
                return byCenter != 0 ? byCenter : Integer.compare(a, b);
            });

            int[] parents = new int[nodeCount];
            int parentCursor = 0;
            for (int sliceStart = 0; sliceStart < count; sliceStart += sliceSize) {
                int sliceEnd = Math.min(count, sliceStart + sliceSize);
                IntArrays.quickSort(ids, sliceStart, sliceEnd, (a, b) -> {
                    int byCenter = Double.compare(boxMinY[a] + boxMaxY[a], boxMinY[b] + boxMaxY[b]);
                    return byCenter != 0 ? byCenter : Integer.compare(a, b);
                });
                for (int groupStart = sliceStart; groupStart < sliceEnd; groupStart += capacity) {
                    int groupEnd = Math.min(sliceEnd, groupStart + capacity);
                    parents[parentCursor++] = emitNode(ids, groupStart, groupEnd,
                            boxMinX, boxMinY, boxMaxX, boxMaxY, leafLevel);
                }
            }
            return Arrays.copyOf(parents, parentCursor);
        }

        private int emitNode(
                int[] ids,
                int from,
                int to,
                double[] boxMinX,
                double[] boxMinY,
                double[] boxMaxX,
                double[] boxMaxY,
                boolean leaf
        ) {
            double nodeMinX = Double.POSITIVE_INFINITY;
            double nodeMinY = Double.POSITIVE_INFINITY;
            double nodeMaxX = Double.NEGATIVE_INFINITY;
            double nodeMaxY = Double.NEGATIVE_INFINITY;
            int entryStart = entries.size();
            for (int i = from; i < to; i++) {
                int id = ids[i];
                nodeMinX = Math.min(nodeMinX, boxMinX[id]);
                nodeMinY = Math.min(nodeMinY, boxMinY[id]);
                nodeMaxX = Math.max(nodeMaxX, boxMaxX[id]);
                nodeMaxY = Math.max(nodeMaxY, boxMaxY[id]);
                entries.add(id);
            }

            minX.add(nodeMinX);
            minY.add(nodeMinY);
            maxX.add(nodeMaxX);
            maxY.add(nodeMaxY);
            entryStarts.add(entryStart);
            entryCounts.add(to - from);
            leafFlags.add(leaf ? (byte) 1 : (byte) 0);
            return minX.size() - 1;
        }
    }

    @Override
    public String toString() {
        return "RTreeAlgorithm[zones=" + geometry.size() + ", nodes=" + leafFlags.length
                + ", height=" + height + ", capacity=" + nodeCapacity + "]";
    }
}
