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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Balanced 2-d tree over segment midpoints.
 *
 * <p>Nodes live in parallel primitive arrays addressed by int index; leaves reference
 * contiguous spans of {@code leafItems}. The tree is immutable after construction and safe
 * for concurrent reads.</p>
 *
 * <p>A query collects the {@code k} midpoints nearest to the point inside radius
 * {@code cutoff + maxHalfLength}, where distances use a planar metric scaled to meters at
 * the query latitude, and measures each candidate segment exactly. The nearest midpoint
 * does not always belong to the nearest segment. With candidate expansion enabled,
 * {@code k} doubles until no unvisited midpoint can own a closer segment, which makes the
 * result exact. With expansion disabled the result is the plain k-candidate approximation.</p>
 */
@Slf4j
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class KDTreeAlgorithm implements CorrelationAlgorithm {
    /**
     * Relative tolerance between the planar candidate metric and haversine distance.
     */
    private static final double METRIC_SLACK = 0.01d;

    private final ZoneGeometry geometry;
    @Getter
    @Accessors(fluent = true)
    private final int candidateCount;
    @Getter
    @Accessors(fluent = true)
    private final boolean candidateExpansion;
    @Getter
    @Accessors(fluent = true)
    private final double maxHalfLengthMeters;

    private final int rootIndex;
    private final double[] splitValues;
    private final byte[] splitAxes;
    private final int[] leftChildren;
    private final int[] rightChildren;
    private final int[] itemStartIndices;
    private final int[] itemCounts;
    private final int[] leafItems;
    private final double[] midX;
    private final double[] midY;

    /**
     * Builds the tree in O(n log n) with median splits on the wider axis.
     */
    public static KDTreeAlgorithm build(List<ZoneSegment> zones, CorrelationConfig config) {
        Objects.requireNonNull(config, "config");
        ZoneGeometry geometry = ZoneGeometry.of(zones, config.getCoordinateSystem());
        int n = geometry.size();

        double[] midX = new double[n];
        double[] midY = new double[n];
        double maxHalfLength = 0.0d;
        for (int i = 0; i < n; i++) {
            midX[i] = geometry.midX(i);
            midY[i] = geometry.midY(i);
            double halfLength = 0.5d * GeoMath.distanceMeters(
                    geometry.system,
                    geometry.startX[i], geometry.startY[i],
                    geometry.endX[i], geometry.endY[i]
            );
            maxHalfLength = Math.max(maxHalfLength, halfLength);
        }

        int[] items = new int[n];
        for (int i = 0; i < n; i++) {
            items[i] = i;
        }

        TreeBuilder builder = new TreeBuilder(items, midX, midY, config.getKdLeafSize(),
                GeoMath.metersPerUnitX(geometry.system, meanY(midY)), GeoMath.metersPerUnitY(geometry.system));
        int root = n == 0 ? -1 : builder.buildNode(0, n);

        KDTreeAlgorithm tree = new KDTreeAlgorithm(
                geometry,
                config.getKdCandidateCount(),
                config.isKdCandidateExpansion(),
                maxHalfLength,
                root,
                builder.splitValues.toDoubleArray(),
                builder.splitAxes.toByteArray(),
                builder.leftChildren.toIntArray(),
                builder.rightChildren.toIntArray(),
                builder.itemStarts.toIntArray(),
                builder.itemCounts.toIntArray(),
                items,
                midX,
                midY
        );
        log.debug("kd tree built: zones={}, nodes={}, leafSize={}, maxHalfLength={} m",
                n, tree.treeNodeCount(), config.getKdLeafSize(), maxHalfLength);
        return tree;
    }

    @Override
    public AlgorithmType type() {
        return AlgorithmType.KD_TREE;
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

        double scaleX = GeoMath.metersPerUnitX(geometry.system, py);
        double scaleY = GeoMath.metersPerUnitY(geometry.system);
        double radius = (cutoffMeters + maxHalfLengthMeters) * (1.0d + METRIC_SLACK);

        int k = Math.min(candidateCount, geometry.size());
        int measuredUpTo = 0;
        while (true) {
            CandidateHeap heap = new CandidateHeap(k);
            nearestMidpoints(px, py, scaleX, scaleY, radius, heap);
            boolean saturated = heap.isFull();
            double worstCandidate = heap.worstDistance();
            int[] candidates = heap.sortedItems();

            // Candidates come back nearest first, and a larger k extends the previous prefix.
            for (int i = measuredUpTo; i < candidates.length; i++) {
                collector.offer(candidates[i], geometry.distance(candidates[i], px, py));
            }
            measuredUpTo = candidates.length;

            if (!candidateExpansion || !saturated || k >= geometry.size()) {
                break;
            }
            double lowerBound = worstCandidate * (1.0d - METRIC_SLACK) - maxHalfLengthMeters;
            if (Math.min(collector.bestDistance(), cutoffMeters) < lowerBound) {
                break;
            }
            k = (int) Math.min(geometry.size(), 2L * k);
        }
        return collector.result();
    }

    /**
     * Number of tree nodes, leaves included.
     */
    public int treeNodeCount() {
        return splitValues.length;
    }

    /**
     * Collects up to {@code heap.capacity} midpoints within {@code radius} planar meters.
     */
    private void nearestMidpoints(
            double px,
            double py,
            double scaleX,
            double scaleY,
            double radius,
            CandidateHeap heap
    ) {
        int[] stack = new int[Math.max(4, Math.min(64, splitValues.length))];
        int top = 0;
        stack[top++] = rootIndex;

        while (top > 0) {
            int nodeIndex = stack[--top];

            if (itemCounts[nodeIndex] > 0) {
                int start = itemStartIndices[nodeIndex];
                int end = start + itemCounts[nodeIndex];
                for (int i = start; i < end; i++) {
                    int item = leafItems[i];
                    double dx = (midX[item] - px) * scaleX;
                    double dy = (midY[item] - py) * scaleY;
                    double distance = Math.sqrt(dx * dx + dy * dy);
                    if (distance <= radius) {
                        heap.offer(item, distance);
                    }
                }
                continue;
            }

            int axis = splitAxes[nodeIndex];
            double delta = axis == 0
                    ? (px - splitValues[nodeIndex]) * scaleX
                    : (py - splitValues[nodeIndex]) * scaleY;
            double planeDistance = Math.abs(delta);

            int nearChild = delta <= 0.0d ? leftChildren[nodeIndex] : rightChildren[nodeIndex];
            int farChild = delta <= 0.0d ? rightChildren[nodeIndex] : leftChildren[nodeIndex];

            if (farChild >= 0 && planeDistance <= radius && planeDistance <= heap.pruneDistance()) {
                if (top == stack.length) {
                    stack = Arrays.copyOf(stack, stack.length << 1);
                }
                stack[top++] = farChild;
            }
            if (nearChild >= 0) {
                if (top == stack.length) {
                    stack = Arrays.copyOf(stack, stack.length << 1);
                }
                stack[top++] = nearChild;
            }
        }
    }

    private static double meanY(double[] midY) {
        if (midY.length == 0) {
            return 0.0d;
        }
        double sum = 0.0d;
        for (double y : midY) {
            sum += y;
        }
        return sum / midY.length;
    }

    /**
     * Recursive median-split construction into growable primitive lists.
     */
    private static final class TreeBuilder {
        private final int[] items;
        private final double[] midX;
        private final double[] midY;
        private final int leafSize;
        private final double scaleX;
        private final double scaleY;

        private final DoubleArrayList splitValues = new DoubleArrayList();
        private final ByteArrayList splitAxes = new ByteArrayList();
        private final IntArrayList leftChildren = new IntArrayList();
        private final IntArrayList rightChildren = new IntArrayList();
        private final IntArrayList itemStarts = new IntArrayList();
        private final IntArrayList itemCounts = new IntArrayList();

        private TreeBuilder(int[] items, double[] midX, double[] midY, int leafSize, double scaleX, double scaleY) {
            this.items = items;
            this.midX = midX;
            this.midY = midY;
            this.leafSize = leafSize;
            this.scaleX = scaleX;
            this.scaleY = scaleY;
        }

        private int buildNode(int from, int to) {
            int nodeIndex = allocate();
            if (to - from <= leafSize) {
                itemStarts.set(nodeIndex, from);
                itemCounts.set(nodeIndex, to - from);
                return nodeIndex;
            }

            int axis = widerAxis(from, to);
            double[] coordinates = axis == 0 ? midX : midY;
            // Sort by coordinate, then zone index, so equal coordinates split deterministically.
            IntArrays.quickSort(items, from, to, (a, b) -> {
                int byCoordinate = Double.compare(coordinates[a], coordinates[b]);
                return byCoordinate != 0 ? byCoordinate : Integer.compare(a, b);
            });
            int median = (from + to) >>> 1;

            splitAxes.set(nodeIndex, (byte) axis);
            splitValues.set(nodeIndex, coordinates[items[median]]);
            int left = buildNode(from, median);
            int right = buildNode(median, to);
            leftChildren.set(nodeIndex, left);
            rightChildren.set(nodeIndex, right);
            return nodeIndex;
        }

        private int allocate() {
            splitValues.add(0.0d);
            splitAxes.add((byte) 0);
            leftChildren.add(-1);
            rightChildren.add(-1);
            itemStarts.add(0);
            itemCounts.add(0);
            return splitValues.size() - 1;
        }

        private int widerAxis(int from, int to) {
            double minX = Double.POSITIVE_INFINITY;
            double maxX = Double.NEGATIVE_INFINITY;
            double minY = Double.POSITIVE_INFINITY;
            double maxY = Double.NEGATIVE_INFINITY;
            for (int i = from; i < to; i++) {
                int item = items[i];
                minX = Math.min(minX, midX[item]);
                maxX = Math.max(maxX, midX[item]);
                minY = Math.min(minY, midY[item]);
                maxY = Math.max(maxY, midY[item]);
            }
            return (maxX - minX) * scaleX >= (maxY - minY) * scaleY ? 0 : 1;
        }
    }

    /**
     * Bounded max-heap keeping the {@code capacity} nearest candidates.
     * Equal distances keep the lower zone index.
     */
    private static final class CandidateHeap {
        private final int capacity;
        private final int[] items;
        private final double[] distances;
        private int size;

        private CandidateHeap(int capacity) {
            this.capacity = capacity;
            this.items = new int[capacity];
            this.distances = new double[capacity];
        }

        private boolean isFull() {
            return size == capacity;
        }

        private double worstDistance() {
            return size == 0 ? Double.POSITIVE_INFINITY : distances[0];
        }

        /**
         * Distance beyond which no subtree can improve the heap.
         */
        private double pruneDistance() {
            return isFull() ? distances[0] : Double.POSITIVE_INFINITY;
        }

        private void offer(int item, double distance) {
            if (size < capacity) {
                items[size] = item;
                distances[size] = distance;
                siftUp(size++);
                return;
            }
            if (worse(item, distance, items[0], distances[0])) {
                return;
            }
            items[0] = item;
            distances[0] = distance;
            siftDown(0);
        }

        /**
         * Drains the heap into an array ordered nearest first. The heap is empty afterwards.
         */
        private int[] sortedItems() {
            int[] sorted = new int[size];
            for (int i = sorted.length - 1; i >= 0; i--) {
                sorted[i] = items[0];
                size--;
                items[0] = items[size];
                distances[0] = distances[size];
                siftDown(0);
            }
            return sorted;
        }

        private void siftUp(int index) {
            while (index > 0) {
                int parent = (index - 1) >>> 1;
                if (!worse(items[index], distances[index], items[parent], distances[parent])) {
                    return;
                }
                swap(index, parent);
                index = parent;
            }
        }

        private void siftDown(int index) {
            while (true) {
                int left = 2 * index + 1;
                if (left >= size) {
                    return;
                }
                int right = left + 1;
                int worst = left;
                if (right < size && worse(items[right], distances[right], items[left], distances[left])) {
                    worst = right;
                }
                if (!worse(items[worst], distances[worst], items[index], distances[index])) {
                    return;
                }
                swap(index, worst);
                index = worst;
            }
        }

        private static boolean worse(int itemA, double distanceA, int itemB, double distanceB) {
            return distanceA > distanceB || (distanceA == distanceB && itemA > itemB);
        }

        private void swap(int a, int b) {
            int item = items[a];
            items[a] = items[b];
            items[b] = item;
            double distance = distances[a];
            distances[a] = distances[b];
            distances[b] = distance;
        }
    }

    @Override
    public String toString() {
        return "KDTreeAlgorithm[zones=" + geometry.size() + ", treeNodes=" + splitValues.length
                + ", k=" + candidateCount + ", expansion=" + candidateExpansion + "]";
    }
}
