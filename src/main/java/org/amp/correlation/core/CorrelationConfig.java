package org.amp.correlation.core;

import lombok.Builder;
import lombok.Value;
import org.amp.core.geo.CoordinateSystem;

/**
 * Tunables shared by the algorithm factory, the batch runner and the benchmarker.
 *
 * <p>Size parameters ({@code cellSize}, {@code chunkSize}) are in coordinate units of
 * {@link #getCoordinateSystem()}: degrees for WGS84, meters for projected input.</p>
 */
@Value
@Builder(toBuilder = true)
public class CorrelationConfig {
    public static final double DEFAULT_CUTOFF_METERS = 50.0d;
    public static final double DEFAULT_CELL_SIZE_DEGREES = 0.0005d;
    public static final double DEFAULT_CHUNK_SIZE_DEGREES = 0.001d;
    public static final double DEFAULT_CELL_SIZE_METERS = 50.0d;
    public static final double DEFAULT_CHUNK_SIZE_METERS = 100.0d;

    /**
     * Maximum match distance in meters. Must be finite and > 0.
     */
    @Builder.Default
    double cutoffMeters = DEFAULT_CUTOFF_METERS;

    @Builder.Default
    CoordinateSystem coordinateSystem = CoordinateSystem.WGS84_DEGREES;

    /**
     * Grid cell edge length, roughly 50 m at Nordic latitudes by default.
     */
    @Builder.Default
    double cellSize = DEFAULT_CELL_SIZE_DEGREES;

    /**
     * Edge length of one overlapping chunk before its overlap margin is added.
     * Widened to the margin itself when the cutoff needs more.
     */
    @Builder.Default
    double chunkSize = DEFAULT_CHUNK_SIZE_DEGREES;

    /**
     * Initial number of nearest midpoints the k-d tree inspects per query.
     */
    @Builder.Default
    int kdCandidateCount = 8;

    @Builder.Default
    int kdLeafSize = 8;

    /**
     * When true the k-d tree doubles its candidate count until no unvisited midpoint can
     * own a closer segment. When false results are the plain k-candidate approximation.
     */
    @Builder.Default
    boolean kdCandidateExpansion = true;

    @Builder.Default
    int rtreeNodeCapacity = 8;

    /**
     * Minimum number of chunk members before a multi-chunk query forks per chunk.
     */
    @Builder.Default
    int chunkParallelThreshold = 512;

    /**
     * Worker count for batch correlation. {@code 1} runs on the calling thread.
     */
    @Builder.Default
    int parallelism = Runtime.getRuntime().availableProcessors();

    /**
     * Benchmark sample size. {@code 0} means all available addresses.
     */
    @Builder.Default
    int sampleSize = 0;

    /**
     * Defaults for WGS84 degree input.
     */
    public static CorrelationConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults for projected meter input, with cell and chunk sizes expressed in meters.
     */
    public static CorrelationConfig projectedMeters() {
        return builder()
                .coordinateSystem(CoordinateSystem.PROJECTED_METERS)
                .cellSize(DEFAULT_CELL_SIZE_METERS)
                .chunkSize(DEFAULT_CHUNK_SIZE_METERS)
                .build();
    }

    /**
     * Validates every tunable and returns this instance for chaining.
     *
     * @throws CorrelationException with {@link CorrelationException#REASON_CUTOFF_NOT_POSITIVE}
     * for a bad cutoff, {@link CorrelationException#REASON_CONFIG_INVALID} otherwise.
     */
    public CorrelationConfig validate() {
        CorrelationContracts.requireCutoff(cutoffMeters);
        if (coordinateSystem == null) {
            throw invalid("coordinateSystem must be provided");
        }
        requirePositiveFinite(cellSize, "cellSize");
        requirePositiveFinite(chunkSize, "chunkSize");
        if (kdCandidateCount < 1) {
            throw invalid("kdCandidateCount must be >= 1, got " + kdCandidateCount);
        }
        if (kdLeafSize < 1) {
            throw invalid("kdLeafSize must be >= 1, got " + kdLeafSize);
        }
        if (rtreeNodeCapacity < 2) {
            throw invalid("rtreeNodeCapacity must be >= 2, got " + rtreeNodeCapacity);
        }
        if (chunkParallelThreshold < 0) {
            throw invalid("chunkParallelThreshold must be >= 0, got " + chunkParallelThreshold);
        }
        if (parallelism < 1) {
            throw invalid("parallelism must be >= 1, got " + parallelism);
        }
        if (sampleSize < 0) {
            throw new CorrelationException(
                    CorrelationException.REASON_SAMPLE_SIZE_INVALID,
                    "sampleSize must be >= 0, got " + sampleSize
            );
        }
        return this;
    }

    private static void requirePositiveFinite(double value, String name) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw invalid(name + " must be finite and > 0, got " + value);
        }
    }

    private static CorrelationException invalid(String message) {
        return new CorrelationException(CorrelationException.REASON_CONFIG_INVALID, message);
    }
}
