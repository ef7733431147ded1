package org.amp.correlation.algorithm;

import lombok.experimental.UtilityClass;
import org.amp.core.geo.ZoneSegment;
import org.amp.correlation.core.CorrelationConfig;
import org.amp.correlation.core.CorrelationContracts;
import org.amp.correlation.core.CorrelationException;

import java.util.List;

/**
 * Builds correlation algorithms from an {@link AlgorithmType}.
 *
 * <p>Index construction happens here, once per zone set. The returned instance answers
 * queries against the same {@code zones} list.</p>
 */
@UtilityClass
public final class AlgorithmFactory {

    /**
     * Creates an algorithm with default tunables.
     */
    public static CorrelationAlgorithm create(AlgorithmType type, List<ZoneSegment> zones) {
        return create(type, zones, CorrelationConfig.defaults());
    }

    /**
     * Creates and builds the requested algorithm.
     *
     * @param type requested strategy.
     * @param zones zone set to index.
     * @param config validated tunables.
     * @return ready-to-query algorithm.
     */
    public static CorrelationAlgorithm create(AlgorithmType type, List<ZoneSegment> zones, CorrelationConfig config) {
        if (type == null) {
            throw new CorrelationException(
                    CorrelationException.REASON_ALGORITHM_REQUIRED,
                    "algorithm type must be explicitly specified (KD_TREE, R_TREE, GRID, BRUTE_FORCE, RAYCASTING, OVERLAPPING_CHUNKS)"
            );
        }
        CorrelationContracts.requireZones(zones);
        if (config == null) {
            throw new CorrelationException(CorrelationException.REASON_CONFIG_INVALID, "config must be provided");
        }
        config.validate();

        return switch (type) {
            case BRUTE_FORCE -> new BruteForceAlgorithm(config.getCoordinateSystem());
            case RAYCASTING -> new RaycastingAlgorithm(config.getCoordinateSystem());
            case GRID -> GridIndexAlgorithm.build(zones, config);
            case OVERLAPPING_CHUNKS -> OverlappingChunksAlgorithm.build(zones, config);
            case KD_TREE -> KDTreeAlgorithm.build(zones, config);
            case R_TREE -> RTreeAlgorithm.build(zones, config);
        };
    }
}
