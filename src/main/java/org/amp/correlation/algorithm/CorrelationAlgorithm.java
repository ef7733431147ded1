package org.amp.correlation.algorithm;

import org.amp.core.geo.Point;
import org.amp.core.geo.ZoneSegment;

import java.util.List;
import java.util.Optional;

/**
 * Nearest-zone lookup contract shared by every strategy.
 *
 * <p>Implementations are immutable after construction and safe for concurrent queries.
 * Index construction happens once in {@link AlgorithmFactory}; {@link #correlate} never
 * mutates the index.</p>
 */
public interface CorrelationAlgorithm {

    /**
     * Strategy implemented by this instance.
     */
    AlgorithmType type();

    /**
     * Finds the zone nearest to {@code point} within {@code cutoffMeters}.
     *
     * <p>On exactly equal distances the lower zone index wins.</p>
     *
     * @param point query coordinate.
     * @param zones zone list; indexed strategies require the list they were built from.
     * @param cutoffMeters maximum match distance, finite and > 0.
     * @return nearest zone and its distance, or empty when nothing lies within the cutoff.
     * @throws org.amp.correlation.core.CorrelationException on contract violations.
     * @throws IllegalArgumentException when the query coordinate is not finite.
     */
    Optional<ZoneMatch> correlate(Point point, List<ZoneSegment> zones, double cutoffMeters);
}
