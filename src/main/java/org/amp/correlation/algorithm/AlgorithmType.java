package org.amp.correlation.algorithm;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Supported nearest-zone strategies.
 *
 * <p>{@code BRUTE_FORCE} is the reference every other strategy is tested against.</p>
 * <p>{@code GRID}, {@code KD_TREE} and {@code R_TREE} build an index once and answer
 * lookups from it.</p>
 * <p>{@code OVERLAPPING_CHUNKS} partitions zones into overlapping tiles searched in parallel.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum AlgorithmType {
    KD_TREE("KD-Tree", "Fast k-dimensional tree partitioning"),
    R_TREE("R-Tree", "Efficient rectangle-based indexing"),
    GRID("Grid", "Regular grid approximation"),
    BRUTE_FORCE("Distance-Based", "Brute force distance check"),
    RAYCASTING("Raycasting", "Polygon containment testing"),
    OVERLAPPING_CHUNKS("Overlapping Chunks", "Advanced chunk partitioning");

    private final String displayName;
    private final String description;
}
