package org.amp.correlation.algorithm;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Immutable nearest-zone match for one address.
 *
 * <p>{@code zoneIndex} indexes the zone list the caller passed to the algorithm;
 * {@code distanceMeters} is non-negative and never above the query cutoff.</p>
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@RequiredArgsConstructor
public final class ZoneMatch {
    /**
     * Distances below this many meters count as the address lying on the zone.
     */
    public static final double EXACT_MATCH_TOLERANCE_METERS = 0.001d;

    private final int zoneIndex;
    private final double distanceMeters;

    /**
     * Returns true when the address lies on the zone within {@link #EXACT_MATCH_TOLERANCE_METERS}.
     */
    public boolean isExact() {
        return distanceMeters < EXACT_MATCH_TOLERANCE_METERS;
    }

    /**
     * Deterministic ordering shared by all algorithms: smaller distance wins, and on an
     * exact distance tie the lower zone index wins.
     */
    public boolean isCloserThan(ZoneMatch other) {
        return other == null || isCloser(zoneIndex, distanceMeters, other.zoneIndex, other.distanceMeters);
    }

    static boolean isCloser(int candidateIndex, double candidateDistance, int bestIndex, double bestDistance) {
        return candidateDistance < bestDistance
                || (candidateDistance == bestDistance && (bestIndex < 0 || candidateIndex < bestIndex));
    }

    @Override
    public String toString() {
        return "ZoneMatch[zoneIndex=" + zoneIndex + ", distanceMeters=" + distanceMeters + "]";
    }
}
