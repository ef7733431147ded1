package org.amp.correlation.algorithm;

import java.util.Optional;

/**
 * Running minimum used inside query loops.
 *
 * <p>Thread-confined: each query creates its own collector. Offers beyond the cutoff and
 * NaN distances are ignored.</p>
 */
final class NearestZoneCollector {
    private final double cutoffMeters;
    private int bestIndex = -1;
    private double bestDistance = Double.POSITIVE_INFINITY;

    NearestZoneCollector(double cutoffMeters) {
        this.cutoffMeters = cutoffMeters;
    }

    /**
     * Offers one candidate; returns true when it became the current best.
     */
    boolean offer(int zoneIndex, double distanceMeters) {
        if (!(distanceMeters <= cutoffMeters)) {
            return false;
        }
        if (ZoneMatch.isCloser(zoneIndex, distanceMeters, bestIndex, bestDistance)) {
            bestIndex = zoneIndex;
            bestDistance = distanceMeters;
            return true;
        }
        return false;
    }

    /**
     * Merges another collector's best candidate into this one.
     */
    void merge(NearestZoneCollector other) {
        if (other.hasMatch()) {
            offer(other.bestIndex, other.bestDistance);
        }
    }

    boolean hasMatch() {
        return bestIndex >= 0;
    }

    int bestIndex() {
        return bestIndex;
    }

    /**
     * Best distance so far, or positive infinity when nothing matched.
     */
    double bestDistance() {
        return bestDistance;
    }

    Optional<ZoneMatch> result() {
        if (bestIndex < 0) {
            return Optional.empty();
        }
        return Optional.of(new ZoneMatch(bestIndex, bestDistance));
    }
}
