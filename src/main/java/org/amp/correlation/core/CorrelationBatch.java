package org.amp.correlation.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.amp.correlation.algorithm.AlgorithmType;
import org.amp.correlation.algorithm.ZoneMatch;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Result of one batch correlation.
 *
 * <p>{@code matches.get(i)} always belongs to input address {@code i}. Addresses whose
 * computation failed hold an empty result and are counted in {@code failureCount}.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class CorrelationBatch {
    private final AlgorithmType algorithmType;
    private final double cutoffMeters;
    private final List<Optional<ZoneMatch>> matches;
    private final int failureCount;
    private final Duration elapsed;

    public int size() {
        return matches.size();
    }

    public Optional<ZoneMatch> match(int addressIndex) {
        return matches.get(addressIndex);
    }

    /**
     * Number of addresses matched to a zone.
     */
    public int matchedCount() {
        int matched = 0;
        for (Optional<ZoneMatch> match : matches) {
            if (match.isPresent()) {
                matched++;
            }
        }
        return matched;
    }

    @Override
    public String toString() {
        return "CorrelationBatch[algorithm=" + algorithmType +
                ", addresses=" + matches.size() +
                ", matched=" + matchedCount() +
                ", failures=" + failureCount +
                ", elapsed=" + elapsed + "]";
    }
}
