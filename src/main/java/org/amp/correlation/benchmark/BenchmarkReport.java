package org.amp.correlation.benchmark;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.util.List;
import java.util.Optional;

/**
 * Ranked benchmark table, fastest first.
 *
 * <p>When the requested sample exceeded the available addresses, {@link #sampleAdjustment()}
 * describes the clamp that was applied.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class BenchmarkReport {
    private final List<BenchmarkSample> samples;
    private final double cutoffMeters;
    private final int requestedSampleSize;
    private final int effectiveSampleSize;
    private final int availableAddresses;
    private final int zoneCount;

    public boolean sampleClamped() {
        return requestedSampleSize > availableAddresses;
    }

    /**
     * Human-readable note about a sample-size clamp, empty when none was needed.
     */
    public Optional<String> sampleAdjustment() {
        if (!sampleClamped()) {
            return Optional.empty();
        }
        return Optional.of("requested " + requestedSampleSize + " addresses but only "
                + availableAddresses + " available; benchmarked " + effectiveSampleSize);
    }

    /**
     * Row ranked first, empty when no algorithm was benchmarked.
     */
    public Optional<BenchmarkSample> fastest() {
        return samples.isEmpty() ? Optional.empty() : Optional.of(samples.get(0));
    }

    @Override
    public String toString() {
        return "BenchmarkReport[addresses=" + effectiveSampleSize +
                ", zones=" + zoneCount +
                ", cutoffMeters=" + cutoffMeters +
                ", sampleClamped=" + sampleClamped() +
                ", samples=" + samples + "]";
    }
}
