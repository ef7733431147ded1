package org.amp.correlation.benchmark;

import lombok.Builder;
import lombok.Value;
import org.amp.correlation.algorithm.AlgorithmType;

import java.time.Duration;

/**
 * Timing row for one algorithm in a benchmark report.
 */
@Value
@Builder(toBuilder = true)
public class BenchmarkSample {
    /**
     * 1-based position after ranking by {@link #getTotalTime()}; 0 before ranking.
     */
    int rank;
    AlgorithmType algorithm;
    Duration buildTime;
    Duration totalQueryTime;
    Duration avgTimePerQuery;
    int matchesFound;
    int addressesTested;
    /**
     * Addresses whose correlation failed and were left unmatched.
     */
    int failures;

    /**
     * Build plus query time, the ranking key.
     */
    public Duration getTotalTime() {
        return buildTime.plus(totalQueryTime);
    }

    @Override
    public String toString() {
        return "BenchmarkSample[rank=" + rank +
                ", algorithm=" + algorithm +
                ", buildTime=" + buildTime +
                ", totalQueryTime=" + totalQueryTime +
                ", avgTimePerQuery=" + avgTimePerQuery +
                ", addressesTested=" + addressesTested +
                ", matchesFound=" + matchesFound +
                ", failures=" + failures + "]";
    }
}
