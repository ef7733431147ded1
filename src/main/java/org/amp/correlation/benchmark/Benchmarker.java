package org.amp.correlation.benchmark;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.amp.core.geo.AddressRecord;
import org.amp.core.geo.ZoneSegment;
import org.amp.correlation.algorithm.AlgorithmFactory;
import org.amp.correlation.algorithm.AlgorithmType;
import org.amp.correlation.algorithm.CorrelationAlgorithm;
import org.amp.correlation.core.CorrelationBatch;
import org.amp.correlation.core.CorrelationConfig;
import org.amp.correlation.core.CorrelationContracts;
import org.amp.correlation.core.CorrelationException;
import org.amp.correlation.core.CorrelationRunner;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Times build and query phases of several algorithms over the same address sample.
 *
 * <p>The sample is the first {@code sampleSize} addresses. A sample size above the number
 * of available addresses is clamped and reported in the result; {@code 0} means all
 * addresses. Inputs are copied once and never mutated between algorithm runs.</p>
 */
@Slf4j
public final class Benchmarker implements AutoCloseable {
    private static final Comparator<BenchmarkSample> BY_TOTAL_TIME = Comparator
            .comparing(BenchmarkSample::getTotalTime)
            .thenComparingInt(sample -> sample.getAlgorithm().ordinal());

    @Getter
    @Accessors(fluent = true)
    private final CorrelationConfig config;
    private final CorrelationRunner runner;

    public Benchmarker() {
        this(CorrelationConfig.defaults());
    }

    public Benchmarker(CorrelationConfig config) {
        this.runner = new CorrelationRunner(config);
        this.config = runner.config();
    }

    /**
     * Releases the worker pool of the underlying runner.
     */
    @Override
    public void close() {
        runner.close();
    }

    /**
     * Benchmarks all six algorithms with the configured sample size.
     */
    public BenchmarkReport run(List<AddressRecord> addresses, List<ZoneSegment> zones) {
        return run(addresses, zones, Arrays.asList(AlgorithmType.values()), config.getSampleSize());
    }

    /**
     * Benchmarks {@code algorithms} in the given order and ranks them by total time.
     *
     * @param addresses available addresses.
     * @param zones zone set every algorithm is built from.
     * @param algorithms algorithms to compare.
     * @param sampleSize requested sample, {@code 0} for all addresses.
     * @return ranked report, fastest first.
     */
    public BenchmarkReport run(
            List<AddressRecord> addresses,
            List<ZoneSegment> zones,
            List<AlgorithmType> algorithms,
            int sampleSize
    ) {
        if (addresses == null) {
            throw new CorrelationException(CorrelationException.REASON_ADDRESSES_REQUIRED, "addresses must be provided");
        }
        CorrelationContracts.requireZones(zones);
        if (algorithms == null) {
            throw new CorrelationException(CorrelationException.REASON_ALGORITHM_REQUIRED, "algorithms must be provided");
        }
        if (sampleSize < 0) {
            throw new CorrelationException(
                    CorrelationException.REASON_SAMPLE_SIZE_INVALID,
                    "sampleSize must be >= 0, got " + sampleSize
            );
        }

        int available = addresses.size();
        int requested = sampleSize == 0 ? available : sampleSize;
        int effective = Math.min(requested, available);
        if (requested > available) {
            log.warn("requested sample of {} addresses exceeds the {} available; clamping to {}",
                    requested, available, effective);
        }

        List<AddressRecord> sample = Collections.unmodifiableList(new ArrayList<>(addresses.subList(0, effective)));
        List<ZoneSegment> zoneSnapshot = Collections.unmodifiableList(new ArrayList<>(zones));
        double cutoff = config.getCutoffMeters();

        List<BenchmarkSample> samples = new ArrayList<>(algorithms.size());
        for (AlgorithmType type : algorithms) {
            samples.add(measure(type, sample, zoneSnapshot, cutoff));
        }
        samples.sort(BY_TOTAL_TIME);

        List<BenchmarkSample> ranked = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            ranked.add(samples.get(i).toBuilder().rank(i + 1).build());
        }

        BenchmarkReport report = new BenchmarkReport(
                Collections.unmodifiableList(ranked),
                cutoff,
                requested,
                effective,
                available,
                zoneSnapshot.size()
        );
        report.fastest().ifPresent(fastest -> log.info("benchmark finished over {} addresses; fastest: {} ({} ms total)",
                effective, fastest.getAlgorithm().displayName(), fastest.getTotalTime().toMillis()));
        return report;
    }

    private BenchmarkSample measure(
            AlgorithmType type,
            List<AddressRecord> sample,
            List<ZoneSegment> zones,
            double cutoff
    ) {
        long buildStart = System.nanoTime();
        CorrelationAlgorithm algorithm = AlgorithmFactory.create(type, zones, config);
        Duration buildTime = Duration.ofNanos(System.nanoTime() - buildStart);

        long queryStart = System.nanoTime();
        CorrelationBatch batch = runner.run(sample, zones, algorithm, cutoff);
        Duration queryTime = Duration.ofNanos(System.nanoTime() - queryStart);

        Duration perQuery = sample.isEmpty() ? Duration.ZERO : queryTime.dividedBy(sample.size());
        log.debug("benchmarked {}: build={} ms, query={} ms, matches={}",
                type.displayName(), buildTime.toMillis(), queryTime.toMillis(), batch.matchedCount());
        return BenchmarkSample.builder()
                .algorithm(type)
                .buildTime(buildTime)
                .totalQueryTime(queryTime)
                .avgTimePerQuery(perQuery)
                .matchesFound(batch.matchedCount())
                .addressesTested(sample.size())
                .failures(batch.failureCount())
                .build();
    }
}
