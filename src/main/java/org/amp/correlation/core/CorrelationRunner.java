package org.amp.correlation.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.amp.core.geo.AddressRecord;
import org.amp.core.geo.ZoneSegment;
import org.amp.correlation.algorithm.AlgorithmFactory;
import org.amp.correlation.algorithm.AlgorithmType;
import org.amp.correlation.algorithm.CorrelationAlgorithm;
import org.amp.correlation.algorithm.ZoneMatch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Applies one correlation algorithm to every address of a batch.
 *
 * <p>Work is split into address ranges on a fork/join pool sized by
 * {@link CorrelationConfig#getParallelism()}; each task writes its results into
 * pre-assigned slots, so output order always matches input order. With parallelism 1 the
 * batch runs on the calling thread.</p>
 *
 * <p>The pool is created once per runner and shared by every batch it executes; call
 * {@link #close()} when the runner is no longer needed.</p>
 *
 * <p>A runtime failure for one address (for example a non-finite coordinate) leaves that
 * slot empty and increments the batch failure count; sibling addresses are unaffected.
 * Contract violations (bad cutoff, missing inputs) fail the whole call before any work
 * starts.</p>
 */
@Slf4j
public final class CorrelationRunner implements AutoCloseable {
    private static final int MIN_SPLIT_SIZE = 16;
    private static final int SPLITS_PER_WORKER = 8;

    @Getter
    @Accessors(fluent = true)
    private final CorrelationConfig config;
    private final ForkJoinPool pool;

    public CorrelationRunner() {
        this(CorrelationConfig.defaults());
    }

    public CorrelationRunner(CorrelationConfig config) {
        if (config == null) {
            throw new CorrelationException(CorrelationException.REASON_CONFIG_INVALID, "config must be provided");
        }
        this.config = config.validate();
        this.pool = this.config.getParallelism() > 1 ? new ForkJoinPool(this.config.getParallelism()) : null;
    }

    /**
     * Shuts down the worker pool. Batches already running finish; later parallel batches
     * are rejected. Idempotent.
     */
    @Override
    public void close() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    /**
     * Builds {@code type} over {@code zones} and correlates every address at the configured cutoff.
     */
    public CorrelationBatch run(List<AddressRecord> addresses, List<ZoneSegment> zones, AlgorithmType type) {
        CorrelationAlgorithm algorithm = AlgorithmFactory.create(type, zones, config);
        return run(addresses, zones, algorithm, config.getCutoffMeters(), null);
    }

    /**
     * Correlates every address with an already built algorithm.
     */
    public CorrelationBatch run(
            List<AddressRecord> addresses,
            List<ZoneSegment> zones,
            CorrelationAlgorithm algorithm,
            double cutoffMeters
    ) {
        return run(addresses, zones, algorithm, cutoffMeters, null);
    }

    /**
     * Correlates every address with an already built algorithm.
     *
     * @param addresses batch input; order defines output order.
     * @param zones zone list the algorithm was built from.
     * @param algorithm built algorithm, shared read-only by all workers.
     * @param cutoffMeters maximum match distance, finite and > 0.
     * @param progress optional observer counter, advanced once per address.
     * @return per-address results in input order plus failure diagnostics.
     */
    public CorrelationBatch run(
            List<AddressRecord> addresses,
            List<ZoneSegment> zones,
            CorrelationAlgorithm algorithm,
            double cutoffMeters,
            CorrelationProgress progress
    ) {
        CorrelationContracts.requireCutoff(cutoffMeters);
        requireAddresses(addresses);
        CorrelationContracts.requireZones(zones);
        if (algorithm == null) {
            throw new CorrelationException(CorrelationException.REASON_ALGORITHM_REQUIRED, "algorithm must be provided");
        }
        if (progress != null) {
            progress.expect(addresses.size());
        }
        return execute(addresses, zones, algorithm, cutoffMeters, progress);
    }

    /**
     * Correlates the same addresses against environmental restriction zones and paid
     * parking zones and merges both results per address.
     *
     * <p>Both datasets are indexed with {@code type}. The progress total spans both passes.</p>
     */
    public List<AddressCorrelation> correlateDatasets(
            List<AddressRecord> addresses,
            List<ZoneSegment> environmentalZones,
            List<ZoneSegment> parkingZones,
            AlgorithmType type,
            CorrelationProgress progress
    ) {
        requireAddresses(addresses);
        CorrelationContracts.requireZones(environmentalZones);
        CorrelationContracts.requireZones(parkingZones);
        if (progress != null) {
            progress.expect(2L * addresses.size());
        }

        double cutoff = config.getCutoffMeters();
        CorrelationAlgorithm environmental = AlgorithmFactory.create(type, environmentalZones, config);
        CorrelationBatch environmentalBatch = execute(addresses, environmentalZones, environmental, cutoff, progress);
        CorrelationAlgorithm parking = AlgorithmFactory.create(type, parkingZones, config);
        CorrelationBatch parkingBatch = execute(addresses, parkingZones, parking, cutoff, progress);

        List<AddressCorrelation> merged = new ArrayList<>(addresses.size());
        for (int i = 0; i < addresses.size(); i++) {
            merged.add(new AddressCorrelation(
                    i,
                    addresses.get(i),
                    environmentalBatch.match(i),
                    parkingBatch.match(i)
            ));
        }
        return Collections.unmodifiableList(merged);
    }

    private CorrelationBatch execute(
            List<AddressRecord> addresses,
            List<ZoneSegment> zones,
            CorrelationAlgorithm algorithm,
            double cutoffMeters,
            CorrelationProgress progress
    ) {
        int n = addresses.size();
        ZoneMatch[] slots = new ZoneMatch[n];
        AtomicInteger failures = new AtomicInteger();
        BatchContext context = new BatchContext(addresses, zones, algorithm, cutoffMeters, slots, failures, progress);

        long startNanos = System.nanoTime();
        if (pool == null || n <= MIN_SPLIT_SIZE) {
            context.correlateRange(0, n);
        } else {
            if (pool.isShutdown()) {
                throw new IllegalStateException("runner is closed");
            }
            int splitSize = Math.max(MIN_SPLIT_SIZE, n / (pool.getParallelism() * SPLITS_PER_WORKER));
            pool.invoke(new CorrelateRange(context, 0, n, splitSize));
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        List<Optional<ZoneMatch>> matches = new ArrayList<>(n);
        for (ZoneMatch slot : slots) {
            matches.add(Optional.ofNullable(slot));
        }
        CorrelationBatch batch = new CorrelationBatch(
                algorithm.type(),
                cutoffMeters,
                Collections.unmodifiableList(matches),
                failures.get(),
                elapsed
        );
        log.info("correlated {} addresses with {} in {} ms: matched={}, failures={}",
                n, algorithm.type().displayName(), elapsed.toMillis(), batch.matchedCount(), batch.failureCount());
        return batch;
    }

    private static void requireAddresses(List<AddressRecord> addresses) {
        if (addresses == null) {
            throw new CorrelationException(CorrelationException.REASON_ADDRESSES_REQUIRED, "addresses must be provided");
        }
    }

    /**
     * Immutable inputs plus the output slots shared by all range tasks of one batch.
     */
    private static final class BatchContext {
        private final List<AddressRecord> addresses;
        private final List<ZoneSegment> zones;
        private final CorrelationAlgorithm algorithm;
        private final double cutoffMeters;
        private final ZoneMatch[] slots;
        private final AtomicInteger failures;
        private final CorrelationProgress progress;

        private BatchContext(
                List<AddressRecord> addresses,
                List<ZoneSegment> zones,
                CorrelationAlgorithm algorithm,
                double cutoffMeters,
                ZoneMatch[] slots,
                AtomicInteger failures,
                CorrelationProgress progress
        ) {
            this.addresses = Objects.requireNonNull(addresses, "addresses");
            this.zones = zones;
            this.algorithm = algorithm;
            this.cutoffMeters = cutoffMeters;
            this.slots = slots;
            this.failures = failures;
            this.progress = progress;
        }

        private void correlateRange(int from, int to) {
            for (int i = from; i < to; i++) {
                slots[i] = correlateOne(i);
                if (progress != null) {
                    progress.advance();
                }
            }
        }

        private ZoneMatch correlateOne(int index) {
            try {
                AddressRecord address = addresses.get(index);
                if (address == null) {
                    throw new IllegalArgumentException("address is null");
                }
                return algorithm.correlate(address.getPoint(), zones, cutoffMeters).orElse(null);
            } catch (CorrelationException e) {
                throw e;
            } catch (RuntimeException e) {
                int failureCount = failures.incrementAndGet();
                if (failureCount == 1) {
                    log.warn("address {} could not be correlated; result left empty", index, e);
                } else {
                    log.debug("address {} could not be correlated: {}", index, e.getMessage());
                }
                return null;
            }
        }
    }

    /**
     * Range-splitting fork/join task over address indices.
     */
    private static final class CorrelateRange extends RecursiveAction {
        private final BatchContext context;
        private final int from;
        private final int to;
        private final int splitSize;

        private CorrelateRange(BatchContext context, int from, int to, int splitSize) {
            this.context = context;
            this.from = from;
            this.to = to;
            this.splitSize = splitSize;
        }

        @Override
        protected void compute() {
            if (to - from <= splitSize) {
                context.correlateRange(from, to);
                return;
            }
            int middle = (from + to) >>> 1;
            invokeAll(
                    new CorrelateRange(context, from, middle, splitSize),
                    new CorrelateRange(context, middle, to, splitSize)
            );
        }
    }
}
