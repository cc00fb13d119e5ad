package com.metadata.disambiguation.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code disambiguation.pass.duration} - Timer (tag: pass)</li>
 *   <li>{@code disambiguation.matches} - Counter (tag: pass)</li>
 *   <li>{@code disambiguation.ambiguous} - Counter</li>
 *   <li>{@code disambiguation.identifier.rejected} - Counter (tag: reason)</li>
 *   <li>{@code disambiguation.work.skipped} - Counter</li>
 *   <li>{@code disambiguation.lookup.batch.size} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter ambiguousCounter;
    private final Counter workSkippedCounter;
    private final DistributionSummary batchSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.ambiguousCounter = Counter.builder("disambiguation.ambiguous")
                .description("Number of nodes with more than one match for a single-valued relation")
                .register(registry);
        this.workSkippedCounter = Counter.builder("disambiguation.work.skipped")
                .description("Number of works skipped because of too many agent relations")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("disambiguation.lookup.batch.size")
                .description("Number of nodes per batched lookup query")
                .register(registry);
    }

    @Override
    public void recordPassDuration(String pass, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(pass, k ->
                Timer.builder("disambiguation.pass.duration")
                        .description("Duration of a matching pass")
                        .tag("pass", pass)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementMatchesRecorded(String pass, int count) {
        if (count <= 0) {
            return;
        }
        Counter counter = counterCache.computeIfAbsent("matches:" + pass, k ->
                Counter.builder("disambiguation.matches")
                        .description("Number of node to candidate matches recorded")
                        .tag("pass", pass)
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void incrementAmbiguousMatch() {
        ambiguousCounter.increment();
    }

    @Override
    public void incrementIdentifierRejected(String reason) {
        Counter counter = counterCache.computeIfAbsent("rejected:" + reason, k ->
                Counter.builder("disambiguation.identifier.rejected")
                        .description("Number of identifier nodes removed from their graph")
                        .tag("reason", reason)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementWorkSkipped() {
        workSkippedCounter.increment();
    }

    @Override
    public void recordLookupBatchSize(int size) {
        batchSizeSummary.record(size);
    }
}
