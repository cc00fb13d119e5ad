package com.metadata.disambiguation.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordPassDuration(String pass, Duration duration) {
    }

    @Override
    public void incrementMatchesRecorded(String pass, int count) {
    }

    @Override
    public void incrementAmbiguousMatch() {
    }

    @Override
    public void incrementIdentifierRejected(String reason) {
    }

    @Override
    public void incrementWorkSkipped() {
    }

    @Override
    public void recordLookupBatchSize(int size) {
    }
}
