package com.metadata.disambiguation.metrics;

import java.time.Duration;

/**
 * Interface for recording disambiguation metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordPassDuration(String pass, Duration duration);

    void incrementMatchesRecorded(String pass, int count);

    void incrementAmbiguousMatch();

    void incrementIdentifierRejected(String reason);

    void incrementWorkSkipped();

    void recordLookupBatchSize(int size);
}
