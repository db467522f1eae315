package com.tagged.index.metrics;

import java.time.Duration;

/**
 * Interface for recording tag graph build metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordBuildDuration(Duration duration);

    void incrementTagFilesScanned();

    void incrementUnmatchedTagFiles();

    void recordTagsParsed(int count);

    void incrementWalkErrors();

    void recordGraphSize(int nodeCount, int edgeCount);
}
