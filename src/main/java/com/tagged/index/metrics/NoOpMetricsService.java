package com.tagged.index.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, ensuring the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordBuildDuration(Duration duration) {
    }

    @Override
    public void incrementTagFilesScanned() {
    }

    @Override
    public void incrementUnmatchedTagFiles() {
    }

    @Override
    public void recordTagsParsed(int count) {
    }

    @Override
    public void incrementWalkErrors() {
    }

    @Override
    public void recordGraphSize(int nodeCount, int edgeCount) {
    }
}
