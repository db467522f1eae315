package com.tagged.index.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code tag.graph.build.duration}: Timer</li>
 *   <li>{@code tag.graph.tagfiles.scanned}: Counter</li>
 *   <li>{@code tag.graph.tagfiles.unmatched}: Counter</li>
 *   <li>{@code tag.graph.tags.parsed}: Counter</li>
 *   <li>{@code tag.graph.walk.errors}: Counter</li>
 *   <li>{@code tag.graph.nodes}: DistributionSummary</li>
 *   <li>{@code tag.graph.edges}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer buildTimer;
    private final Counter tagFilesScannedCounter;
    private final Counter unmatchedTagFilesCounter;
    private final Counter tagsParsedCounter;
    private final Counter walkErrorCounter;
    private final DistributionSummary nodeCountSummary;
    private final DistributionSummary edgeCountSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.buildTimer = Timer.builder("tag.graph.build.duration")
                .description("Duration of complete tag graph builds")
                .register(registry);
        this.tagFilesScannedCounter = Counter.builder("tag.graph.tagfiles.scanned")
                .description("Number of tag files read")
                .register(registry);
        this.unmatchedTagFilesCounter = Counter.builder("tag.graph.tagfiles.unmatched")
                .description("Number of tag files without any attachment target")
                .register(registry);
        this.tagsParsedCounter = Counter.builder("tag.graph.tags.parsed")
                .description("Number of tag lines parsed from tag files")
                .register(registry);
        this.walkErrorCounter = Counter.builder("tag.graph.walk.errors")
                .description("Number of filesystem entries skipped because of errors")
                .register(registry);
        this.nodeCountSummary = DistributionSummary.builder("tag.graph.nodes")
                .description("Node count of completed graphs")
                .register(registry);
        this.edgeCountSummary = DistributionSummary.builder("tag.graph.edges")
                .description("Edge count of completed graphs")
                .register(registry);
    }

    @Override
    public void recordBuildDuration(Duration duration) {
        buildTimer.record(duration);
    }

    @Override
    public void incrementTagFilesScanned() {
        tagFilesScannedCounter.increment();
    }

    @Override
    public void incrementUnmatchedTagFiles() {
        unmatchedTagFilesCounter.increment();
    }

    @Override
    public void recordTagsParsed(int count) {
        tagsParsedCounter.increment(count);
    }

    @Override
    public void incrementWalkErrors() {
        walkErrorCounter.increment();
    }

    @Override
    public void recordGraphSize(int nodeCount, int edgeCount) {
        nodeCountSummary.record(nodeCount);
        edgeCountSummary.record(edgeCount);
    }
}
