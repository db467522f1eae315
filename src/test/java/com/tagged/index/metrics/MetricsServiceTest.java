package com.tagged.index.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordBuildDuration(Duration.ofMillis(100));
                noOp.incrementTagFilesScanned();
                noOp.incrementUnmatchedTagFiles();
                noOp.recordTagsParsed(7);
                noOp.incrementWalkErrors();
                noOp.recordGraphSize(10, 20);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record build duration as timer")
        void recordBuildDuration() {
            metrics.recordBuildDuration(Duration.ofMillis(150));
            metrics.recordBuildDuration(Duration.ofMillis(250));

            Timer timer = registry.find("tag.graph.build.duration").timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertEquals(400.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
        }

        @Test
        @DisplayName("Should count scanned and unmatched tag files separately")
        void countTagFiles() {
            metrics.incrementTagFilesScanned();
            metrics.incrementTagFilesScanned();
            metrics.incrementUnmatchedTagFiles();

            Counter scanned = registry.find("tag.graph.tagfiles.scanned").counter();
            Counter unmatched = registry.find("tag.graph.tagfiles.unmatched").counter();

            assertNotNull(scanned);
            assertEquals(2.0, scanned.count());
            assertNotNull(unmatched);
            assertEquals(1.0, unmatched.count());
        }

        @Test
        @DisplayName("Should add parsed tags to the counter")
        void recordTagsParsed() {
            metrics.recordTagsParsed(3);
            metrics.recordTagsParsed(0);
            metrics.recordTagsParsed(5);

            assertEquals(8.0, registry.find("tag.graph.tags.parsed").counter().count());
        }

        @Test
        @DisplayName("Should count walk errors")
        void incrementWalkErrors() {
            metrics.incrementWalkErrors();

            assertEquals(1.0, registry.find("tag.graph.walk.errors").counter().count());
        }

        @Test
        @DisplayName("Should record graph size as distribution summaries")
        void recordGraphSize() {
            metrics.recordGraphSize(12, 24);
            metrics.recordGraphSize(8, 10);

            DistributionSummary nodes = registry.find("tag.graph.nodes").summary();
            DistributionSummary edges = registry.find("tag.graph.edges").summary();

            assertNotNull(nodes);
            assertEquals(2, nodes.count());
            assertEquals(20.0, nodes.totalAmount());
            assertNotNull(edges);
            assertEquals(24.0, edges.max());
        }
    }
}
