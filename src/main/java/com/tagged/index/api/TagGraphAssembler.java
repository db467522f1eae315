package com.tagged.index.api;

import com.tagged.index.core.TagGraphException;
import com.tagged.index.graph.NodeRegistry;
import com.tagged.index.logging.LogContext;
import com.tagged.index.metrics.MetricsService;
import com.tagged.index.metrics.NoOpMetricsService;
import com.tagged.index.scan.ScanResult;
import com.tagged.index.scan.TagFileNames;
import com.tagged.index.scan.TagFileReader;
import com.tagged.index.scan.TagFileScanner;
import com.tagged.index.walk.FileSystemWalker;
import com.tagged.index.walk.WalkResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Main entry point: builds the tag graph for a directory tree.
 *
 * <h2>Build passes</h2>
 * <ol>
 *   <li>the tag-file scan records every tag and its attachment targets;</li>
 *   <li>the filesystem walk records the directory structure.</li>
 * </ol>
 * <p>Both passes write into one {@link NodeRegistry}, so a path seen by both resolves
 * to a single node. The registry is sealed before the result is returned.</p>
 *
 * <p>A scan failure aborts the build with an {@link IOException} and no graph. Walk
 * failures are logged per entry and never abort the build.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * BuildResult result = TagGraphAssembler.builder()
 *     .metricsService(new MicrometerMetricsService(meterRegistry))
 *     .build()
 *     .build(Path.of("/srv/photos"));
 *
 * OptionalInt favorite = result.registry().find(TagGraphNode.tag("favorite"));
 * </pre>
 */
public class TagGraphAssembler {
    private static final Logger log = LoggerFactory.getLogger(TagGraphAssembler.class);

    private final BuildOptions options;
    private final MetricsService metricsService;

    private TagGraphAssembler(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
    }

    /**
     * Builds the graph for {@code root} with default options.
     */
    public static BuildResult buildGraph(String root) throws IOException {
        return builder().build().build(root);
    }

    /**
     * Builds the graph for a root given as a path string.
     *
     * @throws TagGraphException if the string is blank or not a valid path
     * @throws IOException       if a tag file or its directory cannot be read or canonicalized
     */
    public BuildResult build(String root) throws IOException {
        if (root == null || root.isBlank()) {
            throw new TagGraphException("Root path must not be null or blank");
        }
        Path path;
        try {
            path = Path.of(root);
        } catch (InvalidPathException e) {
            throw new TagGraphException("Invalid root path '" + root + "'", e);
        }
        return build(path);
    }

    /**
     * Builds the graph for {@code root}.
     *
     * @throws IOException if a tag file or its directory cannot be read or canonicalized
     */
    public BuildResult build(Path root) throws IOException {
        Objects.requireNonNull(root, "root is required");
        long startNanos = System.nanoTime();

        try (LogContext ctx = LogContext.forBuild(LogContext.generateBuildId(), root.toString())) {
            log.info("build.started root={} options={}", root, options);
            NodeRegistry registry = new NodeRegistry();
            TagFileNames names = options.tagFileNames();

            ctx.with("phase", "scan");
            ScanResult scan;
            try {
                scan = new TagFileScanner(registry, names, new TagFileReader(options.getCharset()), metricsService)
                        .scan(root);
            } catch (IOException e) {
                log.error("build.failed root={} error={}", root, e.toString());
                throw e;
            }

            ctx.with("phase", "walk");
            WalkResult walk = new FileSystemWalker(registry, names, metricsService).walk(root);

            registry.seal();
            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            int nodeCount = registry.graph().nodeCount();
            int edgeCount = registry.graph().edgeCount();
            metricsService.recordBuildDuration(duration);
            metricsService.recordGraphSize(nodeCount, edgeCount);

            BuildStats stats = new BuildStats(scan.tagFilesScanned(), scan.unmatchedTagFiles(), scan.tagsParsed(),
                    walk.entriesVisited(), walk.entriesSkipped(), nodeCount, edgeCount, duration);
            log.info("build.completed root={} stats={}", root, stats);
            return new BuildResult(registry.graph(), registry, stats);
        }
    }

    public BuildOptions getOptions() {
        return options;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private BuildOptions options = BuildOptions.defaults();
        private MetricsService metricsService;

        public Builder options(BuildOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public TagGraphAssembler build() {
            return new TagGraphAssembler(this);
        }
    }
}
