package com.tagged.index.api;

import com.tagged.index.graph.NodeRegistry;
import com.tagged.index.graph.TagGraph;

import java.util.Objects;

/**
 * A finished, sealed tag graph together with the registry that maps node values to
 * handles and back.
 *
 * @param graph    the graph; read-only
 * @param registry the sealed registry used to build it
 * @param stats    counters collected during the build
 */
public record BuildResult(TagGraph graph, NodeRegistry registry, BuildStats stats) {

    public BuildResult {
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(registry, "registry is required");
        Objects.requireNonNull(stats, "stats is required");
        if (registry.graph() != graph) {
            throw new IllegalArgumentException("registry does not belong to graph");
        }
    }
}
