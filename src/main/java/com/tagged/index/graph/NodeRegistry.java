package com.tagged.index.graph;

import com.tagged.index.core.model.Relation;
import com.tagged.index.core.model.TagGraphNode;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Deduplicating store mapping node values to stable handles in a {@link TagGraph}.
 *
 * <p>The value-to-handle mapping is a bijection: registering a value equal to one
 * already present returns the existing handle. Nothing is ever removed. Callers are
 * responsible for canonicalizing paths before lookup; the registry cannot tell that
 * two different paths name the same filesystem entity.</p>
 *
 * <p>Not thread-safe. A build has a single writer; after {@link #seal()} the
 * registry only answers lookups.</p>
 */
public class NodeRegistry {

    private final TagGraph graph;
    private final Map<TagGraphNode, Integer> handles = new HashMap<>();

    public NodeRegistry() {
        this.graph = new TagGraph();
    }

    /**
     * Gets the handle of a node, adding it to the graph if it didn't already exist.
     *
     * @throws IllegalStateException if the node is new and the registry is sealed
     */
    public int getOrCreate(TagGraphNode node) {
        Objects.requireNonNull(node, "node is required");
        Integer existing = handles.get(node);
        if (existing != null) {
            return existing;
        }
        int handle = graph.addNode(node);
        handles.put(node, handle);
        return handle;
    }

    /**
     * Looks up a node without creating it.
     */
    public OptionalInt find(TagGraphNode node) {
        Integer existing = handles.get(node);
        return existing != null ? OptionalInt.of(existing) : OptionalInt.empty();
    }

    /**
     * Resolves a handle back to its node value.
     */
    public TagGraphNode node(int handle) {
        return graph.node(handle);
    }

    public int file(Path canonicalPath) {
        return getOrCreate(TagGraphNode.file(canonicalPath));
    }

    public int directory(Path canonicalPath) {
        return getOrCreate(TagGraphNode.directory(canonicalPath));
    }

    public int tag(String name) {
        return getOrCreate(TagGraphNode.tag(name));
    }

    public int rootTag() {
        return getOrCreate(TagGraphNode.rootTag());
    }

    public int rootDirectory() {
        return getOrCreate(TagGraphNode.rootDirectory());
    }

    /**
     * Adds a {@code relation} edge from {@code a} to {@code b}. Both nodes are created
     * if they didn't exist. An identical edge is never added twice.
     *
     * @return true if a new edge was added
     */
    public boolean connect(TagGraphNode a, TagGraphNode b, Relation relation) {
        int ax = getOrCreate(a);
        int bx = getOrCreate(b);
        return graph.updateEdge(ax, bx, relation);
    }

    /**
     * Handle form of {@link #connect(TagGraphNode, TagGraphNode, Relation)}.
     */
    public boolean connect(int a, int b, Relation relation) {
        return graph.updateEdge(a, b, relation);
    }

    public int size() {
        return handles.size();
    }

    public TagGraph graph() {
        return graph;
    }

    /**
     * Freezes the registry and its graph. Lookups of registered values keep working.
     */
    public void seal() {
        graph.seal();
    }

    public boolean isSealed() {
        return graph.isSealed();
    }
}
