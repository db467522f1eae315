package com.tagged.index.graph;

import com.tagged.index.core.TagGraphException;
import com.tagged.index.core.model.Edge;
import com.tagged.index.core.model.NodeKind;
import com.tagged.index.core.model.Relation;
import com.tagged.index.core.model.TagGraphNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Directed multi-relation graph backing a tag index.
 *
 * <p>Nodes are stored densely: a node's handle is its insertion index and never
 * changes. Edges are identified by (source, target, relation), so one ordered pair
 * of nodes can carry several edges as long as their relations differ, while adding
 * the same triple twice leaves a single edge.</p>
 *
 * <p>Mutation goes through {@link NodeRegistry}, which owns value deduplication.
 * Once sealed the graph rejects further mutation and may be read from any thread.</p>
 */
public class TagGraph {

    private final List<TagGraphNode> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Set<Edge> edgeIndex = new HashSet<>();
    private final List<List<Edge>> outgoing = new ArrayList<>();
    private final List<List<Edge>> incoming = new ArrayList<>();
    private boolean sealed;

    TagGraph() {
    }

    int addNode(TagGraphNode node) {
        Objects.requireNonNull(node, "node is required");
        checkNotSealed();
        nodes.add(node);
        outgoing.add(new ArrayList<>());
        incoming.add(new ArrayList<>());
        return nodes.size() - 1;
    }

    /**
     * Adds the edge unless an edge with the same endpoints and relation already exists.
     *
     * @return true if a new edge was added
     */
    boolean updateEdge(int source, int target, Relation relation) {
        checkHandle(source);
        checkHandle(target);
        checkNotSealed();
        Edge edge = new Edge(source, target, relation);
        if (!edgeIndex.add(edge)) {
            return false;
        }
        edges.add(edge);
        outgoing.get(source).add(edge);
        incoming.get(target).add(edge);
        return true;
    }

    void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Returns the node value stored under a handle.
     *
     * @throws TagGraphException if the handle is unknown
     */
    public TagGraphNode node(int handle) {
        checkHandle(handle);
        return nodes.get(handle);
    }

    public NodeKind kind(int handle) {
        return node(handle).kind();
    }

    /**
     * All nodes, indexed by handle.
     */
    public List<TagGraphNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * All edges in insertion order.
     */
    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public List<Edge> outgoing(int handle) {
        checkHandle(handle);
        return Collections.unmodifiableList(outgoing.get(handle));
    }

    public List<Edge> incoming(int handle) {
        checkHandle(handle);
        return Collections.unmodifiableList(incoming.get(handle));
    }

    public boolean containsEdge(int source, int target, Relation relation) {
        if (!isValidHandle(source) || !isValidHandle(target) || relation == null) {
            return false;
        }
        return edgeIndex.contains(new Edge(source, target, relation));
    }

    /**
     * Every edge leaving {@code source} and entering {@code target}, whatever its relation.
     */
    public List<Edge> edgesBetween(int source, int target) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : outgoing(source)) {
            if (edge.target() == target) {
                result.add(edge);
            }
        }
        return result;
    }

    /**
     * Returns a view that only follows edges whose relation passes the filter.
     */
    public RelationFilteredView filtered(Predicate<Relation> filter) {
        return new RelationFilteredView(this, filter);
    }

    public boolean isValidHandle(int handle) {
        return handle >= 0 && handle < nodes.size();
    }

    private void checkHandle(int handle) {
        if (!isValidHandle(handle)) {
            throw new TagGraphException("Unknown node handle " + handle + " (graph has " + nodes.size() + " nodes)");
        }
    }

    private void checkNotSealed() {
        if (sealed) {
            throw new IllegalStateException("Tag graph is sealed and can no longer be modified");
        }
    }

    @Override
    public String toString() {
        return "TagGraph{" +
                "nodes=" + nodes.size() +
                ", edges=" + edges.size() +
                ", sealed=" + sealed +
                '}';
    }
}
