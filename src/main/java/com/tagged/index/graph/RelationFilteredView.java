package com.tagged.index.graph;

import com.tagged.index.core.model.Edge;
import com.tagged.index.core.model.Relation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Read-only view of a {@link TagGraph} restricted to edges whose relation passes a filter.
 *
 * <p>Typical use is collecting every tag that applies to a path by following
 * {@link Relation#HAS_TAG} and {@link Relation#PARENT} edges while ignoring
 * {@link Relation#CHILD} and {@link Relation#TAG_ASSIGNED_TO}:</p>
 * <pre>
 * RelationFilteredView view = graph.filtered(RelationFilteredView.only(Relation.HAS_TAG, Relation.PARENT));
 * Set&lt;Integer&gt; reachable = view.reachableFrom(fileHandle);
 * </pre>
 */
public class RelationFilteredView {

    private final TagGraph graph;
    private final Predicate<Relation> filter;

    RelationFilteredView(TagGraph graph, Predicate<Relation> filter) {
        this.graph = Objects.requireNonNull(graph, "graph is required");
        this.filter = Objects.requireNonNull(filter, "filter is required");
    }

    /**
     * Predicate accepting exactly the given relations.
     */
    public static Predicate<Relation> only(Relation first, Relation... rest) {
        Set<Relation> accepted = EnumSet.of(first, rest);
        return accepted::contains;
    }

    public TagGraph graph() {
        return graph;
    }

    public List<Edge> edges() {
        return filter(graph.edges());
    }

    public List<Edge> outgoing(int handle) {
        return filter(graph.outgoing(handle));
    }

    public List<Edge> incoming(int handle) {
        return filter(graph.incoming(handle));
    }

    /**
     * Targets of the accepted edges leaving {@code handle}, without duplicates, in edge order.
     */
    public List<Integer> successors(int handle) {
        Set<Integer> result = new LinkedHashSet<>();
        for (Edge edge : outgoing(handle)) {
            result.add(edge.target());
        }
        return new ArrayList<>(result);
    }

    /**
     * Breadth-first closure over accepted edges. The start node is part of the result.
     */
    public Set<Integer> reachableFrom(int start) {
        Set<Integer> visited = new LinkedHashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (Edge edge : outgoing(current)) {
                if (visited.add(edge.target())) {
                    queue.add(edge.target());
                }
            }
        }
        return visited;
    }

    private List<Edge> filter(List<Edge> source) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : source) {
            if (filter.test(edge.relation())) {
                result.add(edge);
            }
        }
        return result;
    }
}
