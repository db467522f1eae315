package com.tagged.index.core.model;

import java.util.Objects;

/**
 * A directed, relation-labelled edge between two node handles.
 * Two edges are the same edge only when source, target and relation all match,
 * so several relations may connect the same ordered pair of nodes.
 *
 * @param source   handle of the node the edge leaves
 * @param target   handle of the node the edge enters
 * @param relation the edge label
 */
public record Edge(int source, int target, Relation relation) {

    public Edge {
        if (source < 0) {
            throw new IllegalArgumentException("source handle must be >= 0, got " + source);
        }
        if (target < 0) {
            throw new IllegalArgumentException("target handle must be >= 0, got " + target);
        }
        Objects.requireNonNull(relation, "relation is required");
    }
}
