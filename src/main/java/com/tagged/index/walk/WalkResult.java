package com.tagged.index.walk;

/**
 * Outcome of a filesystem walk.
 *
 * @param entriesVisited entries recorded in the graph, the root included
 * @param entriesSkipped entries (or directory listings) dropped because of an error
 */
public record WalkResult(int entriesVisited, int entriesSkipped) {
}
