package com.tagged.index.core.model;

/**
 * Label carried by every edge of the tag graph.
 */
public enum Relation {
    /** File or directory A's parent is directory B. */
    PARENT,
    /** Directory A directly contains B. */
    CHILD,
    /** A (the root tag, a file or a directory) has tag B. */
    HAS_TAG,
    /** Tag A has been assigned to file or directory B. */
    TAG_ASSIGNED_TO;

    /**
     * Whether this relation describes filesystem structure rather than tag membership.
     */
    public boolean isStructural() {
        return this == PARENT || this == CHILD;
    }
}
