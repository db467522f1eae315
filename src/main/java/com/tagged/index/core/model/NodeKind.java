package com.tagged.index.core.model;

/**
 * Discriminator of the {@link TagGraphNode} variants.
 * Consumers switch over this enum to handle every variant exhaustively.
 */
public enum NodeKind {
    FILE("File"),
    DIRECTORY("Directory"),
    ROOT_DIRECTORY("RootDirectory"),
    ROOT_TAG("RootTag"),
    TAG("Tag");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Whether nodes of this kind carry a filesystem path.
     */
    public boolean isPathBearing() {
        return this == FILE || this == DIRECTORY;
    }
}
