package com.tagged.index.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A node of the tag graph.
 *
 * <p>Identity is value equality: two {@code File} nodes with equal paths, or two
 * {@code Tag} nodes with equal names, are the same logical node. Path-bearing
 * variants expect an absolute, symlink-resolved path; the builders canonicalize
 * with {@link Path#toRealPath} before constructing them.</p>
 *
 * <p>The hierarchy is closed. Use {@link #kind()} to dispatch over it:</p>
 * <pre>
 * switch (node.kind()) {
 *     case FILE -> ((TagGraphNode.File) node).path();
 *     case DIRECTORY -> ((TagGraphNode.Directory) node).path();
 *     case ROOT_DIRECTORY, ROOT_TAG -> ...;
 *     case TAG -> ((TagGraphNode.Tag) node).name();
 * }
 * </pre>
 */
public sealed interface TagGraphNode
        permits TagGraphNode.File, TagGraphNode.Directory, TagGraphNode.RootDirectory,
        TagGraphNode.RootTag, TagGraphNode.Tag {

    NodeKind kind();

    static File file(Path path) {
        return new File(path);
    }

    static Directory directory(Path path) {
        return new Directory(path);
    }

    static Tag tag(String name) {
        return new Tag(name);
    }

    static RootDirectory rootDirectory() {
        return RootDirectory.INSTANCE;
    }

    static RootTag rootTag() {
        return RootTag.INSTANCE;
    }

    /**
     * A regular file (or any non-directory entry) at a canonical path.
     */
    record File(Path path) implements TagGraphNode {
        public File {
            Objects.requireNonNull(path, "path is required");
            if (!path.isAbsolute()) {
                throw new IllegalArgumentException("File node path must be absolute: " + path);
            }
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FILE;
        }
    }

    /**
     * A directory at a canonical path.
     */
    record Directory(Path path) implements TagGraphNode {
        public Directory {
            Objects.requireNonNull(path, "path is required");
            if (!path.isAbsolute()) {
                throw new IllegalArgumentException("Directory node path must be absolute: " + path);
            }
        }

        @Override
        public NodeKind kind() {
            return NodeKind.DIRECTORY;
        }
    }

    /**
     * Anchor of the walked filesystem tree; the walk root hangs below it.
     */
    enum RootDirectory implements TagGraphNode {
        INSTANCE;

        @Override
        public NodeKind kind() {
            return NodeKind.ROOT_DIRECTORY;
        }

        @Override
        public String toString() {
            return "RootDirectory";
        }
    }

    /**
     * Anchor owning every tag seen during a build.
     */
    enum RootTag implements TagGraphNode {
        INSTANCE;

        @Override
        public NodeKind kind() {
            return NodeKind.ROOT_TAG;
        }

        @Override
        public String toString() {
            return "RootTag";
        }
    }

    /**
     * A tag, identified by its exact string value. The empty string is a valid tag.
     */
    record Tag(String name) implements TagGraphNode {
        public Tag {
            Objects.requireNonNull(name, "name is required");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TAG;
        }
    }
}
