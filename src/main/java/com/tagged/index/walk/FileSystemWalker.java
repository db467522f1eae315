package com.tagged.index.walk;

import com.tagged.index.core.Directories;
import com.tagged.index.core.model.Relation;
import com.tagged.index.graph.NodeRegistry;
import com.tagged.index.metrics.MetricsService;
import com.tagged.index.scan.TagFileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Second build pass: records the directory structure below a root.
 *
 * <p>Every entry except tag files becomes a {@code File} or {@code Directory} node
 * linked to its containing directory by a {@link Relation#CHILD} edge (directory to
 * entry) and a {@link Relation#PARENT} edge (entry to directory). The root itself is
 * linked the same way to the root directory anchor.</p>
 *
 * <p>The walk is lenient: an entry that cannot be canonicalized, or a directory that
 * cannot be listed, is logged and skipped and the walk goes on with the rest of the tree.
 * Symlinks are recorded under their resolved path but symlinked directories are not entered.
 * An entry is a tag file, and skipped, when either its own name or its resolved name says so.</p>
 */
public class FileSystemWalker {
    private static final Logger log = LoggerFactory.getLogger(FileSystemWalker.class);

    private final NodeRegistry registry;
    private final TagFileNames names;
    private final MetricsService metricsService;

    public FileSystemWalker(NodeRegistry registry, TagFileNames names, MetricsService metricsService) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.names = Objects.requireNonNull(names, "names is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    public WalkResult walk(Path root) {
        int rootDirectory = registry.rootDirectory();
        int visited = 0;
        int skipped = 0;

        Deque<PendingEntry> pending = new ArrayDeque<>();
        pending.push(new PendingEntry(root, rootDirectory, 0));
        while (!pending.isEmpty()) {
            PendingEntry entry = pending.pop();
            if (names.isTagFile(entry.path())) {
                continue;
            }

            Path canonical;
            try {
                canonical = entry.path().toRealPath();
            } catch (IOException e) {
                skipped++;
                metricsService.incrementWalkErrors();
                log.error("walk.entry.failed path={} error={}", entry.path(), e.toString());
                continue;
            }
            if (names.isTagFile(canonical)) {
                log.trace("walk.entry.tagfile path={} resolved={}", entry.path(), canonical);
                continue;
            }

            boolean directory = Files.isDirectory(canonical);
            int node = directory ? registry.directory(canonical) : registry.file(canonical);
            registry.connect(entry.parent(), node, Relation.CHILD);
            registry.connect(node, entry.parent(), Relation.PARENT);
            visited++;

            if (!directory || !shouldDescend(entry)) {
                continue;
            }
            List<Path> children;
            try {
                children = Directories.listSorted(entry.path());
            } catch (IOException e) {
                skipped++;
                metricsService.incrementWalkErrors();
                log.error("walk.listing.failed path={} error={}", entry.path(), e.toString());
                continue;
            }
            // pushed in reverse so that siblings are popped in name order
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(new PendingEntry(children.get(i), node, entry.depth() + 1));
            }
        }

        log.debug("walk.completed root={} visited={} skipped={}", root, visited, skipped);
        return new WalkResult(visited, skipped);
    }

    /**
     * The root is always entered, even through a symlink; below it only real directories are.
     */
    private boolean shouldDescend(PendingEntry entry) {
        return entry.depth() == 0 || Files.isDirectory(entry.path(), LinkOption.NOFOLLOW_LINKS);
    }

    /**
     * An entry waiting to be visited, with the handle of the directory it was listed from.
     * At depth zero the parent is the root directory anchor.
     */
    private record PendingEntry(Path path, int parent, int depth) {
    }
}
