package com.tagged.index.scan;

import com.tagged.index.core.Directories;
import com.tagged.index.core.model.Relation;
import com.tagged.index.graph.NodeRegistry;
import com.tagged.index.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * First build pass: finds every tag file under a root and records tag membership.
 *
 * <p>For each tag file the attachment targets are resolved first:</p>
 * <ul>
 *   <li>the directory tag file ({@code dir.tags}) targets its containing directory;</li>
 *   <li>any other {@code <stem>.tags} targets every sibling, file or directory, whose
 *       name or own stem equals {@code <stem>}. Other tag files, and links resolving to
 *       one, are never targets.</li>
 * </ul>
 * <p>Then every line of the file becomes a tag owned by the root tag and linked to each
 * target with a {@link Relation#HAS_TAG} edge and the inverse {@link Relation#TAG_ASSIGNED_TO}.</p>
 *
 * <p>The scan is strict: a path that cannot be canonicalized, a directory that cannot
 * be listed or a tag file that cannot be read aborts it with an {@link IOException}.
 * A tag file without targets only logs a warning.</p>
 */
public class TagFileScanner {
    private static final Logger log = LoggerFactory.getLogger(TagFileScanner.class);

    private final NodeRegistry registry;
    private final TagFileNames names;
    private final TagFileReader reader;
    private final MetricsService metricsService;

    public TagFileScanner(NodeRegistry registry, TagFileNames names, TagFileReader reader,
                          MetricsService metricsService) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.names = Objects.requireNonNull(names, "names is required");
        this.reader = Objects.requireNonNull(reader, "reader is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    public ScanResult scan(Path root) throws IOException {
        int rootTag = registry.rootTag();
        List<Path> tagFiles = findTagFiles(root);
        log.trace("tagfiles.found root={} count={}", root, tagFiles.size());

        int unmatched = 0;
        int tagsParsed = 0;
        for (Path tagFile : tagFiles) {
            log.trace("tagfile.visit path={}", tagFile);
            List<Integer> targets = resolveTargets(tagFile);
            if (targets.isEmpty()) {
                unmatched++;
                metricsService.incrementUnmatchedTagFiles();
                log.warn("tagfile.unmatched path={} reason=no associated files", tagFile);
            }

            List<String> tags = reader.read(tagFile);
            for (String tag : tags) {
                int tagNode = registry.tag(tag);
                registry.connect(rootTag, tagNode, Relation.HAS_TAG);
                for (int target : targets) {
                    log.trace("tag.attach tag='{}' target={}", tag, target);
                    registry.connect(target, tagNode, Relation.HAS_TAG);
                    registry.connect(tagNode, target, Relation.TAG_ASSIGNED_TO);
                }
            }
            tagsParsed += tags.size();
            metricsService.incrementTagFilesScanned();
            metricsService.recordTagsParsed(tags.size());
        }

        return new ScanResult(tagFiles.size(), unmatched, tagsParsed);
    }

    /**
     * Every regular file below {@code root} carrying the tag-file extension, sorted by path.
     * Symlinked directories are not entered. A root that is not a directory has no tag files.
     */
    List<Path> findTagFiles(Path root) throws IOException {
        List<Path> found = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return found;
        }
        Deque<Path> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Path directory = pending.pop();
            for (Path entry : Directories.listSorted(directory)) {
                if (names.isTagFile(entry)) {
                    if (Files.isRegularFile(entry)) {
                        found.add(entry);
                    }
                } else if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    pending.push(entry);
                }
            }
        }
        Collections.sort(found);
        return found;
    }

    /**
     * Registers the tag file's directory and returns the handles its tags attach to.
     */
    List<Integer> resolveTargets(Path tagFile) throws IOException {
        Path directory = tagFile.toAbsolutePath().getParent().toRealPath();
        int directoryNode = registry.directory(directory);
        String name = tagFile.getFileName().toString();

        if (names.isDirectoryTagFile(name)) {
            log.trace("tagfile.directory path={} target={}", tagFile, directory);
            return List.of(directoryNode);
        }

        String tagFileStem = TagFileNames.stem(name);
        List<Integer> targets = new ArrayList<>();
        for (Path sibling : Directories.listSorted(directory)) {
            if (names.isTagFile(sibling)) {
                continue;
            }
            String siblingName = sibling.getFileName().toString();
            if (siblingName.equals(tagFileStem) || TagFileNames.stem(siblingName).equals(tagFileStem)) {
                Path canonical = sibling.toRealPath();
                if (names.isTagFile(canonical)) {
                    continue;
                }
                int target = Files.isDirectory(canonical)
                        ? registry.directory(canonical)
                        : registry.file(canonical);
                log.trace("tagfile.target path={} target={}", canonical, target);
                targets.add(target);
            }
        }
        return targets;
    }
}
