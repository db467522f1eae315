package com.tagged.index.walk;

import com.tagged.index.core.model.Edge;
import com.tagged.index.core.model.NodeKind;
import com.tagged.index.core.model.Relation;
import com.tagged.index.core.model.TagGraphNode;
import com.tagged.index.graph.NodeRegistry;
import com.tagged.index.graph.TagGraph;
import com.tagged.index.metrics.MetricsService;
import com.tagged.index.metrics.NoOpMetricsService;
import com.tagged.index.scan.TagFileNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.Mockito.*;

class FileSystemWalkerTest {

    @TempDir
    Path tempDir;

    private Path root;
    private NodeRegistry registry;
    private FileSystemWalker walker;

    @BeforeEach
    void setUp() throws IOException {
        root = tempDir.toRealPath();
        registry = new NodeRegistry();
        walker = new FileSystemWalker(registry, TagFileNames.defaults(), new NoOpMetricsService());
    }

    @Test
    @DisplayName("Root should hang below the root directory anchor")
    void testRootWiring() {
        WalkResult result = walker.walk(root);

        assertEquals(new WalkResult(1, 0), result);
        int anchor = handle(TagGraphNode.rootDirectory());
        int rootNode = handle(TagGraphNode.directory(root));
        assertEquals(List.of(new Edge(anchor, rootNode, Relation.CHILD)), graph().outgoing(anchor));
        assertEquals(List.of(new Edge(rootNode, anchor, Relation.PARENT)), graph().outgoing(rootNode));
    }

    @Test
    @DisplayName("Every entry should be linked to its immediate parent directory")
    void testParentChildEdges() throws IOException {
        Path docs = Files.createDirectories(root.resolve("docs/drafts"));
        Files.writeString(root.resolve("readme.md"), "readme");
        Files.writeString(docs.resolve("plan.txt"), "plan");

        WalkResult result = walker.walk(root);

        assertEquals(5, result.entriesVisited());
        int rootNode = handle(TagGraphNode.directory(root));
        int docsNode = handle(TagGraphNode.directory(root.resolve("docs")));
        int draftsNode = handle(TagGraphNode.directory(docs));
        int readme = handle(TagGraphNode.file(root.resolve("readme.md")));
        int plan = handle(TagGraphNode.file(docs.resolve("plan.txt")));

        assertLinked(rootNode, docsNode);
        assertLinked(rootNode, readme);
        assertLinked(docsNode, draftsNode);
        assertLinked(draftsNode, plan);
        assertFalse(graph().containsEdge(rootNode, plan, Relation.CHILD));
        // 5 entries plus the anchor, two edges per entry
        assertEquals(6, graph().nodeCount());
        assertEquals(10, graph().edgeCount());
    }

    @Test
    @DisplayName("Tag files should be skipped by the walk")
    void testSkipsTagFiles() throws IOException {
        Files.writeString(root.resolve("img.png"), "png");
        Files.writeString(root.resolve("img.tags"), "favorite\n");
        Files.writeString(root.resolve("dir.tags"), "red\n");

        WalkResult result = walker.walk(root);

        assertEquals(2, result.entriesVisited());
        assertTrue(registry.find(TagGraphNode.file(root.resolve("img.tags"))).isEmpty());
        assertTrue(registry.find(TagGraphNode.file(root.resolve("dir.tags"))).isEmpty());
        assertTrue(registry.find(TagGraphNode.file(root.resolve("img.png"))).isPresent());
    }

    @Test
    @DisplayName("Directories named like tag files should be skipped with their contents")
    void testSkipsTagNamedDirectories() throws IOException {
        Path odd = Files.createDirectory(root.resolve("odd.tags"));
        Files.writeString(odd.resolve("inside.txt"), "x");

        walker.walk(root);

        assertTrue(registry.find(TagGraphNode.directory(odd)).isEmpty());
        assertTrue(registry.find(TagGraphNode.file(odd.resolve("inside.txt"))).isEmpty());
    }

    @Test
    @DisplayName("A walk rooted at a file should link the file to the anchor")
    void testFileRoot() throws IOException {
        Path file = Files.writeString(root.resolve("single.txt"), "x");

        WalkResult result = walker.walk(file);

        assertEquals(1, result.entriesVisited());
        int fileNode = handle(TagGraphNode.file(file));
        assertEquals(NodeKind.FILE, graph().kind(fileNode));
        assertTrue(graph().containsEdge(fileNode, handle(TagGraphNode.rootDirectory()), Relation.PARENT));
    }

    @Test
    @DisplayName("Broken symlinks should be logged and skipped without stopping the walk")
    void testBrokenSymlinkIsSkipped() throws IOException {
        Files.writeString(root.resolve("a.txt"), "a");
        Files.writeString(root.resolve("z.txt"), "z");
        assumeTrue(createSymlink(root.resolve("m-dangling"), root.resolve("does-not-exist")));
        MetricsService metrics = mock(MetricsService.class);
        FileSystemWalker counting = new FileSystemWalker(registry, TagFileNames.defaults(), metrics);

        WalkResult result = counting.walk(root);

        assertEquals(new WalkResult(3, 1), result);
        assertTrue(registry.find(TagGraphNode.file(root.resolve("a.txt"))).isPresent());
        assertTrue(registry.find(TagGraphNode.file(root.resolve("z.txt"))).isPresent());
        verify(metrics, times(1)).incrementWalkErrors();
    }

    @Test
    @DisplayName("Symlinked entries should be recorded under their resolved path")
    void testSymlinkResolvesToTarget() throws IOException {
        Path target = Files.writeString(root.resolve("target.txt"), "t");
        assumeTrue(createSymlink(root.resolve("link.txt"), target));

        walker.walk(root);

        assertTrue(registry.find(TagGraphNode.file(target)).isPresent());
        assertTrue(registry.find(TagGraphNode.file(root.resolve("link.txt"))).isEmpty());
        // target.txt and link.txt resolve to one node
        assertEquals(3, graph().nodeCount());
    }

    @Test
    @DisplayName("A link resolving to a tag file should be skipped like the tag file")
    void testSkipsLinkToTagFile() throws IOException {
        Path tagFile = Files.writeString(root.resolve("real.tags"), "favorite\n");
        assumeTrue(createSymlink(root.resolve("real.txt"), tagFile));

        WalkResult result = walker.walk(root);

        assertEquals(new WalkResult(1, 0), result);
        assertTrue(registry.find(TagGraphNode.file(tagFile)).isEmpty());
        assertTrue(registry.find(TagGraphNode.file(root.resolve("real.txt"))).isEmpty());
        assertEquals(2, graph().nodeCount());
    }

    @Test
    @DisplayName("Symlinked entries should hang below the directory they were listed from")
    void testSymlinkParentIsListingDirectory() throws IOException {
        Path data = Files.createDirectory(root.resolve("data"));
        Path links = Files.createDirectory(root.resolve("links"));
        Path report = Files.writeString(data.resolve("report.txt"), "r");
        assumeTrue(createSymlink(links.resolve("latest.txt"), report));

        walker.walk(root);

        int reportNode = handle(TagGraphNode.file(report));
        int dataNode = handle(TagGraphNode.directory(data));
        int linksNode = handle(TagGraphNode.directory(links));
        assertLinked(dataNode, reportNode);
        assertLinked(linksNode, reportNode);
        assertEquals(2, graph().filtered(r -> r == Relation.PARENT).successors(reportNode).size());
    }

    @Test
    @DisplayName("Missing root should be reported as a skipped entry")
    void testMissingRoot() {
        WalkResult result = walker.walk(root.resolve("missing"));

        assertEquals(new WalkResult(0, 1), result);
        assertEquals(1, registry.size());
    }

    private void assertLinked(int parent, int child) {
        assertTrue(graph().containsEdge(parent, child, Relation.CHILD), "missing CHILD edge");
        assertTrue(graph().containsEdge(child, parent, Relation.PARENT), "missing PARENT edge");
    }

    private static boolean createSymlink(Path link, Path target) {
        try {
            Files.createSymbolicLink(link, target);
            return true;
        } catch (IOException | UnsupportedOperationException e) {
            return false;
        }
    }

    private TagGraph graph() {
        return registry.graph();
    }

    private int handle(TagGraphNode node) {
        return registry.find(node).orElseThrow(() -> new AssertionError("Node not registered: " + node));
    }
}
