package com.tagged.index.api;

import java.time.Duration;

/**
 * Counters collected while building one tag graph.
 *
 * @param tagFilesScanned   tag files read by the scan pass
 * @param unmatchedTagFiles tag files whose tags found no attachment target
 * @param tagsParsed        tag lines read, duplicates included
 * @param entriesWalked     filesystem entries recorded by the walk pass
 * @param walkErrors        entries or listings the walk pass skipped because of errors
 * @param nodeCount         nodes in the finished graph
 * @param edgeCount         edges in the finished graph
 * @param duration          wall-clock duration of the build
 */
public record BuildStats(
        int tagFilesScanned,
        int unmatchedTagFiles,
        int tagsParsed,
        int entriesWalked,
        int walkErrors,
        int nodeCount,
        int edgeCount,
        Duration duration
) {
}
