package com.tagged.index.scan;

/**
 * Outcome of a tag-file scan.
 *
 * @param tagFilesScanned   number of tag files read
 * @param unmatchedTagFiles tag files for which no attachment target was found
 * @param tagsParsed        total tag lines read, duplicates included
 */
public record ScanResult(int tagFilesScanned, int unmatchedTagFiles, int tagsParsed) {
}
