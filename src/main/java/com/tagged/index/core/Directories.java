package com.tagged.index.core;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Directory listing helper shared by the tag-file scanner and the filesystem walker.
 */
public final class Directories {

    private Directories() {
        // utility class
    }

    /**
     * Lists the direct entries of a directory, sorted by path so that builds visit
     * entries in a stable order. The directory handle is closed before returning.
     *
     * @throws IOException if the directory cannot be opened or read
     */
    public static List<Path> listSorted(Path directory) throws IOException {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                entries.add(entry);
            }
        } catch (DirectoryIteratorException e) {
            throw e.getCause();
        }
        Collections.sort(entries);
        return entries;
    }
}
