package com.tagged.index.scan;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Naming rules for sidecar tag files.
 *
 * <p>A name's extension is whatever follows its last dot, unless that dot is the
 * first character: {@code .hidden} has no extension and is its own stem, while
 * {@code photo.jpg} has stem {@code photo} and extension {@code jpg}. A file is a
 * tag file when its extension equals the configured tag-file extension.</p>
 */
public final class TagFileNames {

    public static final String DEFAULT_EXTENSION = "tags";
    public static final String DEFAULT_DIRECTORY_TAG_FILE = "dir.tags";

    private final String extension;
    private final String directoryTagFileName;

    public TagFileNames(String extension, String directoryTagFileName) {
        this.extension = Objects.requireNonNull(extension, "extension is required");
        this.directoryTagFileName = Objects.requireNonNull(directoryTagFileName, "directoryTagFileName is required");
    }

    public static TagFileNames defaults() {
        return new TagFileNames(DEFAULT_EXTENSION, DEFAULT_DIRECTORY_TAG_FILE);
    }

    public String getExtension() {
        return extension;
    }

    public String getDirectoryTagFileName() {
        return directoryTagFileName;
    }

    /**
     * Whether the last element of {@code path} names a tag file.
     * Roots such as {@code /} have no file name and are never tag files.
     */
    public boolean isTagFile(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && isTagFileName(fileName.toString());
    }

    public boolean isTagFileName(String name) {
        return extension(name).map(extension::equals).orElse(false);
    }

    /**
     * Whether the name is the reserved tag file that tags its containing directory.
     */
    public boolean isDirectoryTagFile(String name) {
        return directoryTagFileName.equals(name);
    }

    /**
     * Everything before the last non-leading dot, or the whole name when there is none.
     */
    public static String stem(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Everything after the last non-leading dot. {@code "archive."} has an empty extension.
     */
    public static Optional<String> extension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? Optional.of(name.substring(dot + 1)) : Optional.empty();
    }
}
