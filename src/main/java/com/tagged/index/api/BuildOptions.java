package com.tagged.index.api;

import com.tagged.index.scan.TagFileNames;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Options for tag graph builds.
 * Configures the tag-file naming convention and the charset tag files are read with.
 */
public class BuildOptions {

    private final String tagFileExtension;
    private final String directoryTagFileName;
    private final Charset charset;

    private BuildOptions(Builder builder) {
        this.tagFileExtension = builder.tagFileExtension;
        this.directoryTagFileName = builder.directoryTagFileName;
        this.charset = builder.charset;
    }

    public String getTagFileExtension() {
        return tagFileExtension;
    }

    public String getDirectoryTagFileName() {
        return directoryTagFileName;
    }

    public Charset getCharset() {
        return charset;
    }

    /**
     * Naming rules derived from these options.
     */
    public TagFileNames tagFileNames() {
        return new TagFileNames(tagFileExtension, directoryTagFileName);
    }

    /**
     * Creates default options: {@code .tags} files, {@code dir.tags} for directories, UTF-8.
     */
    public static BuildOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "BuildOptions{" +
                "tagFileExtension='" + tagFileExtension + '\'' +
                ", directoryTagFileName='" + directoryTagFileName + '\'' +
                ", charset=" + charset +
                '}';
    }

    public static class Builder {
        private String tagFileExtension = TagFileNames.DEFAULT_EXTENSION;
        private String directoryTagFileName = TagFileNames.DEFAULT_DIRECTORY_TAG_FILE;
        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Extension marking tag files, without the leading dot.
         */
        public Builder tagFileExtension(String tagFileExtension) {
            this.tagFileExtension = tagFileExtension;
            return this;
        }

        /**
         * Exact file name of the tag file whose tags apply to its containing directory.
         */
        public Builder directoryTagFileName(String directoryTagFileName) {
            this.directoryTagFileName = directoryTagFileName;
            return this;
        }

        public Builder charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        public BuildOptions build() {
            validate();
            return new BuildOptions(this);
        }

        private void validate() {
            Objects.requireNonNull(charset, "charset is required");
            if (tagFileExtension == null || tagFileExtension.isBlank()) {
                throw new IllegalArgumentException("tagFileExtension must not be null or blank");
            }
            if (tagFileExtension.contains(".") || tagFileExtension.contains("/")) {
                throw new IllegalArgumentException(
                        "tagFileExtension must be a bare extension without dots or separators, got: '"
                                + tagFileExtension + "'");
            }
            if (directoryTagFileName == null || directoryTagFileName.isBlank()) {
                throw new IllegalArgumentException("directoryTagFileName must not be null or blank");
            }
            if (!new TagFileNames(tagFileExtension, directoryTagFileName).isTagFileName(directoryTagFileName)) {
                throw new IllegalArgumentException(
                        "directoryTagFileName '" + directoryTagFileName + "' must carry the tag file extension '."
                                + tagFileExtension + "'");
            }
        }
    }
}
