package com.tagged.index.scan;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads a tag file.
 *
 * <p>A tag file is a plain text file where each line is one tag. Lines are returned
 * in file order exactly as written: no trimming, no comments, no escaping and no
 * deduplication. An empty line is the empty tag.</p>
 *
 * <p>Lines end at {@code \n}; a {@code \r} directly before it is dropped. A lone
 * {@code \r} is part of the tag, and so is a trailing {@code \r} on an unterminated last line.</p>
 */
public class TagFileReader {

    private final Charset charset;

    public TagFileReader() {
        this(StandardCharsets.UTF_8);
    }

    public TagFileReader(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset is required");
    }

    /**
     * @throws IOException if the file cannot be opened, or is not valid text in the configured charset
     */
    public List<String> read(Path tagFile) throws IOException {
        List<String> tags = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        try (BufferedReader reader = Files.newBufferedReader(tagFile, charset)) {
            int c;
            while ((c = reader.read()) != -1) {
                if (c != '\n') {
                    line.append((char) c);
                    continue;
                }
                int end = line.length();
                if (end > 0 && line.charAt(end - 1) == '\r') {
                    line.setLength(end - 1);
                }
                tags.add(line.toString());
                line.setLength(0);
            }
        }
        if (line.length() > 0) {
            tags.add(line.toString());
        }
        return tags;
    }

    public Charset getCharset() {
        return charset;
    }
}
