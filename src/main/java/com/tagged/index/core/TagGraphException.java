package com.tagged.index.core;

/**
 * Runtime exception for descriptive failures while building or querying a tag graph,
 * such as an invalid root argument or an unknown node handle.
 * I/O failures are reported as {@link java.io.IOException} instead.
 */
public class TagGraphException extends RuntimeException {

    public TagGraphException(String message) {
        super(message);
    }

    public TagGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
