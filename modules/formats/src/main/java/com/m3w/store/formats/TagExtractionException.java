package com.m3w.store.formats;

/**
 * Thrown when a payload cannot be parsed for tags.
 */
public class TagExtractionException extends RuntimeException {

    public TagExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
