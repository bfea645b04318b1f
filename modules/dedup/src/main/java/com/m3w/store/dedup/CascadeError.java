package com.m3w.store.dedup;

/**
 * A failure recorded during a cascade.
 *
 * @param itemId id of the song that failed, or of the library/playlist for fatal errors
 */
public record CascadeError(String itemId, String message) {

    @Override
    public String toString() {
        return itemId + ": " + message;
    }
}
