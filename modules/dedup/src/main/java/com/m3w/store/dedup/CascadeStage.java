package com.m3w.store.dedup;

/**
 * Stages reported while a library is deleted, in order.
 */
public enum CascadeStage {
    ENUMERATING("songs"),
    DETACHING("playlistSongs"),
    PROCESSING("songs"),
    REMOVING_CONTAINER("library"),
    COMPLETE("complete");

    private final String label;

    CascadeStage(String label) {
        this.label = label;
    }

    /** Label shown to clients. Enumeration and processing share {@code songs}. */
    public String label() {
        return label;
    }
}
