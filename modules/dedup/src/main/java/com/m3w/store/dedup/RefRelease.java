package com.m3w.store.dedup;

/**
 * Result of releasing one file reference.
 *
 * @param remaining count after the decrement, 0 when purged or missing
 */
public record RefRelease(Outcome outcome, int remaining) {

    public enum Outcome {
        /** No such file; nothing changed. */
        MISSING,
        /** Count went down and the file survives. */
        DECREMENTED,
        /** Count reached zero; row and payload are gone. */
        PURGED
    }

    static final RefRelease MISSING = new RefRelease(Outcome.MISSING, 0);
    static final RefRelease PURGED = new RefRelease(Outcome.PURGED, 0);
}
