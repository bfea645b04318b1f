package com.m3w.store.dedup;

import com.m3w.store.util.ContentHash;

/**
 * Thrown by {@link TierTransaction#create} when another writer inserted a file
 * with the same hash first. {@link DedupUploader} recovers from it by
 * incrementing the winner's row.
 */
public class DedupConflictException extends RuntimeException {

    private final ContentHash hash;

    public DedupConflictException(ContentHash hash, Throwable cause) {
        super("File already exists for hash " + hash, cause);
        this.hash = hash;
    }

    public ContentHash hash() {
        return hash;
    }
}
