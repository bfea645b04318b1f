package com.m3w.store.dedup;

import com.m3w.store.util.ContentHash;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * File and song mutations available inside one tier transaction.
 *
 * <p>Reference-count changes are single atomic store operations: the new count
 * is written and read back under the same row lock, never computed from an
 * earlier read.
 */
public interface TierTransaction {

    Optional<FileEntry> findByHash(ContentHash hash);

    Optional<FileEntry> findFile(String fileId);

    /**
     * Inserts a file with {@code refCount = 1}.
     *
     * @throws DedupConflictException if a file with the same hash already exists
     */
    FileEntry create(NewFile file);

    /**
     * Adds one reference to the file with this hash.
     *
     * @return the updated row, or empty when no file has this hash
     */
    Optional<FileEntry> incrementRef(ContentHash hash);

    /**
     * Adds one reference to the file.
     *
     * @return the new count, or empty when the file does not exist
     */
    OptionalInt incrementRef(String fileId);

    /**
     * Removes one reference from the file.
     *
     * @return the new count, or empty when the file does not exist
     */
    OptionalInt decrementRef(String fileId);

    boolean deleteFile(String fileId);

    boolean deleteSong(String songId);
}
