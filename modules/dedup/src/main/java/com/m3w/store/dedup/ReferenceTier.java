package com.m3w.store.dedup;

import com.m3w.store.util.StorageKey;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * One storage tier holding File, Song and playlist membership rows plus a byte
 * store for payloads. The server (relational store + object store) and the
 * client mirror (embedded database + binary cache) each implement it, and
 * {@link DedupUploader} and {@link CascadeDeleter} run unchanged on both.
 */
public interface ReferenceTier {

    /** Short name used in log lines. */
    String name();

    /**
     * Runs {@code work} in a transaction. Any exception rolls the transaction
     * back and propagates.
     */
    <T> T inTransaction(TierWork<T> work);

    /** Songs of the library in enumeration order. */
    List<SongRef> songsInLibrary(String libraryId);

    Optional<SongRef> findSong(String songId);

    /**
     * Removes every playlist membership row of the given songs, in any playlist.
     *
     * @return number of rows removed
     */
    int detachFromPlaylists(Collection<String> songIds);

    /**
     * Removes every membership row of the playlist.
     *
     * @return number of rows removed
     */
    int clearPlaylist(String playlistId);

    boolean deletePlaylist(String playlistId);

    boolean deleteLibrary(String libraryId);

    /**
     * Writes a payload under its content-derived key. Called inside the
     * transaction that creates the file, once its row exists. Writing the same
     * key twice is harmless since equal keys imply equal bytes.
     */
    void storePayload(StorageKey key, byte[] data, String mimeType);

    PurgeTiming purgeTiming();

    /**
     * Removes the payload of a file whose count reached zero, or of a legacy song.
     *
     * @param file the purged file, null for a legacy song
     * @param song the song whose deletion triggered the purge, null for a
     *             standalone {@link CascadeDeleter#decrementFileRef}
     * @return false when the payload was already absent
     */
    boolean purgePayload(FileEntry file, SongRef song);
}
