package com.m3w.store.dedup;

import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Deletes libraries, playlists and songs on one tier, releasing file
 * references and purging payloads that are no longer referenced.
 *
 * <p>Each song is released in its own transaction: delete the Song row,
 * decrement its file, and purge the file when the count reaches zero. A
 * failing song is recorded and the loop moves on; nothing already committed
 * is rolled back. Only failures outside the loop (enumeration, playlist
 * detach, removing the parent row) clear {@link CascadeResult#success()}.
 */
public class CascadeDeleter {

    private static final Logger log = Logger.getLogger(CascadeDeleter.class);

    private final ReferenceTier tier;
    private final CascadePolicy policy;

    public CascadeDeleter(ReferenceTier tier, CascadePolicy policy) {
        this.tier = Objects.requireNonNull(tier, "tier");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public CascadePolicy policy() {
        return policy;
    }

    public CascadeResult deleteLibrary(String libraryId) {
        return deleteLibrary(libraryId, DeleteProgressListener.NONE);
    }

    /**
     * Deletes a library and all of its songs, reporting progress through
     * {@code songs → playlistSongs → songs → library → complete}.
     */
    public CascadeResult deleteLibrary(String libraryId, DeleteProgressListener listener) {
        Tally tally = new Tally();
        try {
            log.infof("Deleting library %s on %s", libraryId, tier.name());
            List<SongRef> songs = tier.songsInLibrary(libraryId);
            int total = songs.size();
            listener.onProgress(new DeleteProgress(CascadeStage.ENUMERATING, 0, total,
                    "Found " + total + " songs in library"));

            listener.onProgress(new DeleteProgress(CascadeStage.DETACHING, 0, total,
                    "Removing songs from playlists"));
            List<String> songIds = songs.stream().map(SongRef::id).toList();
            tally.playlistSongs = songIds.isEmpty() ? 0 : tier.detachFromPlaylists(songIds);

            listener.onProgress(new DeleteProgress(CascadeStage.PROCESSING, 0, total,
                    "Deleting songs"));
            int processed = 0;
            for (SongRef song : songs) {
                processed++;
                releaseSong(song, tally);
                listener.onProgress(new DeleteProgress(CascadeStage.PROCESSING, processed, total,
                        "Processing song " + processed + "/" + total));
            }

            listener.onProgress(new DeleteProgress(CascadeStage.REMOVING_CONTAINER, total, total,
                    "Deleting library"));
            boolean removed = false;
            if (policy == CascadePolicy.STRICT && !tally.errors.isEmpty()) {
                log.warnf("Keeping library %s on %s: %d song(s) failed to clean up",
                        libraryId, tier.name(), tally.errors.size());
            } else {
                removed = tier.deleteLibrary(libraryId);
            }

            listener.onProgress(new DeleteProgress(CascadeStage.COMPLETE, total, total,
                    "Deletion complete"));
            CascadeResult result = tally.toResult(true, removed);
            log.infof("Library %s deleted on %s: songs=%d playlistSongs=%d payloads=%d errors=%d",
                    libraryId, tier.name(), result.deletedSongs(), result.deletedPlaylistSongs(),
                    result.deletedCacheEntries(), result.errors().size());
            return result;
        } catch (RuntimeException e) {
            log.errorf(e, "Library deletion failed on %s: library=%s", tier.name(), libraryId);
            tally.errors.add(new CascadeError(libraryId, "Fatal error: " + describe(e)));
            return tally.toResult(false, false);
        }
    }

    /**
     * Deletes one song after checking it belongs to the library.
     *
     * @return empty when the song does not exist or lives in another library
     */
    public Optional<CascadeResult> deleteSongFromLibrary(String libraryId, String songId) {
        Optional<SongRef> song = tier.findSong(songId)
                .filter(s -> s.libraryId().equals(libraryId));
        if (song.isEmpty()) {
            log.warnf("Song %s not found in library %s on %s", songId, libraryId, tier.name());
            return Optional.empty();
        }

        Tally tally = new Tally();
        try {
            tally.playlistSongs = tier.detachFromPlaylists(List.of(songId));
        } catch (RuntimeException e) {
            log.errorf(e, "Failed to detach song %s from playlists on %s", songId, tier.name());
            tally.errors.add(new CascadeError(songId, "Fatal error: " + describe(e)));
            return Optional.of(tally.toResult(false, false));
        }
        releaseSong(song.get(), tally);
        return Optional.of(tally.toResult(true, false));
    }

    /**
     * Deletes a playlist and its membership rows. Files are untouched: songs,
     * not playlists, hold file references.
     */
    public CascadeResult deletePlaylist(String playlistId) {
        Tally tally = new Tally();
        try {
            tally.playlistSongs = tier.clearPlaylist(playlistId);
            boolean removed = tier.deletePlaylist(playlistId);
            log.infof("Playlist %s deleted on %s: rows=%d", playlistId, tier.name(), tally.playlistSongs);
            return tally.toResult(true, removed);
        } catch (RuntimeException e) {
            log.errorf(e, "Playlist deletion failed on %s: playlist=%s", tier.name(), playlistId);
            tally.errors.add(new CascadeError(playlistId, "Fatal error: " + describe(e)));
            return tally.toResult(false, false);
        }
    }

    /**
     * Releases one reference to a file outside of any song deletion, purging
     * it when the count reaches zero. A missing file is a no-op.
     */
    public RefRelease decrementFileRef(String fileId) {
        Step step = tier.inTransaction(tx -> release(tx, fileId, null));
        if (step.deferredPurge != null) {
            tier.purgePayload(step.deferredPurge, null);
        }
        return step.release;
    }

    private void releaseSong(SongRef song, Tally tally) {
        try {
            Step step = tier.inTransaction(tx -> {
                if (!tx.deleteSong(song.id())) {
                    log.debugf("Song %s already gone on %s", song.id(), tier.name());
                    return Step.SKIPPED;
                }
                if (song.isLegacy()) {
                    return purgeLegacy(song);
                }
                return release(tx, song.fileId(), song);
            });

            int purged = step.purgedInTransaction ? 1 : 0;
            if (step.deferredPurge != null || step.deferredLegacy) {
                if (tier.purgePayload(step.deferredPurge, song)) {
                    purged++;
                }
            }
            if (step.songDeleted) {
                tally.songs++;
            }
            tally.payloads += purged;
        } catch (RuntimeException e) {
            log.errorf(e, "Failed to delete song %s on %s", song.id(), tier.name());
            tally.errors.add(new CascadeError(song.id(),
                    "Failed to process song " + song.id() + ": " + describe(e)));
        }
    }

    // Legacy songs own their payload outright; no count is consulted.
    private Step purgeLegacy(SongRef song) {
        if (tier.purgeTiming() == PurgeTiming.IN_TRANSACTION) {
            boolean purged = tier.purgePayload(null, song);
            return new Step(true, RefRelease.PURGED, purged, null, false);
        }
        return new Step(true, RefRelease.PURGED, false, null, true);
    }

    private Step release(TierTransaction tx, String fileId, SongRef song) {
        Optional<FileEntry> file = tx.findFile(fileId);
        if (file.isEmpty()) {
            log.warnf("File %s not found on %s, nothing to release", fileId, tier.name());
            return new Step(song != null, RefRelease.MISSING, false, null, false);
        }

        OptionalInt remaining = tx.decrementRef(fileId);
        if (remaining.isEmpty()) {
            log.warnf("File %s vanished on %s during release", fileId, tier.name());
            return new Step(song != null, RefRelease.MISSING, false, null, false);
        }
        if (remaining.getAsInt() > 0) {
            log.debugf("File %s on %s now has %d reference(s)", fileId, tier.name(), remaining.getAsInt());
            return new Step(song != null,
                    new RefRelease(RefRelease.Outcome.DECREMENTED, remaining.getAsInt()), false, null, false);
        }

        // Row first: if the delete is refused the transaction aborts with the blob intact.
        tx.deleteFile(fileId);
        boolean purgedNow = false;
        if (tier.purgeTiming() == PurgeTiming.IN_TRANSACTION) {
            purgedNow = tier.purgePayload(file.get(), song);
        }
        log.infof("File %s purged on %s (hash=%s)", fileId, tier.name(), file.get().hash());
        FileEntry deferred = tier.purgeTiming() == PurgeTiming.AFTER_COMMIT ? file.get() : null;
        return new Step(song != null, RefRelease.PURGED, purgedNow, deferred, false);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * What one transaction did, and what is left to purge once it commits.
     */
    private record Step(boolean songDeleted,
                        RefRelease release,
                        boolean purgedInTransaction,
                        FileEntry deferredPurge,
                        boolean deferredLegacy) {

        static final Step SKIPPED = new Step(false, RefRelease.MISSING, false, null, false);
    }

    private static final class Tally {
        int playlistSongs;
        int songs;
        int payloads;
        final List<CascadeError> errors = new ArrayList<>();

        CascadeResult toResult(boolean success, boolean containerDeleted) {
            return new CascadeResult(success, playlistSongs, songs, payloads, containerDeleted, errors);
        }
    }
}
