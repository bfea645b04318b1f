package com.m3w.store.mirror;

import com.m3w.store.dedup.DedupConflictException;
import com.m3w.store.dedup.FileEntry;
import com.m3w.store.dedup.NewFile;
import com.m3w.store.dedup.PurgeTiming;
import com.m3w.store.dedup.ReferenceTier;
import com.m3w.store.dedup.SongRef;
import com.m3w.store.dedup.TierTransaction;
import com.m3w.store.dedup.TierWork;
import com.m3w.store.mirror.cache.BinaryCache;
import com.m3w.store.mirror.db.MirrorFileDao;
import com.m3w.store.mirror.db.MirrorFileRecord;
import com.m3w.store.mirror.db.MirrorLibraryDao;
import com.m3w.store.mirror.db.MirrorPlaylistDao;
import com.m3w.store.mirror.db.MirrorSongDao;
import com.m3w.store.mirror.db.MirrorSongRecord;
import com.m3w.store.util.ContentHash;
import com.m3w.store.util.StorageKey;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * The offline mirror as a reference tier: rows in SQLite, audio in a
 * {@link BinaryCache} keyed by each song's stream URL.
 *
 * <p>Payloads are cached per song rather than per file, so storing a payload
 * at upload time is left to the caller, who knows the song id. A cache entry
 * is evicted after the transaction that purged its file commits.
 */
public class MirrorTier implements ReferenceTier {

    private static final Logger log = Logger.getLogger(MirrorTier.class);

    private final Jdbi jdbi;
    private final BinaryCache cache;

    public MirrorTier(Jdbi jdbi, BinaryCache cache) {
        this.jdbi = jdbi;
        this.cache = cache;
    }

    @Override
    public String name() {
        return "mirror";
    }

    @Override
    public <T> T inTransaction(TierWork<T> work) {
        return jdbi.inTransaction(h -> work.execute(new MirrorTransaction(h)));
    }

    @Override
    public List<SongRef> songsInLibrary(String libraryId) {
        return jdbi.withHandle(h -> h.attach(MirrorSongDao.class).findByLibrary(libraryId))
                .stream()
                .map(MirrorTier::toRef)
                .toList();
    }

    @Override
    public Optional<SongRef> findSong(String songId) {
        return jdbi.withHandle(h -> h.attach(MirrorSongDao.class).findById(songId)).map(MirrorTier::toRef);
    }

    @Override
    public int detachFromPlaylists(Collection<String> songIds) {
        if (songIds.isEmpty()) {
            return 0;
        }
        return jdbi.withHandle(h -> h.attach(MirrorPlaylistDao.class).detachSongs(songIds));
    }

    @Override
    public int clearPlaylist(String playlistId) {
        return jdbi.withHandle(h -> h.attach(MirrorPlaylistDao.class).clear(playlistId));
    }

    @Override
    public boolean deletePlaylist(String playlistId) {
        return jdbi.withHandle(h -> h.attach(MirrorPlaylistDao.class).delete(playlistId)) > 0;
    }

    @Override
    public boolean deleteLibrary(String libraryId) {
        return jdbi.withHandle(h -> h.attach(MirrorLibraryDao.class).delete(libraryId)) > 0;
    }

    @Override
    public void storePayload(StorageKey key, byte[] data, String mimeType) {
        log.debugf("Payload %s left to the per-song cache", key);
    }

    @Override
    public PurgeTiming purgeTiming() {
        return PurgeTiming.AFTER_COMMIT;
    }

    /**
     * Evicts the cached audio of the song whose deletion released the file.
     * Without a song there is no cache key to evict.
     */
    @Override
    public boolean purgePayload(FileEntry file, SongRef song) {
        if (song == null || song.cacheKey() == null) {
            return false;
        }
        boolean evicted = cache.delete(song.cacheKey());
        if (!evicted) {
            log.debugf("Cache entry already absent: %s", song.cacheKey());
        }
        return evicted;
    }

    static SongRef toRef(MirrorSongRecord song) {
        return new SongRef(song.id(), song.libraryId(), song.fileId(), song.cacheKey());
    }

    static class MirrorTransaction implements TierTransaction {

        private final Handle handle;
        private final MirrorFileDao files;

        MirrorTransaction(Handle handle) {
            this.handle = handle;
            this.files = handle.attach(MirrorFileDao.class);
        }

        @Override
        public Optional<FileEntry> findByHash(ContentHash hash) {
            return files.findByHash(hash.toHex()).map(MirrorFileRecord::toEntry);
        }

        @Override
        public Optional<FileEntry> findFile(String fileId) {
            return files.findById(fileId).map(MirrorFileRecord::toEntry);
        }

        @Override
        public FileEntry create(NewFile file) {
            String id = MirrorFileRecord.idFor(file.hash().toHex());
            try {
                files.insert(id, file.hash().toHex(), file.size(), file.mimeType(),
                        file.physical().durationSeconds(), file.physical().bitrateKbps(),
                        file.physical().sampleRate(), file.physical().channelCount(),
                        System.currentTimeMillis());
            } catch (UnableToExecuteStatementException e) {
                if (MirrorSqlErrors.isUniqueViolation(e)) {
                    throw new DedupConflictException(file.hash(), e);
                }
                throw e;
            }
            return files.findById(id).map(MirrorFileRecord::toEntry).orElseThrow();
        }

        @Override
        public Optional<FileEntry> incrementRef(ContentHash hash) {
            if (files.incrementByHash(hash.toHex()) == 0) {
                return Optional.empty();
            }
            return findByHash(hash);
        }

        @Override
        public OptionalInt incrementRef(String fileId) {
            if (files.increment(fileId) == 0) {
                return OptionalInt.empty();
            }
            return files.refCount(fileId).map(OptionalInt::of).orElseGet(OptionalInt::empty);
        }

        @Override
        public OptionalInt decrementRef(String fileId) {
            if (files.decrement(fileId) == 0) {
                return OptionalInt.empty();
            }
            return files.refCount(fileId).map(OptionalInt::of).orElseGet(OptionalInt::empty);
        }

        @Override
        public boolean deleteFile(String fileId) {
            return files.delete(fileId) > 0;
        }

        @Override
        public boolean deleteSong(String songId) {
            return handle.attach(MirrorSongDao.class).delete(songId) > 0;
        }
    }
}
