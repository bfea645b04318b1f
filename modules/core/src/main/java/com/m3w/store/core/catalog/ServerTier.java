package com.m3w.store.core.catalog;

import com.m3w.store.core.dao.LibraryDao;
import com.m3w.store.core.dao.PlaylistDao;
import com.m3w.store.core.dao.SongDao;
import com.m3w.store.core.dao.SongRecord;
import com.m3w.store.core.dao.StoredFileDao;
import com.m3w.store.core.dao.StoredFileRecord;
import com.m3w.store.core.db.SqlStates;
import com.m3w.store.core.storage.ObjectStorage;
import com.m3w.store.dedup.DedupConflictException;
import com.m3w.store.dedup.FileEntry;
import com.m3w.store.dedup.NewFile;
import com.m3w.store.dedup.PurgeTiming;
import com.m3w.store.dedup.ReferenceTier;
import com.m3w.store.dedup.SongRef;
import com.m3w.store.dedup.TierTransaction;
import com.m3w.store.dedup.TierWork;
import com.m3w.store.util.ContentHash;
import com.m3w.store.util.StorageKey;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * Authoritative tier: relational File/Song rows through JDBI, payloads in
 * {@link ObjectStorage}.
 *
 * <p>Blobs are purged inside the song transaction, before the File row goes,
 * so a failed blob delete rolls the song back and leaves the graph intact.
 */
@ApplicationScoped
public class ServerTier implements ReferenceTier {

    private static final Logger log = Logger.getLogger(ServerTier.class);

    @Inject
    Jdbi jdbi;

    @Inject
    ObjectStorage storage;

    @Override
    public String name() {
        return "server";
    }

    @Override
    public <T> T inTransaction(TierWork<T> work) {
        return jdbi.inTransaction(h -> work.execute(new ServerTransaction(h)));
    }

    @Override
    public List<SongRef> songsInLibrary(String libraryId) {
        return jdbi.withHandle(h -> h.attach(SongDao.class).findByLibrary(libraryId)).stream()
                .map(ServerTier::toRef)
                .toList();
    }

    @Override
    public Optional<SongRef> findSong(String songId) {
        return jdbi.withHandle(h -> h.attach(SongDao.class).findById(songId)).map(ServerTier::toRef);
    }

    @Override
    public int detachFromPlaylists(Collection<String> songIds) {
        if (songIds.isEmpty()) {
            return 0;
        }
        return jdbi.inTransaction(h -> h.attach(PlaylistDao.class).detachSongs(songIds));
    }

    @Override
    public int clearPlaylist(String playlistId) {
        return jdbi.withHandle(h -> h.attach(PlaylistDao.class).clear(playlistId));
    }

    @Override
    public boolean deletePlaylist(String playlistId) {
        return jdbi.withHandle(h -> h.attach(PlaylistDao.class).delete(playlistId)) > 0;
    }

    @Override
    public boolean deleteLibrary(String libraryId) {
        return jdbi.withHandle(h -> h.attach(LibraryDao.class).delete(libraryId)) > 0;
    }

    @Override
    public void storePayload(StorageKey key, byte[] data, String mimeType) {
        storage.put(key.toString(), data, mimeType).await().indefinitely();
    }

    @Override
    public PurgeTiming purgeTiming() {
        return PurgeTiming.IN_TRANSACTION;
    }

    @Override
    public boolean purgePayload(FileEntry file, SongRef song) {
        if (file == null) {
            // server songs always reference a file
            return false;
        }
        boolean deleted = storage.delete(file.storageKey()).await().indefinitely();
        if (!deleted) {
            log.warnf("Blob already absent: key=%s file=%s", file.storageKey(), file.id());
        }
        return deleted;
    }

    static SongRef toRef(SongRecord song) {
        return new SongRef(song.id(), song.libraryId(), song.fileId(), null);
    }

    /**
     * File and song mutations bound to one JDBI handle.
     */
    static class ServerTransaction implements TierTransaction {

        private final Handle handle;
        private final StoredFileDao files;

        ServerTransaction(Handle handle) {
            this.handle = handle;
            this.files = handle.attach(StoredFileDao.class);
        }

        @Override
        public Optional<FileEntry> findByHash(ContentHash hash) {
            return files.findByHash(hash.toHex()).map(StoredFileRecord::toEntry);
        }

        @Override
        public Optional<FileEntry> findFile(String fileId) {
            return files.findById(fileId).map(StoredFileRecord::toEntry);
        }

        @Override
        public FileEntry create(NewFile file) {
            String id = UUID.randomUUID().toString();
            try {
                files.insert(id, file.hash().toHex(), file.storageKey().toString(), file.size(),
                        file.mimeType(), file.physical().durationSeconds(), file.physical().bitrateKbps(),
                        file.physical().sampleRate(), file.physical().channelCount());
            } catch (UnableToExecuteStatementException e) {
                if (SqlStates.isUniqueViolation(e)) {
                    throw new DedupConflictException(file.hash(), e);
                }
                throw e;
            }
            return files.findById(id).map(StoredFileRecord::toEntry).orElseThrow();
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
            return handle.attach(SongDao.class).delete(songId) > 0;
        }
    }
}
