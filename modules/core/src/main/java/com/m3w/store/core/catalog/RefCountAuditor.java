package com.m3w.store.core.catalog;

import com.m3w.store.core.dao.RefCountDrift;
import com.m3w.store.core.dao.SongDao;
import com.m3w.store.core.dao.SongRecord;
import com.m3w.store.core.dao.StoredFileDao;
import com.m3w.store.core.storage.ObjectStorage;
import com.m3w.store.dedup.CascadeDeleter;
import com.m3w.store.dedup.CascadeResult;
import com.m3w.store.util.StorageKey;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reconciles the server tier after partial failures: counts that drifted from
 * the song graph, songs left behind by a best-effort library deletion, and
 * blobs with no File row.
 */
@ApplicationScoped
public class RefCountAuditor {

    private static final Logger log = Logger.getLogger(RefCountAuditor.class);

    @Inject
    Jdbi jdbi;

    @Inject
    ObjectStorage storage;

    @Inject
    CascadeDeleter cascadeDeleter;

    public List<RefCountDrift> findDrift() {
        return jdbi.withHandle(h -> h.attach(StoredFileDao.class).findDrift());
    }

    /**
     * Raises counts that fell below the number of live songs. Every live song
     * holds a reference, so this is safe under traffic: an upload that has
     * counted its reference but not yet linked its song only adds to the count.
     * Counts above the live songs are reported by {@link #findDrift()} and left
     * to {@link #repairOverCounts()}.
     *
     * @return number of files repaired
     */
    public int repairDrift() {
        int repaired = 0;
        for (RefCountDrift drift : findDrift()) {
            if (drift.refCount() >= drift.liveSongs()) {
                continue;
            }
            boolean fixed = jdbi.inTransaction(h -> {
                Optional<Integer> current = h.attach(StoredFileDao.class).lockRefCount(drift.fileId());
                if (current.isEmpty()) {
                    return false;
                }
                int live = h.attach(SongDao.class).countByFile(drift.fileId());
                if (live <= current.get()) {
                    return false;
                }
                return h.attach(StoredFileDao.class)
                        .adjustRefCount(drift.fileId(), current.get(), live - current.get()) > 0;
            });
            if (fixed) {
                log.infof("Raised file %s refCount %d -> %d", drift.fileId(), drift.refCount(), drift.liveSongs());
                repaired++;
            }
        }
        return repaired;
    }

    /**
     * Lowers counts that exceed the number of live songs and purges files left
     * with none. A reference taken by an upload that has not linked its song yet
     * looks exactly like drift, so run this only while no uploads are in flight.
     * The row goes before the blob; a failed blob delete rolls the row back.
     *
     * @return number of files repaired
     */
    public int repairOverCounts() {
        int repaired = 0;
        for (RefCountDrift drift : findDrift()) {
            if (drift.refCount() <= drift.liveSongs()) {
                continue;
            }
            boolean fixed = jdbi.inTransaction(h -> {
                StoredFileDao files = h.attach(StoredFileDao.class);
                Optional<Integer> current = files.lockRefCount(drift.fileId());
                if (current.isEmpty()) {
                    return false;
                }
                int live = h.attach(SongDao.class).countByFile(drift.fileId());
                if (live >= current.get()) {
                    return false;
                }
                if (live > 0) {
                    return files.adjustRefCount(drift.fileId(), current.get(), live - current.get()) > 0;
                }
                if (files.deleteIfRefCount(drift.fileId(), current.get()) == 0) {
                    return false;
                }
                if (!storage.delete(drift.storageKey()).await().indefinitely()) {
                    log.warnf("Blob %s for file %s was already gone", drift.storageKey(), drift.fileId());
                }
                return true;
            });
            if (fixed) {
                log.infof("Repaired file %s: refCount %d -> %d", drift.fileId(), drift.refCount(), drift.liveSongs());
                repaired++;
            }
        }
        return repaired;
    }

    /** Songs whose library row no longer exists. */
    public List<SongRecord> findOrphanedSongs() {
        return jdbi.withHandle(h -> h.attach(SongDao.class).findOrphaned());
    }

    /**
     * Runs the song cascade again for every orphaned song.
     *
     * @return number of songs removed
     */
    public int reclaimOrphanedSongs() {
        int reclaimed = 0;
        for (SongRecord song : findOrphanedSongs()) {
            Optional<CascadeResult> result = cascadeDeleter.deleteSongFromLibrary(song.libraryId(), song.id());
            if (result.isPresent() && result.get().errors().isEmpty()) {
                reclaimed += result.get().deletedSongs();
            } else {
                log.warnf("Could not reclaim orphaned song %s: %s", song.id(),
                        result.map(CascadeResult::errors).orElse(List.of()));
            }
        }
        return reclaimed;
    }

    /** Keys under {@code files/} with no File row pointing at them. */
    public List<String> findOrphanedBlobs() {
        Set<String> known = new HashSet<>(jdbi.withHandle(h -> h.attach(StoredFileDao.class).allStorageKeys()));
        return storage.list(StorageKey.PREFIX)
                .filter(key -> !known.contains(key))
                .collect().asList()
                .await().indefinitely();
    }

    /**
     * Deletes blobs found by {@link #findOrphanedBlobs()}. Uploads write the blob
     * before its row, so run this only while no uploads are in flight.
     *
     * @return number of blobs deleted
     */
    public int deleteOrphanedBlobs() {
        int deleted = 0;
        for (String key : findOrphanedBlobs()) {
            if (storage.delete(key).await().indefinitely()) {
                log.infof("Deleted orphaned blob %s", key);
                deleted++;
            }
        }
        return deleted;
    }
}
