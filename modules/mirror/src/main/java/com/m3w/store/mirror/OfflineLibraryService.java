package com.m3w.store.mirror;

import com.m3w.store.dedup.CascadeDeleter;
import com.m3w.store.dedup.CascadePolicy;
import com.m3w.store.dedup.CascadeResult;
import com.m3w.store.dedup.DedupUploader;
import com.m3w.store.dedup.DeleteProgressListener;
import com.m3w.store.dedup.UploadResult;
import com.m3w.store.formats.TagExtractor;
import com.m3w.store.mirror.cache.BinaryCache;
import com.m3w.store.mirror.cache.DirectoryBinaryCache;
import com.m3w.store.mirror.db.MirrorFileDao;
import com.m3w.store.mirror.db.MirrorFileRecord;
import com.m3w.store.mirror.db.MirrorLibraryDao;
import com.m3w.store.mirror.db.MirrorLibraryRecord;
import com.m3w.store.mirror.db.MirrorPlaylistDao;
import com.m3w.store.mirror.db.MirrorSongDao;
import com.m3w.store.mirror.db.MirrorSongRecord;
import com.m3w.store.types.SongTags;
import com.m3w.store.util.ContentHash;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Library operations of the offline mirror. Reference counting and cascades
 * run through the same engine as the server.
 */
public class OfflineLibraryService {

    private static final Logger log = Logger.getLogger(OfflineLibraryService.class);

    private static final String STREAM_PREFIX = "/api/songs/";
    private static final String DEFAULT_MIME = "audio/mpeg";

    private final Jdbi jdbi;
    private final BinaryCache cache;
    private final DedupUploader uploader;
    private final CascadeDeleter cascadeDeleter;

    public OfflineLibraryService(Jdbi jdbi, BinaryCache cache, TagExtractor tagExtractor, CascadePolicy policy) {
        this.jdbi = jdbi;
        this.cache = cache;
        MirrorTier tier = new MirrorTier(jdbi, cache);
        this.uploader = new DedupUploader(tier, tagExtractor);
        this.cascadeDeleter = new CascadeDeleter(tier, policy);
    }

    public static OfflineLibraryService open(MirrorSettings settings, TagExtractor tagExtractor) {
        MirrorDatabase database = MirrorDatabase.open(settings.databaseFile());
        return new OfflineLibraryService(database.jdbi(), new DirectoryBinaryCache(settings.cacheDirectory()),
                tagExtractor, settings.cascadePolicy());
    }

    /** Creates the library if the mirror does not know it yet. */
    public MirrorLibraryRecord ensureLibrary(String libraryId, String name) {
        return jdbi.inTransaction(h -> {
            MirrorLibraryDao dao = h.attach(MirrorLibraryDao.class);
            dao.insert(libraryId, name, System.currentTimeMillis());
            return dao.findById(libraryId).orElseThrow();
        });
    }

    public void ensurePlaylist(String playlistId, String name) {
        jdbi.useHandle(h -> h.attach(MirrorPlaylistDao.class).insert(playlistId, name, System.currentTimeMillis()));
    }

    public boolean addToPlaylist(String playlistId, String songId) {
        return jdbi.withHandle(h -> h.attach(MirrorPlaylistDao.class)
                .append(playlistId, songId, System.currentTimeMillis())) > 0;
    }

    public List<String> playlistSongIds(String playlistId) {
        return jdbi.withHandle(h -> h.attach(MirrorPlaylistDao.class).songIds(playlistId));
    }

    public Optional<MirrorSongRecord> findSong(String songId) {
        return jdbi.withHandle(h -> h.attach(MirrorSongDao.class).findById(songId));
    }

    public Optional<MirrorFileRecord> findFile(String fileId) {
        return jdbi.withHandle(h -> h.attach(MirrorFileDao.class).findById(fileId));
    }

    public List<MirrorSongRecord> songs(String libraryId) {
        return jdbi.withHandle(h -> h.attach(MirrorSongDao.class).findByLibrary(libraryId));
    }

    /**
     * Mirrors a server song. The file row is shared by hash; a song without a
     * hash is stored as a legacy song owning its cache entry.
     *
     * @param audio bytes to cache now, or null to leave the song uncached
     * @throws IllegalArgumentException if the song carries a malformed hash
     */
    public MirrorSongRecord importSong(ImportedSong song, byte[] audio) {
        // stored lowercase so imports and offline uploads share one file id
        String hash = song.fileHash() != null ? ContentHash.fromHex(song.fileHash()).toHex() : null;
        String streamUrl = MirrorSongRecord.streamUrlFor(song.id());
        MirrorSongRecord stored = jdbi.inTransaction(h -> {
            String fileId = null;
            if (hash != null) {
                fileId = referenceFile(h, hash, song);
            }
            h.attach(MirrorSongDao.class).insert(song.id(), song.libraryId(), fileId, song.title(), song.artist(),
                    song.album(), song.mimeType(), streamUrl, hash, System.currentTimeMillis());
            return h.attach(MirrorSongDao.class).findById(song.id()).orElseThrow();
        });
        log.debugf("Imported song %s into library %s (file=%s)", song.id(), song.libraryId(), stored.fileId());

        if (audio != null) {
            cache.put(streamUrl, audio);
            return markCached(song.id(), audio.length);
        }
        return stored;
    }

    private static String referenceFile(Handle h, String hash, ImportedSong song) {
        MirrorFileDao files = h.attach(MirrorFileDao.class);
        if (files.incrementByHash(hash) > 0) {
            return files.findByHash(hash).orElseThrow().id();
        }
        String fileId = MirrorFileRecord.idFor(hash);
        files.insert(fileId, hash, song.fileSize(), song.mimeType(), song.durationSeconds(),
                null, null, null, System.currentTimeMillis());
        return fileId;
    }

    /**
     * Uploads audio while offline: the file is deduplicated by hash, the song
     * is created from the extracted tags and the bytes are cached under the
     * song's stream URL.
     *
     * @return empty when the library is unknown to the mirror
     */
    public Optional<MirrorSongRecord> uploadOffline(String libraryId, byte[] data, String filename, String mimeType) {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("Upload is empty");
        }
        if (jdbi.withHandle(h -> h.attach(MirrorLibraryDao.class).findById(libraryId)).isEmpty()) {
            return Optional.empty();
        }
        String mime = mimeType != null ? mimeType : DEFAULT_MIME;

        UploadResult upload = uploader.upload(data, filename, mime);
        String songId = UUID.randomUUID().toString();
        String streamUrl = MirrorSongRecord.streamUrlFor(songId);
        SongTags tags = upload.suggestedTags();
        try {
            cache.put(streamUrl, data);
            jdbi.useTransaction(h -> h.attach(MirrorSongDao.class).insert(songId, libraryId, upload.fileId(),
                    tags.hasTitle() ? tags.title() : filename, tags.artist(), tags.album(), mime, streamUrl,
                    upload.hash().toHex(), System.currentTimeMillis()));
        } catch (RuntimeException e) {
            log.errorf(e, "Offline upload of '%s' failed, releasing file %s", filename, upload.fileId());
            cache.delete(streamUrl);
            cascadeDeleter.decrementFileRef(upload.fileId());
            throw e;
        }
        log.infof("Offline upload %s into library %s: file=%s new=%s",
                songId, libraryId, upload.fileId(), upload.isNewFile());
        return Optional.of(markCached(songId, data.length));
    }

    private MirrorSongRecord markCached(String songId, long size) {
        return jdbi.inTransaction(h -> {
            MirrorSongDao dao = h.attach(MirrorSongDao.class);
            dao.markCached(songId, size, System.currentTimeMillis());
            return dao.findById(songId).orElseThrow();
        });
    }

    public CascadeResult deleteLibrary(String libraryId) {
        return deleteLibrary(libraryId, DeleteProgressListener.NONE);
    }

    public CascadeResult deleteLibrary(String libraryId, DeleteProgressListener onProgress) {
        return cascadeDeleter.deleteLibrary(libraryId, onProgress);
    }

    /**
     * @return empty when the song is not in that library
     */
    public Optional<CascadeResult> removeSongFromLibrary(String libraryId, String songId) {
        return cascadeDeleter.deleteSongFromLibrary(libraryId, songId);
    }

    public CascadeResult deletePlaylist(String playlistId) {
        return cascadeDeleter.deletePlaylist(playlistId);
    }

    public Optional<LibraryStats> libraryStats(String libraryId) {
        return jdbi.withHandle(h -> {
            if (h.attach(MirrorLibraryDao.class).findById(libraryId).isEmpty()) {
                return Optional.empty();
            }
            MirrorSongDao songs = h.attach(MirrorSongDao.class);
            return Optional.of(new LibraryStats(songs.countByLibrary(libraryId), songs.countCached(libraryId),
                    songs.totalSize(libraryId), songs.cachedSize(libraryId)));
        });
    }

    /**
     * Evicts cached audio that no surviving song points at. Deleting a song
     * whose file is still shared leaves its entry behind; this reclaims it.
     *
     * @return number of entries evicted
     */
    public int sweepOrphanedCacheEntries() {
        Set<String> live = new HashSet<>(jdbi.withHandle(h -> h.attach(MirrorSongDao.class).allCacheKeys()));
        int evicted = 0;
        for (String key : cache.keys()) {
            if (key.startsWith(STREAM_PREFIX) && !live.contains(key) && cache.delete(key)) {
                log.debugf("Evicted orphaned cache entry %s", key);
                evicted++;
            }
        }
        if (evicted > 0) {
            log.infof("Swept %d orphaned cache entries", evicted);
        }
        return evicted;
    }
}
