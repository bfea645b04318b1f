package com.m3w.store.core.catalog;

import com.m3w.store.core.dao.LibraryDao;
import com.m3w.store.core.dao.LibraryRecord;
import com.m3w.store.core.dao.SongDao;
import com.m3w.store.core.dao.SongRecord;
import com.m3w.store.core.dao.StoredFileDao;
import com.m3w.store.core.dao.StoredFileRecord;
import com.m3w.store.core.storage.ObjectStorage;
import com.m3w.store.dedup.CascadeDeleter;
import com.m3w.store.dedup.CascadeResult;
import com.m3w.store.dedup.DedupUploader;
import com.m3w.store.dedup.UploadResult;
import com.m3w.store.types.SongTags;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.io.InputStream;
import java.util.Optional;
import java.util.UUID;

/**
 * Song lifecycle on the server: every song creation adds exactly one file
 * reference and every song deletion releases exactly one.
 */
@ApplicationScoped
public class SongService {

    private static final Logger log = Logger.getLogger(SongService.class);

    static final String UNTITLED = "Untitled";

    @Inject
    Jdbi jdbi;

    @Inject
    DedupUploader uploader;

    @Inject
    CascadeDeleter cascadeDeleter;

    @Inject
    ObjectStorage storage;

    @ConfigProperty(name = "m3w.upload.max-size", defaultValue = "524288000")
    long maxUploadSize;

    /**
     * Uploads audio into a library and creates its song from the suggested tags.
     *
     * @return empty when the library does not exist or is not owned by {@code ownerId}
     * @throws IllegalArgumentException if the payload is empty or over the size limit
     */
    public Optional<SongUpload> upload(String ownerId, String libraryId,
                                       byte[] data, String filename, String mimeType) {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("Upload is empty");
        }
        if (data.length > maxUploadSize) {
            throw new IllegalArgumentException("Upload of " + data.length
                    + " bytes exceeds limit of " + maxUploadSize);
        }
        if (ownedLibrary(ownerId, libraryId).isEmpty()) {
            return Optional.empty();
        }

        UploadResult upload = uploader.upload(data, filename, mimeType);
        String songId = UUID.randomUUID().toString();
        try {
            SongRecord song = jdbi.inTransaction(h -> insertSong(h, songId, libraryId, upload.fileId(),
                    upload.suggestedTags()));
            log.infof("Song %s created in library %s: file=%s new=%s",
                    songId, libraryId, upload.fileId(), upload.isNewFile());
            return Optional.of(new SongUpload(song, upload));
        } catch (RuntimeException e) {
            // the reference taken by upload() has no song to belong to
            log.errorf(e, "Song insert failed after upload, releasing file %s", upload.fileId());
            cascadeDeleter.decrementFileRef(upload.fileId());
            throw e;
        }
    }

    /**
     * Creates another song over an existing file, e.g. when copying a song into
     * a second library. Increment and insert share one transaction.
     *
     * @return empty when the library is not owned by {@code ownerId} or the file does not exist
     */
    public Optional<SongRecord> linkSong(String ownerId, String libraryId, String fileId, SongTags tags) {
        if (ownedLibrary(ownerId, libraryId).isEmpty()) {
            return Optional.empty();
        }
        String songId = UUID.randomUUID().toString();
        return jdbi.inTransaction(h -> {
            if (h.attach(StoredFileDao.class).increment(fileId) == 0) {
                log.warnf("Cannot link song to missing file %s", fileId);
                return Optional.empty();
            }
            return Optional.of(insertSong(h, songId, libraryId, fileId, tags));
        });
    }

    public Optional<SongRecord> find(String ownerId, String songId) {
        return jdbi.withHandle(h -> h.attach(SongDao.class).findOwned(songId, ownerId));
    }

    public Optional<StoredFileRecord> fileOf(String ownerId, String songId) {
        return find(ownerId, songId)
                .flatMap(s -> jdbi.withHandle(h -> h.attach(StoredFileDao.class).findById(s.fileId())));
    }

    public Optional<SongRecord> updateTags(String ownerId, String songId, SongTags tags) {
        if (find(ownerId, songId).isEmpty()) {
            return Optional.empty();
        }
        return jdbi.inTransaction(h -> {
            SongDao dao = h.attach(SongDao.class);
            dao.updateTags(songId, titleOrDefault(tags), tags.artist(), tags.album(), tags.albumArtist(),
                    tags.year(), tags.genre(), tags.trackNumber(), tags.discNumber(), tags.composer());
            return dao.findById(songId);
        });
    }

    /**
     * Deletes a song, detaching it from playlists and releasing its file.
     *
     * @return empty when the song does not exist or is not owned by {@code ownerId}
     */
    public Optional<CascadeResult> delete(String ownerId, String songId) {
        return find(ownerId, songId)
                .flatMap(s -> cascadeDeleter.deleteSongFromLibrary(s.libraryId(), s.id()));
    }

    /**
     * Opens a byte range of the song's audio.
     *
     * @param end last byte, inclusive; null streams to the end
     */
    public Optional<InputStream> openStream(String ownerId, String songId, long start, Long end) {
        return fileOf(ownerId, songId)
                .map(f -> storage.streamRange(f.storageKey(), start, end).await().indefinitely());
    }

    private Optional<LibraryRecord> ownedLibrary(String ownerId, String libraryId) {
        return jdbi.withHandle(h -> h.attach(LibraryDao.class).findById(libraryId))
                .filter(l -> l.ownerId().equals(ownerId));
    }

    private static SongRecord insertSong(Handle h, String songId, String libraryId, String fileId, SongTags tags) {
        SongDao dao = h.attach(SongDao.class);
        dao.insert(songId, libraryId, fileId, titleOrDefault(tags), tags.artist(), tags.album(),
                tags.albumArtist(), tags.year(), tags.genre(), tags.trackNumber(), tags.discNumber(),
                tags.composer());
        return dao.findById(songId).orElseThrow();
    }

    private static String titleOrDefault(SongTags tags) {
        return tags.hasTitle() ? tags.title() : UNTITLED;
    }
}
