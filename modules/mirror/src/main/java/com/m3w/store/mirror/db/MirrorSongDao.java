package com.m3w.store.mirror.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(MirrorSongRecord.class)
public interface MirrorSongDao {

    @SqlUpdate("INSERT INTO song (id, library_id, file_id, title, artist, album, mime_type, stream_url, " +
            "is_cached, file_hash, created_at, updated_at) " +
            "VALUES (:id, :libraryId, :fileId, :title, :artist, :album, :mimeType, :streamUrl, " +
            "0, :fileHash, :now, :now)")
    void insert(@Bind("id") String id,
                @Bind("libraryId") String libraryId,
                @Bind("fileId") String fileId,
                @Bind("title") String title,
                @Bind("artist") String artist,
                @Bind("album") String album,
                @Bind("mimeType") String mimeType,
                @Bind("streamUrl") String streamUrl,
                @Bind("fileHash") String fileHash,
                @Bind("now") long now);

    @SqlQuery("SELECT * FROM song WHERE id = :id")
    Optional<MirrorSongRecord> findById(@Bind("id") String id);

    @SqlQuery("SELECT * FROM song WHERE library_id = :libraryId ORDER BY created_at, id")
    List<MirrorSongRecord> findByLibrary(@Bind("libraryId") String libraryId);

    @SqlUpdate("UPDATE song SET is_cached = 1, cache_size = :size, last_cache_check = :now, " +
            "updated_at = :now WHERE id = :id")
    int markCached(@Bind("id") String id, @Bind("size") long size, @Bind("now") long now);

    @SqlQuery("SELECT COALESCE(stream_url, '/api/songs/' || id || '/stream') FROM song")
    List<String> allCacheKeys();

    @SqlQuery("SELECT COUNT(*) FROM song WHERE file_id = :fileId")
    int countByFile(@Bind("fileId") String fileId);

    @SqlQuery("SELECT COUNT(*) FROM song WHERE library_id = :libraryId")
    int countByLibrary(@Bind("libraryId") String libraryId);

    @SqlQuery("SELECT COALESCE(SUM(f.size_bytes), 0) FROM song s JOIN file f ON f.id = s.file_id " +
            "WHERE s.library_id = :libraryId")
    long totalSize(@Bind("libraryId") String libraryId);

    @SqlQuery("SELECT COUNT(*) FROM song WHERE library_id = :libraryId AND is_cached = 1")
    int countCached(@Bind("libraryId") String libraryId);

    @SqlQuery("SELECT COALESCE(SUM(cache_size), 0) FROM song WHERE library_id = :libraryId AND is_cached = 1")
    long cachedSize(@Bind("libraryId") String libraryId);

    @SqlUpdate("DELETE FROM song WHERE id = :id")
    int delete(@Bind("id") String id);
}
