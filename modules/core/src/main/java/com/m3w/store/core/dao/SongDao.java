package com.m3w.store.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(SongRecord.class)
public interface SongDao {

    @SqlUpdate("INSERT INTO song (id, library_id, file_id, title, artist, album, album_artist, " +
            "release_year, genre, track_number, disc_number, composer) " +
            "VALUES (:id, :libraryId, :fileId, :title, :artist, :album, :albumArtist, " +
            ":year, :genre, :trackNumber, :discNumber, :composer)")
    void insert(@Bind("id") String id,
                @Bind("libraryId") String libraryId,
                @Bind("fileId") String fileId,
                @Bind("title") String title,
                @Bind("artist") String artist,
                @Bind("album") String album,
                @Bind("albumArtist") String albumArtist,
                @Bind("year") Integer year,
                @Bind("genre") String genre,
                @Bind("trackNumber") Integer trackNumber,
                @Bind("discNumber") Integer discNumber,
                @Bind("composer") String composer);

    @SqlQuery("SELECT * FROM song WHERE id = :id")
    Optional<SongRecord> findById(@Bind("id") String id);

    @SqlQuery("SELECT s.* FROM song s JOIN library l ON l.id = s.library_id " +
            "WHERE s.id = :id AND l.owner_id = :ownerId")
    Optional<SongRecord> findOwned(@Bind("id") String id, @Bind("ownerId") String ownerId);

    @SqlQuery("SELECT * FROM song WHERE library_id = :libraryId ORDER BY created_at, id")
    List<SongRecord> findByLibrary(@Bind("libraryId") String libraryId);

    @SqlQuery("SELECT COUNT(*) FROM song WHERE file_id = :fileId")
    int countByFile(@Bind("fileId") String fileId);

    @SqlQuery("SELECT s.* FROM song s LEFT JOIN library l ON l.id = s.library_id " +
            "WHERE l.id IS NULL ORDER BY s.id")
    List<SongRecord> findOrphaned();

    @SqlUpdate("UPDATE song SET title = :title, artist = :artist, album = :album, " +
            "album_artist = :albumArtist, release_year = :year, genre = :genre, " +
            "track_number = :trackNumber, disc_number = :discNumber, composer = :composer, " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = :id")
    int updateTags(@Bind("id") String id,
                   @Bind("title") String title,
                   @Bind("artist") String artist,
                   @Bind("album") String album,
                   @Bind("albumArtist") String albumArtist,
                   @Bind("year") Integer year,
                   @Bind("genre") String genre,
                   @Bind("trackNumber") Integer trackNumber,
                   @Bind("discNumber") Integer discNumber,
                   @Bind("composer") String composer);

    @SqlUpdate("DELETE FROM song WHERE id = :id")
    int delete(@Bind("id") String id);
}
