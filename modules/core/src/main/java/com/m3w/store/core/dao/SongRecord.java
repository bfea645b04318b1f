package com.m3w.store.core.dao;

import com.m3w.store.types.SongTags;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record SongRecord(
        @ColumnName("id") String id,
        @ColumnName("library_id") String libraryId,
        @ColumnName("file_id") String fileId,
        @ColumnName("title") String title,
        @ColumnName("artist") String artist,
        @ColumnName("album") String album,
        @ColumnName("album_artist") String albumArtist,
        @ColumnName("release_year") Integer releaseYear,
        @ColumnName("genre") String genre,
        @ColumnName("track_number") Integer trackNumber,
        @ColumnName("disc_number") Integer discNumber,
        @ColumnName("composer") String composer,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt
) {

    public SongTags tags() {
        return new SongTags(title, artist, album, albumArtist, releaseYear, genre,
                trackNumber, discNumber, composer);
    }
}
