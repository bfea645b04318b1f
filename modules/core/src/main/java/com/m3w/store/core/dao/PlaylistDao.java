package com.m3w.store.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(PlaylistRecord.class)
@RegisterConstructorMapper(SongRecord.class)
public interface PlaylistDao {

    @SqlUpdate("INSERT INTO playlist (id, owner_id, name) VALUES (:id, :ownerId, :name)")
    void insert(@Bind("id") String id, @Bind("ownerId") String ownerId, @Bind("name") String name);

    @SqlQuery("SELECT * FROM playlist WHERE id = :id")
    Optional<PlaylistRecord> findById(@Bind("id") String id);

    @SqlUpdate("DELETE FROM playlist WHERE id = :id")
    int delete(@Bind("id") String id);

    /**
     * Appends a song after the playlist's current last position.
     */
    @SqlUpdate("INSERT INTO playlist_song (playlist_id, song_id, sort_order) " +
            "SELECT :playlistId, :songId, COALESCE(MAX(sort_order), -1) + 1 " +
            "FROM playlist_song WHERE playlist_id = :playlistId")
    int append(@Bind("playlistId") String playlistId, @Bind("songId") String songId);

    @SqlQuery("SELECT COUNT(*) FROM playlist_song WHERE playlist_id = :playlistId AND song_id = :songId")
    int countEntry(@Bind("playlistId") String playlistId, @Bind("songId") String songId);

    @SqlQuery("SELECT s.* FROM song s JOIN playlist_song ps ON ps.song_id = s.id " +
            "WHERE ps.playlist_id = :playlistId ORDER BY ps.sort_order")
    List<SongRecord> songs(@Bind("playlistId") String playlistId);

    @SqlUpdate("DELETE FROM playlist_song WHERE playlist_id = :playlistId AND song_id = :songId")
    int removeEntry(@Bind("playlistId") String playlistId, @Bind("songId") String songId);

    @SqlUpdate("DELETE FROM playlist_song WHERE playlist_id = :playlistId")
    int clear(@Bind("playlistId") String playlistId);

    @SqlUpdate("DELETE FROM playlist_song WHERE song_id IN (<songIds>)")
    int detachSongs(@BindList("songIds") Collection<String> songIds);
}
