package com.m3w.store.mirror.db;

import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Collection;
import java.util.List;

public interface MirrorPlaylistDao {

    @SqlUpdate("INSERT OR IGNORE INTO playlist (id, name, created_at) VALUES (:id, :name, :now)")
    int insert(@Bind("id") String id, @Bind("name") String name, @Bind("now") long now);

    @SqlUpdate("DELETE FROM playlist WHERE id = :id")
    int delete(@Bind("id") String id);

    @SqlUpdate("INSERT OR IGNORE INTO playlist_song (playlist_id, song_id, sort_order, added_at) " +
            "SELECT :playlistId, :songId, COALESCE(MAX(sort_order), -1) + 1, :now " +
            "FROM playlist_song WHERE playlist_id = :playlistId")
    int append(@Bind("playlistId") String playlistId, @Bind("songId") String songId, @Bind("now") long now);

    @SqlQuery("SELECT song_id FROM playlist_song WHERE playlist_id = :playlistId ORDER BY sort_order")
    List<String> songIds(@Bind("playlistId") String playlistId);

    @SqlUpdate("DELETE FROM playlist_song WHERE playlist_id = :playlistId")
    int clear(@Bind("playlistId") String playlistId);

    @SqlUpdate("DELETE FROM playlist_song WHERE song_id IN (<songIds>)")
    int detachSongs(@BindList("songIds") Collection<String> songIds);
}
