package com.m3w.store.core.catalog;

import com.m3w.store.core.dao.PlaylistDao;
import com.m3w.store.core.dao.PlaylistRecord;
import com.m3w.store.core.dao.SongDao;
import com.m3w.store.core.dao.SongRecord;
import com.m3w.store.dedup.CascadeDeleter;
import com.m3w.store.dedup.CascadeResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owner-scoped playlists. Membership never touches file reference counts.
 */
@ApplicationScoped
public class PlaylistService {

    @Inject
    Jdbi jdbi;

    @Inject
    CascadeDeleter cascadeDeleter;

    public PlaylistRecord create(String ownerId, String name) {
        String id = UUID.randomUUID().toString();
        return jdbi.inTransaction(h -> {
            PlaylistDao dao = h.attach(PlaylistDao.class);
            dao.insert(id, ownerId, name);
            return dao.findById(id).orElseThrow();
        });
    }

    public Optional<PlaylistRecord> find(String ownerId, String playlistId) {
        return jdbi.withHandle(h -> h.attach(PlaylistDao.class).findById(playlistId))
                .filter(p -> p.ownerId().equals(ownerId));
    }

    /**
     * Appends a song the owner can see. Adding a song twice is a no-op.
     *
     * @return false when the playlist or song is not found for this owner
     */
    public boolean addSong(String ownerId, String playlistId, String songId) {
        if (find(ownerId, playlistId).isEmpty()) {
            return false;
        }
        return jdbi.inTransaction(h -> {
            if (h.attach(SongDao.class).findOwned(songId, ownerId).isEmpty()) {
                return false;
            }
            PlaylistDao dao = h.attach(PlaylistDao.class);
            if (dao.countEntry(playlistId, songId) > 0) {
                return true;
            }
            return dao.append(playlistId, songId) > 0;
        });
    }

    public Optional<List<SongRecord>> songs(String ownerId, String playlistId) {
        return find(ownerId, playlistId)
                .map(p -> jdbi.withHandle(h -> h.attach(PlaylistDao.class).songs(p.id())));
    }

    public boolean removeSong(String ownerId, String playlistId, String songId) {
        if (find(ownerId, playlistId).isEmpty()) {
            return false;
        }
        return jdbi.withHandle(h -> h.attach(PlaylistDao.class).removeEntry(playlistId, songId)) > 0;
    }

    /**
     * @return null when the playlist does not exist or is not owned by {@code ownerId}
     */
    public CascadeResult delete(String ownerId, String playlistId) {
        if (find(ownerId, playlistId).isEmpty()) {
            return null;
        }
        return cascadeDeleter.deletePlaylist(playlistId);
    }
}
