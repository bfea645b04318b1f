package com.m3w.store.core.catalog;

import com.m3w.store.core.dao.LibraryRecord;
import com.m3w.store.core.dao.PlaylistRecord;
import com.m3w.store.core.dao.SongRecord;
import com.m3w.store.dedup.CascadePolicy;
import com.m3w.store.dedup.CascadeResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class PlaylistServiceTest {

    @TempDir
    Path storageRoot;

    private ServerFixture server;
    private SongRecord first;
    private SongRecord second;

    @BeforeEach
    void setUp() {
        server = new ServerFixture(storageRoot, CascadePolicy.BEST_EFFORT);
        LibraryRecord library = server.libraries.create("alice", "Main");
        first = server.songs.upload("alice", library.id(), "first".getBytes(StandardCharsets.UTF_8),
                "First.mp3", "audio/mpeg").orElseThrow().song();
        second = server.songs.upload("alice", library.id(), "second".getBytes(StandardCharsets.UTF_8),
                "Second.mp3", "audio/mpeg").orElseThrow().song();
    }

    @Test
    void shouldKeepInsertionOrderAndIgnoreDuplicates() {
        PlaylistRecord playlist = server.playlists.create("alice", "Mix");

        assertThat(server.playlists.addSong("alice", playlist.id(), second.id())).isTrue();
        assertThat(server.playlists.addSong("alice", playlist.id(), first.id())).isTrue();
        assertThat(server.playlists.addSong("alice", playlist.id(), second.id())).isTrue();

        assertThat(server.playlists.songs("alice", playlist.id()).orElseThrow())
                .extracting(SongRecord::id)
                .containsExactly(second.id(), first.id());
    }

    @Test
    void shouldNotAddSongOfAnotherOwner() {
        PlaylistRecord playlist = server.playlists.create("bob", "Mine");

        assertThat(server.playlists.addSong("bob", playlist.id(), first.id())).isFalse();
    }

    @Test
    void shouldDeletePlaylistWithoutTouchingSongs() {
        PlaylistRecord playlist = server.playlists.create("alice", "Mix");
        server.playlists.addSong("alice", playlist.id(), first.id());
        server.playlists.addSong("alice", playlist.id(), second.id());

        CascadeResult result = server.playlists.delete("alice", playlist.id());

        assertThat(result.success()).isTrue();
        assertThat(result.deletedPlaylistSongs()).isEqualTo(2);
        assertThat(result.deletedSongs()).isZero();
        assertThat(result.containerDeleted()).isTrue();
        assertThat(server.playlists.find("alice", playlist.id())).isEmpty();
        assertThat(server.songs.find("alice", first.id())).isPresent();
        assertThat(server.blobs()).hasSize(2);
    }

    @Test
    void shouldRemoveSingleEntry() {
        PlaylistRecord playlist = server.playlists.create("alice", "Mix");
        server.playlists.addSong("alice", playlist.id(), first.id());

        assertThat(server.playlists.removeSong("alice", playlist.id(), first.id())).isTrue();
        assertThat(server.playlists.removeSong("alice", playlist.id(), first.id())).isFalse();
        assertThat(server.playlists.delete("bob", playlist.id())).isNull();
    }
}
