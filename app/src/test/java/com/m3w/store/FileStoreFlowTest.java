package com.m3w.store;

import com.m3w.store.core.catalog.LibraryService;
import com.m3w.store.core.catalog.PlaylistService;
import com.m3w.store.core.catalog.RefCountAuditor;
import com.m3w.store.core.catalog.SongService;
import com.m3w.store.core.catalog.SongUpload;
import com.m3w.store.core.dao.LibraryRecord;
import com.m3w.store.core.dao.PlaylistRecord;
import com.m3w.store.core.storage.ObjectStorage;
import com.m3w.store.dedup.CascadePolicy;
import com.m3w.store.dedup.CascadeDeleter;
import com.m3w.store.dedup.CascadeResult;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Upload and cascade through the CDI-wired application against H2 and the
 * filesystem object store.
 */
@QuarkusTest
class FileStoreFlowTest {

    @Inject
    LibraryService libraries;

    @Inject
    SongService songs;

    @Inject
    PlaylistService playlists;

    @Inject
    RefCountAuditor auditor;

    @Inject
    ObjectStorage storage;

    @Inject
    CascadeDeleter cascadeDeleter;

    private static byte[] uniqueAudio() {
        return ("audio " + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void shouldWireConfiguredPolicy() {
        assertThat(cascadeDeleter.policy()).isEqualTo(CascadePolicy.BEST_EFFORT);
    }

    @Test
    void shouldDeduplicateAcrossLibrariesAndPurgeOnLastDelete() {
        String owner = "owner-" + UUID.randomUUID();
        LibraryRecord first = libraries.create(owner, "First");
        LibraryRecord second = libraries.create(owner, "Second");
        byte[] audio = uniqueAudio();

        SongUpload a = songs.upload(owner, first.id(), audio, "Artist - Song.mp3", "audio/mpeg").orElseThrow();
        SongUpload b = songs.upload(owner, second.id(), audio, "copy.mp3", "audio/mpeg").orElseThrow();
        String key = songs.fileOf(owner, a.song().id()).orElseThrow().storageKey();

        assertThat(b.upload().fileId()).isEqualTo(a.upload().fileId());
        assertThat(b.upload().isNewFile()).isFalse();
        assertThat(a.song().title()).isEqualTo("Song");
        assertThat(storage.exists(key).await().indefinitely()).isTrue();

        CascadeResult firstDelete = libraries.delete(owner, first.id());
        assertThat(firstDelete.deletedSongs()).isEqualTo(1);
        assertThat(firstDelete.deletedCacheEntries()).isZero();
        assertThat(storage.exists(key).await().indefinitely()).isTrue();

        CascadeResult secondDelete = libraries.delete(owner, second.id());
        assertThat(secondDelete.deletedCacheEntries()).isEqualTo(1);
        assertThat(storage.exists(key).await().indefinitely()).isFalse();
        assertThat(auditor.findDrift()).isEmpty();
    }

    @Test
    void shouldKeepSongsWhenPlaylistIsDeleted() {
        String owner = "owner-" + UUID.randomUUID();
        LibraryRecord library = libraries.create(owner, "Main");
        SongUpload song = songs.upload(owner, library.id(), uniqueAudio(), "a.mp3", "audio/mpeg").orElseThrow();
        PlaylistRecord playlist = playlists.create(owner, "Mix");
        playlists.addSong(owner, playlist.id(), song.song().id());

        CascadeResult result = playlists.delete(owner, playlist.id());

        assertThat(result.deletedPlaylistSongs()).isEqualTo(1);
        assertThat(songs.find(owner, song.song().id())).isPresent();
        assertThat(songs.fileOf(owner, song.song().id()).orElseThrow().refCount()).isEqualTo(1);
    }
}
