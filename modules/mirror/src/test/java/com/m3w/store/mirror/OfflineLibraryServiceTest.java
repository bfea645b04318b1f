package com.m3w.store.mirror;

import com.m3w.store.dedup.CascadeError;
import com.m3w.store.dedup.CascadePolicy;
import com.m3w.store.dedup.CascadeResult;
import com.m3w.store.dedup.DeleteProgress;
import com.m3w.store.formats.AudioTags;
import com.m3w.store.mirror.cache.DirectoryBinaryCache;
import com.m3w.store.mirror.db.MirrorFileRecord;
import com.m3w.store.mirror.db.MirrorSongRecord;
import com.m3w.store.util.ContentHash;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OfflineLibraryServiceTest {

    private static final byte[] AUDIO = "offline audio".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path home;

    private FailingBinaryCache cache;
    private OfflineLibraryService mirror;

    @BeforeEach
    void setUp() {
        mirror = open(CascadePolicy.BEST_EFFORT);
        mirror.ensureLibrary("lib-1", "Main");
        mirror.ensureLibrary("lib-2", "Second");
    }

    private OfflineLibraryService open(CascadePolicy policy) {
        MirrorSettings settings = MirrorSettings.under(home).withCascadePolicy(policy);
        MirrorDatabase database = MirrorDatabase.open(settings.databaseFile());
        cache = new FailingBinaryCache(new DirectoryBinaryCache(settings.cacheDirectory()));
        return new OfflineLibraryService(database.jdbi(), cache, (data, mime) -> AudioTags.NONE, policy);
    }

    private MirrorSongRecord upload(String libraryId, byte[] data, String filename) {
        return mirror.uploadOffline(libraryId, data, filename, "audio/mpeg").orElseThrow();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void shouldShareFileBetweenIdenticalOfflineUploads() {
        MirrorSongRecord a = upload("lib-1", AUDIO, "Artist - One.mp3");
        MirrorSongRecord b = upload("lib-1", AUDIO, "Two.mp3");

        assertThat(a.fileId()).isEqualTo("file-" + ContentHash.of(AUDIO).toHex());
        assertThat(b.fileId()).isEqualTo(a.fileId());
        assertThat(mirror.findFile(a.fileId()).orElseThrow().refCount()).isEqualTo(2);
        assertThat(a.title()).isEqualTo("One");
        assertThat(a.artist()).isEqualTo("Artist");
        assertThat(a.cached()).isTrue();
        assertThat(a.streamUrl()).isEqualTo("/api/songs/" + a.id() + "/stream");
        assertThat(cache.get(a.streamUrl())).isPresent();
        assertThat(cache.get(b.streamUrl())).isPresent();
    }

    @Test
    void shouldKeepSharedFileUntilLastLibraryIsDeleted() {
        MirrorSongRecord a = upload("lib-1", AUDIO, "a.mp3");
        MirrorSongRecord b = upload("lib-2", AUDIO, "b.mp3");

        CascadeResult first = mirror.deleteLibrary("lib-1");

        assertThat(first.deletedSongs()).isEqualTo(1);
        assertThat(first.deletedCacheEntries()).isZero();
        assertThat(mirror.findFile(a.fileId()).orElseThrow().refCount()).isEqualTo(1);
        assertThat(cache.get(b.streamUrl())).isPresent();

        CascadeResult last = mirror.deleteLibrary("lib-2");

        assertThat(last.deletedSongs()).isEqualTo(1);
        assertThat(last.deletedCacheEntries()).isEqualTo(1);
        assertThat(mirror.findFile(a.fileId())).isEmpty();
        assertThat(cache.get(b.streamUrl())).isEmpty();
    }

    @Test
    void shouldSweepEntriesLeftByDeletedSongsOfSharedFiles() {
        MirrorSongRecord a = upload("lib-1", AUDIO, "a.mp3");
        MirrorSongRecord b = upload("lib-2", AUDIO, "b.mp3");
        mirror.deleteLibrary("lib-1");

        assertThat(mirror.sweepOrphanedCacheEntries()).isEqualTo(1);
        assertThat(cache.get(a.streamUrl())).isEmpty();
        assertThat(cache.get(b.streamUrl())).isPresent();
        assertThat(mirror.sweepOrphanedCacheEntries()).isZero();
    }

    @Test
    void shouldEvictCacheOfLegacySongs() {
        ImportedSong legacy = new ImportedSong("song-legacy", "lib-1", "Old", null, null, "audio/mpeg",
                null, 0, null);
        MirrorSongRecord stored = mirror.importSong(legacy, AUDIO);
        assertThat(stored.fileId()).isNull();
        assertThat(stored.cached()).isTrue();

        CascadeResult result = mirror.deleteLibrary("lib-1");

        assertThat(result.errors()).isEmpty();
        assertThat(result.deletedSongs()).isEqualTo(1);
        assertThat(result.deletedCacheEntries()).isEqualTo(1);
        assertThat(cache.keys()).isEmpty();
    }

    @Test
    void shouldShareImportedFilesByHash() {
        String hash = ContentHash.of(AUDIO).toHex();
        mirror.importSong(new ImportedSong("s1", "lib-1", "One", null, null, "audio/flac", hash, 13, 200), AUDIO);
        MirrorSongRecord second = mirror.importSong(
                new ImportedSong("s2", "lib-2", "One", null, null, "audio/flac", hash, 13, 200), null);

        MirrorFileRecord file = mirror.findFile(second.fileId()).orElseThrow();
        assertThat(file.id()).isEqualTo(MirrorFileRecord.idFor(hash));
        assertThat(file.refCount()).isEqualTo(2);
        assertThat(file.durationSeconds()).isEqualTo(200);
        assertThat(second.cached()).isFalse();

        MirrorSongRecord offline = upload("lib-1", AUDIO, "again.flac");
        assertThat(offline.fileId()).isEqualTo(file.id());
        assertThat(mirror.findFile(file.id()).orElseThrow().refCount()).isEqualTo(3);
    }

    @Test
    void shouldNormaliseImportedHashToLowercase() {
        String hash = ContentHash.of(AUDIO).toHex();
        MirrorSongRecord imported = mirror.importSong(
                new ImportedSong("s1", "lib-1", "One", null, null, "audio/mpeg", hash.toUpperCase(), 13, 200), null);

        MirrorSongRecord offline = upload("lib-2", AUDIO, "One.mp3");

        assertThat(imported.fileId()).isEqualTo(MirrorFileRecord.idFor(hash));
        assertThat(offline.fileId()).isEqualTo(imported.fileId());
        assertThat(mirror.findFile(imported.fileId()).orElseThrow().refCount()).isEqualTo(2);
        assertThat(mirror.deleteLibrary("lib-1").errors()).isEmpty();
    }

    @Test
    void shouldRejectMalformedImportedHash() {
        ImportedSong wrongLength = new ImportedSong("s1", "lib-1", "One", null, null, "audio/mpeg",
                "a".repeat(64), 13, 200);
        ImportedSong notHex = new ImportedSong("s2", "lib-1", "Two", null, null, "audio/mpeg",
                "z".repeat(32), 13, 200);

        assertThatIllegalArgumentException().isThrownBy(() -> mirror.importSong(wrongLength, AUDIO));
        assertThatIllegalArgumentException().isThrownBy(() -> mirror.importSong(notHex, AUDIO));
        assertThat(mirror.findSong("s1")).isEmpty();
        assertThat(mirror.songs("lib-1")).isEmpty();
    }

    @Test
    void shouldRecordFailedEvictionAndContinue() {
        MirrorSongRecord ok = upload("lib-1", bytes("first"), "1.mp3");
        MirrorSongRecord broken = upload("lib-1", bytes("second"), "2.mp3");
        upload("lib-1", bytes("third"), "3.mp3");
        cache.failingDeletes.add(broken.streamUrl());

        CascadeResult result = mirror.deleteLibrary("lib-1");

        assertThat(result.success()).isTrue();
        assertThat(result.deletedSongs()).isEqualTo(2);
        assertThat(result.deletedCacheEntries()).isEqualTo(2);
        assertThat(result.errors()).extracting(CascadeError::itemId).containsExactly(broken.id());
        assertThat(result.containerDeleted()).isTrue();
        assertThat(mirror.findSong(ok.id())).isEmpty();
        assertThat(mirror.findFile(broken.fileId())).isEmpty();

        cache.failingDeletes.clear();
        assertThat(mirror.sweepOrphanedCacheEntries()).isEqualTo(1);
    }

    @Test
    void shouldReportProgressStagesInOrder() {
        upload("lib-1", bytes("first"), "1.mp3");
        upload("lib-1", bytes("second"), "2.mp3");

        List<DeleteProgress> progress = new ArrayList<>();
        mirror.deleteLibrary("lib-1", progress::add);

        assertThat(progress).extracting(p -> p.stage().label())
                .containsExactly("songs", "playlistSongs", "songs", "songs", "songs", "library", "complete");
        assertThat(progress).extracting(DeleteProgress::current).isSorted();
        assertThat(progress).allSatisfy(p -> assertThat(p.total()).isEqualTo(2));
    }

    @Test
    void shouldDetachSongsFromPlaylists() {
        MirrorSongRecord song = upload("lib-1", AUDIO, "a.mp3");
        mirror.ensurePlaylist("pl-1", "Mix");
        assertThat(mirror.addToPlaylist("pl-1", song.id())).isTrue();

        CascadeResult result = mirror.removeSongFromLibrary("lib-1", song.id()).orElseThrow();

        assertThat(result.deletedPlaylistSongs()).isEqualTo(1);
        assertThat(mirror.playlistSongIds("pl-1")).isEmpty();
        assertThat(mirror.removeSongFromLibrary("lib-1", song.id())).isEmpty();
    }

    @Test
    void shouldNotRemoveSongThroughAnotherLibrary() {
        MirrorSongRecord song = upload("lib-1", AUDIO, "a.mp3");

        assertThat(mirror.removeSongFromLibrary("lib-2", song.id())).isEmpty();
        assertThat(mirror.findSong(song.id())).isPresent();
    }

    @Test
    void shouldReportLibraryStats() {
        upload("lib-1", bytes("12345"), "a.mp3");
        mirror.importSong(new ImportedSong("s-remote", "lib-1", "Remote", null, null, "audio/mpeg",
                ContentHash.of(bytes("remote")).toHex(), 100, null), null);

        LibraryStats stats = mirror.libraryStats("lib-1").orElseThrow();

        assertThat(stats.songCount()).isEqualTo(2);
        assertThat(stats.cachedSongs()).isEqualTo(1);
        assertThat(stats.totalSize()).isEqualTo(105);
        assertThat(stats.cachedSize()).isEqualTo(5);
        assertThat(mirror.libraryStats("missing")).isEmpty();
    }

    @Test
    void shouldKeepLibraryUnderStrictPolicy() {
        mirror = open(CascadePolicy.STRICT);
        mirror.ensureLibrary("lib-3", "Strict");
        MirrorSongRecord broken = upload("lib-3", AUDIO, "a.mp3");
        cache.failingDeletes.add(broken.streamUrl());

        CascadeResult result = mirror.deleteLibrary("lib-3");

        assertThat(result.containerDeleted()).isFalse();
        assertThat(mirror.libraryStats("lib-3")).isPresent();
    }

    @Test
    void shouldRejectUploadToUnknownLibrary() {
        assertThat(mirror.uploadOffline("missing", AUDIO, "a.mp3", "audio/mpeg")).isEmpty();
        assertThatThrownBy(() -> mirror.uploadOffline("lib-1", new byte[0], "a.mp3", "audio/mpeg"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReopenExistingDatabase() {
        upload("lib-1", AUDIO, "a.mp3");

        OfflineLibraryService reopened = open(CascadePolicy.BEST_EFFORT);

        assertThat(reopened.songs("lib-1")).hasSize(1);
    }
}
