package com.m3w.store.mirror.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class DirectoryBinaryCacheTest {

    @TempDir
    Path dir;

    private DirectoryBinaryCache cache;

    @BeforeEach
    void setUp() {
        cache = new DirectoryBinaryCache(dir.resolve("cache"));
    }

    @Test
    void shouldStoreEntryPerUrl() {
        cache.put("/api/songs/1/stream", new byte[]{1, 2, 3});
        cache.put("/api/songs/2/stream", new byte[]{4});

        assertThat(cache.get("/api/songs/1/stream")).hasValueSatisfying(b -> assertThat(b).containsExactly(1, 2, 3));
        assertThat(cache.keys()).containsExactly("/api/songs/1/stream", "/api/songs/2/stream");
        assertThat(cache.pathOf("/api/songs/1/stream").getFileName().toString()).doesNotContain("/");
    }

    @Test
    void shouldTreatEvictionOfMissingEntryAsNoOp() {
        cache.put("/api/songs/1/stream", new byte[]{1});

        assertThat(cache.delete("/api/songs/1/stream")).isTrue();
        assertThat(cache.delete("/api/songs/1/stream")).isFalse();
        assertThat(cache.get("/api/songs/1/stream")).isEmpty();
        assertThat(cache.keys()).isEmpty();
    }

    @Test
    void shouldKeepKeysWithSpecialCharacters() {
        String key = "/api/songs/a b+c?x=1/stream";
        cache.put(key, new byte[]{9});

        assertThat(cache.keys()).containsExactly(key);
    }
}
