package com.m3w.store.mirror;

import com.m3w.store.dedup.CascadePolicy;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where the offline mirror keeps its database and cached audio.
 *
 * @param databaseFile   SQLite file, created on first open
 * @param cacheDirectory one file per cached stream URL
 */
public record MirrorSettings(Path databaseFile, Path cacheDirectory, CascadePolicy cascadePolicy) {

    public MirrorSettings {
        Objects.requireNonNull(databaseFile, "databaseFile");
        Objects.requireNonNull(cacheDirectory, "cacheDirectory");
        Objects.requireNonNull(cascadePolicy, "cascadePolicy");
    }

    /**
     * Conventional layout under one directory: {@code mirror.db} and {@code cache/}.
     */
    public static MirrorSettings under(Path home) {
        return new MirrorSettings(home.resolve("mirror.db"), home.resolve("cache"), CascadePolicy.BEST_EFFORT);
    }

    public MirrorSettings withCascadePolicy(CascadePolicy policy) {
        return new MirrorSettings(databaseFile, cacheDirectory, policy);
    }
}
