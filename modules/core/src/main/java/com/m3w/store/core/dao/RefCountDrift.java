package com.m3w.store.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

/**
 * A file whose stored count disagrees with its live song rows.
 */
public record RefCountDrift(
        @ColumnName("file_id") String fileId,
        @ColumnName("hash") String hash,
        @ColumnName("storage_key") String storageKey,
        @ColumnName("ref_count") int refCount,
        @ColumnName("live_songs") long liveSongs
) {}
