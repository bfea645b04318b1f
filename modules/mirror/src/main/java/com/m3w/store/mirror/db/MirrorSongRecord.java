package com.m3w.store.mirror.db;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

/**
 * A song row on the mirror.
 *
 * @param fileId    null for legacy songs cached before files were deduplicated
 * @param streamUrl cache key of the song's audio
 */
public record MirrorSongRecord(
        @ColumnName("id") String id,
        @ColumnName("library_id") String libraryId,
        @ColumnName("file_id") String fileId,
        @ColumnName("title") String title,
        @ColumnName("artist") String artist,
        @ColumnName("album") String album,
        @ColumnName("mime_type") String mimeType,
        @ColumnName("stream_url") String streamUrl,
        @ColumnName("is_cached") boolean cached,
        @ColumnName("cache_size") Long cacheSize,
        @ColumnName("last_cache_check") Long lastCacheCheck,
        @ColumnName("file_hash") String fileHash,
        @ColumnName("created_at") long createdAt,
        @ColumnName("updated_at") long updatedAt
) {

    public static String streamUrlFor(String songId) {
        return "/api/songs/" + songId + "/stream";
    }

    /** The cache key, falling back to the conventional URL for rows imported without one. */
    public String cacheKey() {
        return streamUrl != null ? streamUrl : streamUrlFor(id);
    }
}
