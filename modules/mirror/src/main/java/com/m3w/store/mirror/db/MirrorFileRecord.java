package com.m3w.store.mirror.db;

import com.m3w.store.dedup.FileEntry;
import com.m3w.store.types.PhysicalProperties;
import com.m3w.store.util.ContentHash;
import com.m3w.store.util.StorageKey;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record MirrorFileRecord(
        @ColumnName("id") String id,
        @ColumnName("hash") String hash,
        @ColumnName("size_bytes") long sizeBytes,
        @ColumnName("mime_type") String mimeType,
        @ColumnName("duration_seconds") Integer durationSeconds,
        @ColumnName("bitrate_kbps") Integer bitrateKbps,
        @ColumnName("sample_rate") Integer sampleRate,
        @ColumnName("channel_count") Integer channelCount,
        @ColumnName("ref_count") int refCount,
        @ColumnName("created_at") long createdAt
) {

    /** Mirror file ids are derived from the hash so resyncs converge on one row. */
    public static String idFor(String hexHash) {
        return "file-" + hexHash;
    }

    public FileEntry toEntry() {
        ContentHash contentHash = ContentHash.fromHex(hash);
        return new FileEntry(id, contentHash, StorageKey.of(contentHash, mimeType).toString(), sizeBytes, mimeType,
                new PhysicalProperties(durationSeconds, bitrateKbps, sampleRate, channelCount),
                refCount, Instant.ofEpochMilli(createdAt));
    }
}
