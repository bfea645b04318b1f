package com.m3w.store.core.dao;

import com.m3w.store.dedup.FileEntry;
import com.m3w.store.types.PhysicalProperties;
import com.m3w.store.util.ContentHash;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record StoredFileRecord(
        @ColumnName("id") String id,
        @ColumnName("hash") String hash,
        @ColumnName("storage_key") String storageKey,
        @ColumnName("size_bytes") long sizeBytes,
        @ColumnName("mime_type") String mimeType,
        @ColumnName("duration_seconds") Integer durationSeconds,
        @ColumnName("bitrate_kbps") Integer bitrateKbps,
        @ColumnName("sample_rate") Integer sampleRate,
        @ColumnName("channel_count") Integer channelCount,
        @ColumnName("ref_count") int refCount,
        @ColumnName("created_at") Instant createdAt
) {

    public PhysicalProperties physical() {
        return new PhysicalProperties(durationSeconds, bitrateKbps, sampleRate, channelCount);
    }

    public FileEntry toEntry() {
        return new FileEntry(id, ContentHash.fromHex(hash), storageKey, sizeBytes, mimeType,
                physical(), refCount, createdAt);
    }
}
