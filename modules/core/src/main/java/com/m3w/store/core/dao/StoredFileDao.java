package com.m3w.store.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Canonical file rows. Reference counts only move through single
 * {@code UPDATE ... SET ref_count = ref_count ± 1} statements; the row lock they
 * take is held until the surrounding transaction ends, so a follow-up
 * {@link #refCount} in the same transaction reads the value this writer produced.
 */
@RegisterConstructorMapper(StoredFileRecord.class)
@RegisterConstructorMapper(RefCountDrift.class)
public interface StoredFileDao {

    @SqlQuery("SELECT * FROM stored_file WHERE hash = :hash")
    Optional<StoredFileRecord> findByHash(@Bind("hash") String hash);

    @SqlQuery("SELECT * FROM stored_file WHERE id = :id")
    Optional<StoredFileRecord> findById(@Bind("id") String id);

    @SqlUpdate("INSERT INTO stored_file (id, hash, storage_key, size_bytes, mime_type, " +
            "duration_seconds, bitrate_kbps, sample_rate, channel_count, ref_count) " +
            "VALUES (:id, :hash, :storageKey, :sizeBytes, :mimeType, " +
            ":duration, :bitrate, :sampleRate, :channels, 1)")
    void insert(@Bind("id") String id,
                @Bind("hash") String hash,
                @Bind("storageKey") String storageKey,
                @Bind("sizeBytes") long sizeBytes,
                @Bind("mimeType") String mimeType,
                @Bind("duration") Integer durationSeconds,
                @Bind("bitrate") Integer bitrateKbps,
                @Bind("sampleRate") Integer sampleRate,
                @Bind("channels") Integer channelCount);

    @SqlUpdate("UPDATE stored_file SET ref_count = ref_count + 1 WHERE hash = :hash")
    int incrementByHash(@Bind("hash") String hash);

    @SqlUpdate("UPDATE stored_file SET ref_count = ref_count + 1 WHERE id = :id")
    int increment(@Bind("id") String id);

    @SqlUpdate("UPDATE stored_file SET ref_count = ref_count - 1 WHERE id = :id")
    int decrement(@Bind("id") String id);

    @SqlQuery("SELECT ref_count FROM stored_file WHERE id = :id")
    Optional<Integer> refCount(@Bind("id") String id);

    @SqlUpdate("UPDATE stored_file SET ref_count = :refCount WHERE id = :id")
    int setRefCount(@Bind("id") String id, @Bind("refCount") int refCount);

    /** Locks the row for the rest of the transaction and returns its count. */
    @SqlQuery("SELECT ref_count FROM stored_file WHERE id = :id FOR UPDATE")
    Optional<Integer> lockRefCount(@Bind("id") String id);

    /** Applies {@code delta} only if nobody moved the count since {@code expected} was read. */
    @SqlUpdate("UPDATE stored_file SET ref_count = ref_count + :delta WHERE id = :id AND ref_count = :expected")
    int adjustRefCount(@Bind("id") String id, @Bind("expected") int expected, @Bind("delta") int delta);

    @SqlUpdate("DELETE FROM stored_file WHERE id = :id AND ref_count = :expected")
    int deleteIfRefCount(@Bind("id") String id, @Bind("expected") int expected);

    @SqlUpdate("DELETE FROM stored_file WHERE id = :id")
    int delete(@Bind("id") String id);

    @SqlQuery("SELECT storage_key FROM stored_file")
    List<String> allStorageKeys();

    @SqlQuery("SELECT f.id AS file_id, f.hash, f.storage_key, f.ref_count, COUNT(s.id) AS live_songs " +
            "FROM stored_file f LEFT JOIN song s ON s.file_id = f.id " +
            "GROUP BY f.id, f.hash, f.storage_key, f.ref_count " +
            "HAVING f.ref_count <> COUNT(s.id) " +
            "ORDER BY f.id")
    List<RefCountDrift> findDrift();
}
