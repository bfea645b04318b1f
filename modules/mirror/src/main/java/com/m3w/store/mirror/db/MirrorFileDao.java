package com.m3w.store.mirror.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Optional;

@RegisterConstructorMapper(MirrorFileRecord.class)
public interface MirrorFileDao {

    @SqlQuery("SELECT * FROM file WHERE hash = :hash")
    Optional<MirrorFileRecord> findByHash(@Bind("hash") String hash);

    @SqlQuery("SELECT * FROM file WHERE id = :id")
    Optional<MirrorFileRecord> findById(@Bind("id") String id);

    @SqlUpdate("INSERT INTO file (id, hash, size_bytes, mime_type, duration_seconds, bitrate_kbps, " +
            "sample_rate, channel_count, ref_count, created_at) " +
            "VALUES (:id, :hash, :sizeBytes, :mimeType, :duration, :bitrate, :sampleRate, :channels, 1, :now)")
    void insert(@Bind("id") String id,
                @Bind("hash") String hash,
                @Bind("sizeBytes") long sizeBytes,
                @Bind("mimeType") String mimeType,
                @Bind("duration") Integer durationSeconds,
                @Bind("bitrate") Integer bitrateKbps,
                @Bind("sampleRate") Integer sampleRate,
                @Bind("channels") Integer channelCount,
                @Bind("now") long now);

    @SqlUpdate("UPDATE file SET ref_count = ref_count + 1 WHERE hash = :hash")
    int incrementByHash(@Bind("hash") String hash);

    @SqlUpdate("UPDATE file SET ref_count = ref_count + 1 WHERE id = :id")
    int increment(@Bind("id") String id);

    @SqlUpdate("UPDATE file SET ref_count = ref_count - 1 WHERE id = :id")
    int decrement(@Bind("id") String id);

    @SqlQuery("SELECT ref_count FROM file WHERE id = :id")
    Optional<Integer> refCount(@Bind("id") String id);

    @SqlUpdate("DELETE FROM file WHERE id = :id")
    int delete(@Bind("id") String id);
}
