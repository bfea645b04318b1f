package com.m3w.store.mirror.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Optional;

@RegisterConstructorMapper(MirrorLibraryRecord.class)
public interface MirrorLibraryDao {

    @SqlUpdate("INSERT OR IGNORE INTO library (id, name, created_at) VALUES (:id, :name, :now)")
    int insert(@Bind("id") String id, @Bind("name") String name, @Bind("now") long now);

    @SqlQuery("SELECT * FROM library WHERE id = :id")
    Optional<MirrorLibraryRecord> findById(@Bind("id") String id);

    @SqlUpdate("DELETE FROM library WHERE id = :id")
    int delete(@Bind("id") String id);
}
