package com.m3w.store.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(LibraryRecord.class)
public interface LibraryDao {

    @SqlUpdate("INSERT INTO library (id, owner_id, name, can_delete) VALUES (:id, :ownerId, :name, :canDelete)")
    void insert(@Bind("id") String id,
                @Bind("ownerId") String ownerId,
                @Bind("name") String name,
                @Bind("canDelete") boolean canDelete);

    @SqlQuery("SELECT * FROM library WHERE id = :id")
    Optional<LibraryRecord> findById(@Bind("id") String id);

    @SqlQuery("SELECT * FROM library WHERE owner_id = :ownerId ORDER BY created_at, id")
    List<LibraryRecord> findByOwner(@Bind("ownerId") String ownerId);

    @SqlQuery("SELECT COUNT(*) FROM song WHERE library_id = :id")
    int songCount(@Bind("id") String id);

    @SqlUpdate("DELETE FROM library WHERE id = :id")
    int delete(@Bind("id") String id);
}
