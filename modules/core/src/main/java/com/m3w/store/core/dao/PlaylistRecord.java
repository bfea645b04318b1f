package com.m3w.store.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record PlaylistRecord(
        @ColumnName("id") String id,
        @ColumnName("owner_id") String ownerId,
        @ColumnName("name") String name,
        @ColumnName("created_at") Instant createdAt
) {}
