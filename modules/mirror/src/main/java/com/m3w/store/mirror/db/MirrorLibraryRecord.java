package com.m3w.store.mirror.db;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record MirrorLibraryRecord(
        @ColumnName("id") String id,
        @ColumnName("name") String name,
        @ColumnName("created_at") long createdAt
) {}
