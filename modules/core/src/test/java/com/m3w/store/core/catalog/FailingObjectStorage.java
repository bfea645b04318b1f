package com.m3w.store.core.catalog;

import com.m3w.store.core.storage.ObjectMetadata;
import com.m3w.store.core.storage.ObjectStorage;
import com.m3w.store.core.storage.StorageException;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delegating storage whose deletes fail for selected keys.
 */
class FailingObjectStorage implements ObjectStorage {

    private final ObjectStorage delegate;
    final Set<String> failingDeletes = ConcurrentHashMap.newKeySet();

    FailingObjectStorage(ObjectStorage delegate) {
        this.delegate = delegate;
    }

    @Override
    public Uni<Void> put(String key, byte[] data, String contentType) {
        return delegate.put(key, data, contentType);
    }

    @Override
    public Uni<byte[]> get(String key) {
        return delegate.get(key);
    }

    @Override
    public Uni<InputStream> streamRange(String key, long start, Long end) {
        return delegate.streamRange(key, start, end);
    }

    @Override
    public Uni<Boolean> delete(String key) {
        if (failingDeletes.contains(key)) {
            return Uni.createFrom().failure(new StorageException("delete object", key, new IOException("Connection reset")));
        }
        return delegate.delete(key);
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return delegate.exists(key);
    }

    @Override
    public Uni<ObjectMetadata> getMetadata(String key) {
        return delegate.getMetadata(key);
    }

    @Override
    public Multi<String> list(String prefix) {
        return delegate.list(prefix);
    }
}
