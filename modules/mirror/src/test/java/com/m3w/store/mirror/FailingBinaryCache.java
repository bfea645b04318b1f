package com.m3w.store.mirror;

import com.m3w.store.mirror.cache.BinaryCache;
import com.m3w.store.mirror.cache.CacheException;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delegating cache whose evictions fail for selected keys.
 */
class FailingBinaryCache implements BinaryCache {

    private final BinaryCache delegate;
    final Set<String> failingDeletes = ConcurrentHashMap.newKeySet();

    FailingBinaryCache(BinaryCache delegate) {
        this.delegate = delegate;
    }

    @Override
    public void put(String key, byte[] data) {
        delegate.put(key, data);
    }

    @Override
    public Optional<byte[]> get(String key) {
        return delegate.get(key);
    }

    @Override
    public boolean delete(String key) {
        if (failingDeletes.contains(key)) {
            throw new CacheException("Failed to evict " + key, new IOException("Device busy"));
        }
        return delegate.delete(key);
    }

    @Override
    public Set<String> keys() {
        return delegate.keys();
    }
}
