package com.m3w.store.mirror.cache;

import java.util.Optional;
import java.util.Set;

/**
 * Local byte store of the offline mirror, keyed by the URL the player
 * requests (for audio, {@code /api/songs/{songId}/stream}).
 */
public interface BinaryCache {

    /**
     * Stores bytes under {@code key}, replacing any previous entry.
     *
     * @throws CacheException on I/O errors
     */
    void put(String key, byte[] data);

    Optional<byte[]> get(String key);

    /**
     * Removes an entry. Removing an absent key is not an error.
     *
     * @return false if there was nothing to remove
     * @throws CacheException on I/O errors other than absence
     */
    boolean delete(String key);

    Set<String> keys();
}
