package com.m3w.store.core.storage;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import java.io.InputStream;

/**
 * Narrow object-store abstraction for audio payloads.
 *
 * <p>Keys are opaque strings; the file store uses {@code files/{hash}{ext}}.
 * Deletion is idempotent: removing an absent key reports {@code false}
 * instead of failing.
 */
public interface ObjectStorage {

    /**
     * Writes an object, replacing any existing object under the same key.
     *
     * @param contentType optional (may be null)
     * @throws StorageException on I/O errors
     */
    Uni<Void> put(String key, byte[] data, String contentType);

    /**
     * Reads a whole object.
     *
     * @throws ObjectNotFoundException if the key does not exist
     * @throws StorageException on I/O errors
     */
    Uni<byte[]> get(String key);

    /**
     * Opens a byte range of an object. The caller closes the stream.
     *
     * @param start first byte, inclusive
     * @param end   last byte, inclusive; null reads to the end
     * @throws ObjectNotFoundException if the key does not exist
     */
    Uni<InputStream> streamRange(String key, long start, Long end);

    /**
     * Deletes an object.
     *
     * @return false if the key was already absent
     * @throws StorageException on I/O errors other than absence
     */
    Uni<Boolean> delete(String key);

    Uni<Boolean> exists(String key);

    /**
     * @throws ObjectNotFoundException if the key does not exist
     */
    Uni<ObjectMetadata> getMetadata(String key);

    /**
     * Lists keys starting with {@code prefix}.
     */
    Multi<String> list(String prefix);
}
