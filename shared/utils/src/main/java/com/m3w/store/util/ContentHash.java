package com.m3w.store.util;

import org.apache.commons.codec.digest.Blake3;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * BLAKE3-128 content hash (16 bytes) identifying an audio payload.
 * Immutable value object that can be used as a map key.
 *
 * <p>The lowercase hex form is what gets persisted in the {@code hash}
 * column on both the server and the mirror, and what storage keys are
 * derived from.
 */
public record ContentHash(byte[] bytes) {
    private static final int HASH_LENGTH = 16; // 128 bits
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public ContentHash {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException(
                "Content hash must be 16 bytes (BLAKE3-128), got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Hashes a complete payload held in memory.
     */
    public static ContentHash of(byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        return new ContentHash(Blake3.initHash().update(data).doFinalize(HASH_LENGTH));
    }

    /**
     * Hashes a stream to its end. The stream is not closed.
     */
    public static ContentHash of(InputStream in) {
        Objects.requireNonNull(in, "input stream cannot be null");
        Blake3 hasher = Blake3.initHash();
        byte[] chunk = new byte[8192];
        try {
            int n;
            while ((n = in.read(chunk)) != -1) {
                hasher.update(chunk, 0, n);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to hash stream", e);
        }
        return new ContentHash(hasher.doFinalize(HASH_LENGTH));
    }

    /**
     * Creates ContentHash from hex string (32 characters).
     */
    public static ContentHash fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.length() != 32) {
            throw new IllegalArgumentException(
                "BLAKE3-128 hex string must be 32 characters, got: " + hex.length()
            );
        }
        try {
            return new ContentHash(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    /**
     * Returns lowercase hex representation (32 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentHash other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
