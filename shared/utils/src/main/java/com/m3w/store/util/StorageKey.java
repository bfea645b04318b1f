package com.m3w.store.util;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Object-store key of an audio payload: {@code files/{hashHex}{ext}}.
 *
 * <p>The extension is only a hint for humans browsing the bucket; identity is
 * the hash, so two keys with the same hash always hold the same bytes.
 */
public record StorageKey(ContentHash hash, String extension) {

    public static final String PREFIX = "files/";

    static final String DEFAULT_EXTENSION = ".audio";

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
            Map.entry("audio/mpeg", ".mp3"),
            Map.entry("audio/mp3", ".mp3"),
            Map.entry("audio/flac", ".flac"),
            Map.entry("audio/x-flac", ".flac"),
            Map.entry("audio/wav", ".wav"),
            Map.entry("audio/wave", ".wav"),
            Map.entry("audio/x-wav", ".wav"),
            Map.entry("audio/ogg", ".ogg"),
            Map.entry("audio/m4a", ".m4a"),
            Map.entry("audio/mp4", ".m4a"),
            Map.entry("audio/x-m4a", ".m4a"),
            Map.entry("audio/aac", ".aac")
    );

    public StorageKey {
        Objects.requireNonNull(hash, "hash cannot be null");
        Objects.requireNonNull(extension, "extension cannot be null");
    }

    /**
     * Derives the key for a payload from its hash and declared mime type.
     */
    public static StorageKey of(ContentHash hash, String mimeType) {
        return new StorageKey(hash, extensionFor(mimeType));
    }

    /**
     * Maps an audio mime type to a file extension, {@code .audio} when unknown.
     * Parameters such as {@code ;codecs=...} are ignored.
     */
    public static String extensionFor(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return DEFAULT_EXTENSION;
        }
        String base = mimeType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return EXTENSIONS.getOrDefault(base, DEFAULT_EXTENSION);
    }

    /**
     * Parses a key previously produced by {@link #toString()}.
     */
    public static StorageKey parse(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        if (!key.startsWith(PREFIX) || key.length() < PREFIX.length() + 32) {
            throw new IllegalArgumentException("Not a file store key: " + key);
        }
        String hex = key.substring(PREFIX.length(), PREFIX.length() + 32);
        return new StorageKey(ContentHash.fromHex(hex), key.substring(PREFIX.length() + 32));
    }

    @Override
    public String toString() {
        return PREFIX + hash.toHex() + extension;
    }
}
