package com.m3w.store.mirror;

/**
 * A song as fetched from the server during a full resync.
 *
 * @param fileHash hex content hash of the song's file, null for songs predating
 *                 deduplication
 */
public record ImportedSong(String id,
                           String libraryId,
                           String title,
                           String artist,
                           String album,
                           String mimeType,
                           String fileHash,
                           long fileSize,
                           Integer durationSeconds) {}
