package com.m3w.store.dedup;

/**
 * The parts of a Song row the cascade needs.
 *
 * @param fileId   referenced file, null for legacy rows that predate deduplication
 * @param cacheKey key of the song's entry in a local binary cache, null when the tier has none
 */
public record SongRef(String id, String libraryId, String fileId, String cacheKey) {

    public boolean isLegacy() {
        return fileId == null;
    }
}
