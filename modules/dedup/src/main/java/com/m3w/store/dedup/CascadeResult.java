package com.m3w.store.dedup;

import java.util.List;

/**
 * Aggregate outcome of a cascade delete. Per-song failures land in
 * {@code errors} without clearing {@code success}; only a failure outside the
 * per-song loop does.
 *
 * @param deletedSongs        songs whose row and file reference were fully released
 * @param deletedCacheEntries payloads (blobs or cache entries) actually removed
 * @param containerDeleted    whether the library or playlist row itself was removed
 */
public record CascadeResult(boolean success,
                            int deletedPlaylistSongs,
                            int deletedSongs,
                            int deletedCacheEntries,
                            boolean containerDeleted,
                            List<CascadeError> errors) {

    public CascadeResult {
        errors = List.copyOf(errors);
    }

    public boolean isPartial() {
        return success && !errors.isEmpty();
    }
}
