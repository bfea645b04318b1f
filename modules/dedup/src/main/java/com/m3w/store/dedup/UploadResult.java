package com.m3w.store.dedup;

import com.m3w.store.types.PhysicalProperties;
import com.m3w.store.types.SongTags;
import com.m3w.store.util.ContentHash;

/**
 * Outcome of {@link DedupUploader#upload}.
 *
 * @param isNewFile     true when this call created the file and wrote its payload
 * @param suggestedTags tags for the song about to be created, never null
 */
public record UploadResult(String fileId,
                           ContentHash hash,
                           boolean isNewFile,
                           PhysicalProperties physicalProperties,
                           SongTags suggestedTags) {}
