package com.m3w.store.formats;

import com.m3w.store.types.PhysicalProperties;
import com.m3w.store.types.SongTags;

/**
 * What a {@link TagExtractor} recovered from a payload.
 */
public record AudioTags(SongTags tags, PhysicalProperties physical) {

    public static final AudioTags NONE = new AudioTags(SongTags.EMPTY, PhysicalProperties.UNKNOWN);
}
