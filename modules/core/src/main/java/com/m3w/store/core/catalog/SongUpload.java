package com.m3w.store.core.catalog;

import com.m3w.store.core.dao.SongRecord;
import com.m3w.store.dedup.UploadResult;

/**
 * A song created from an upload, with the file it resolved to.
 */
public record SongUpload(SongRecord song, UploadResult upload) {}
