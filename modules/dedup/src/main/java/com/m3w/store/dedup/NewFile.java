package com.m3w.store.dedup;

import com.m3w.store.types.PhysicalProperties;
import com.m3w.store.util.ContentHash;
import com.m3w.store.util.StorageKey;

/**
 * A file about to be inserted with {@code refCount = 1}. The tier assigns the id.
 */
public record NewFile(ContentHash hash,
                      StorageKey storageKey,
                      long size,
                      String mimeType,
                      PhysicalProperties physical) {}
