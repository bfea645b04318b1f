package com.m3w.store.dedup;

import com.m3w.store.types.PhysicalProperties;
import com.m3w.store.util.ContentHash;

import java.time.Instant;

/**
 * A canonical File row on one tier.
 *
 * @param storageKey where the payload lives on this tier's byte store
 * @param refCount   number of Song rows referencing this file
 */
public record FileEntry(String id,
                        ContentHash hash,
                        String storageKey,
                        long size,
                        String mimeType,
                        PhysicalProperties physical,
                        int refCount,
                        Instant createdAt) {}
