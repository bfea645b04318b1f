package com.m3w.store.core.storage;

import java.time.Instant;

public record ObjectMetadata(long size, String contentType, Instant lastModified) {}
