/**
 * Pure Java value types shared across the file store modules.
 *
 * <p>No framework dependencies. {@link com.m3w.store.types.SongTags} and
 * {@link com.m3w.store.types.PhysicalProperties} flow from tag extraction through
 * the uploader to the service facades of both tiers.
 */
package com.m3w.store.types;
