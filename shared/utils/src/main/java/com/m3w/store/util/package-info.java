/**
 * Shared utilities for all m3w file store modules.
 *
 * <p>Contains {@link com.m3w.store.util.ContentHash} (BLAKE3-128) and
 * {@link com.m3w.store.util.StorageKey}. No framework dependencies, pure Java
 * plus commons-codec.
 */
package com.m3w.store.util;
