package com.m3w.store.mirror;

/**
 * @param totalSize  bytes of all files referenced by the library's songs, shared files counted per song
 * @param cachedSize bytes of audio held in the local cache for the library
 */
public record LibraryStats(int songCount, int cachedSongs, long totalSize, long cachedSize) {}
