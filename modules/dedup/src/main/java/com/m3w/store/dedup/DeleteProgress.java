package com.m3w.store.dedup;

/**
 * Progress snapshot. Within one call {@code current} and {@code total} never decrease.
 */
public record DeleteProgress(CascadeStage stage, int current, int total, String message) {}
