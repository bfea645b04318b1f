package com.m3w.store.dedup;

/**
 * Unit of work run inside {@link ReferenceTier#inTransaction}.
 */
@FunctionalInterface
public interface TierWork<T> {

    T execute(TierTransaction tx);
}
