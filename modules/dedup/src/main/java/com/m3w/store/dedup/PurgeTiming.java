package com.m3w.store.dedup;

/**
 * When a tier removes the payload of a file whose count reached zero.
 */
public enum PurgeTiming {
    /**
     * Inside the song transaction, before the File row is deleted. A failed
     * purge rolls the song back.
     */
    IN_TRANSACTION,
    /**
     * After the song transaction commits, as a separate best-effort call.
     */
    AFTER_COMMIT
}
