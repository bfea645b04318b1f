package com.m3w.store.core.storage;

/**
 * An object-store operation failed for a reason other than a missing object.
 * {@link #target()} names the key, prefix or bucket the operation addressed,
 * so audit and purge callers can report which blob was left behind.
 */
public class StorageException extends RuntimeException {

    private final String operation;
    private final String target;

    public StorageException(String operation, String target, Throwable cause) {
        super("Failed to " + operation + ": " + target, cause);
        this.operation = operation;
        this.target = target;
    }

    public String operation() {
        return operation;
    }

    public String target() {
        return target;
    }
}
