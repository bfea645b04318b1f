package com.m3w.store.core.storage;

/**
 * Thrown when a read targets an object that does not exist.
 */
public class ObjectNotFoundException extends RuntimeException {

    private final String key;

    public ObjectNotFoundException(String key) {
        super("Object not found: " + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
