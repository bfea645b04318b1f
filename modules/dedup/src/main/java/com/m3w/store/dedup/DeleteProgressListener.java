package com.m3w.store.dedup;

@FunctionalInterface
public interface DeleteProgressListener {

    DeleteProgressListener NONE = progress -> { };

    void onProgress(DeleteProgress progress);
}
