package com.m3w.store.formats;

/**
 * Reads descriptive tags and physical properties from raw audio bytes.
 *
 * <p>Extraction is best effort: callers must be prepared for
 * {@link TagExtractionException} and for records with every field unset.
 */
public interface TagExtractor {

    /**
     * @param data     complete payload
     * @param mimeType declared content type, used as a detection hint (may be null)
     * @throws TagExtractionException when the payload cannot be parsed
     */
    AudioTags extract(byte[] data, String mimeType);
}
