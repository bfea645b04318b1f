package com.m3w.store.dedup;

import com.m3w.store.formats.AudioTags;
import com.m3w.store.formats.FilenameTagParser;
import com.m3w.store.formats.TagExtractor;
import com.m3w.store.types.SongTags;
import com.m3w.store.util.ContentHash;
import com.m3w.store.util.StorageKey;
import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves uploaded bytes to a canonical file, creating it or adding a
 * reference to an existing one.
 *
 * <p>Identical bytes never yield two files or two payload writes on the same
 * tier, whatever their filenames. A concurrent insert of the same hash is
 * retried as an increment and never reaches the caller. The payload is
 * written inside the transaction that creates its row; a failed write leaves
 * no row behind.
 */
public class DedupUploader {

    private static final Logger log = Logger.getLogger(DedupUploader.class);

    static final int MAX_ATTEMPTS = 3;

    private final ReferenceTier tier;
    private final TagExtractor tagExtractor;

    public DedupUploader(ReferenceTier tier, TagExtractor tagExtractor) {
        this.tier = Objects.requireNonNull(tier, "tier");
        this.tagExtractor = Objects.requireNonNull(tagExtractor, "tagExtractor");
    }

    /**
     * Uploads a payload. The returned file already counts the reference of the
     * song the caller is about to create.
     */
    public UploadResult upload(byte[] data, String filename, String mimeType) {
        Objects.requireNonNull(data, "data");
        ContentHash hash = ContentHash.of(data);
        AudioTags extracted = extractTags(data, filename, mimeType);

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Optional<FileEntry> existing = tier.inTransaction(tx -> tx.incrementRef(hash));
            if (existing.isPresent()) {
                FileEntry file = existing.get();
                log.infof("Dedup hit on %s: hash=%s file=%s refCount=%d",
                        tier.name(), hash, file.id(), file.refCount());
                return new UploadResult(file.id(), hash, false, file.physical(), extracted.tags());
            }

            StorageKey key = StorageKey.of(hash, mimeType);
            NewFile candidate = new NewFile(hash, key, data.length, mimeType, extracted.physical());
            try {
                // The row is written first and stays locked until commit, so a purge of an
                // earlier file with this hash cannot remove the payload written here.
                FileEntry created = tier.inTransaction(tx -> {
                    FileEntry file = tx.create(candidate);
                    tier.storePayload(key, data, mimeType);
                    return file;
                });
                log.infof("New file on %s: hash=%s file=%s key=%s size=%d",
                        tier.name(), hash, created.id(), key, data.length);
                return new UploadResult(created.id(), hash, true, created.physical(), extracted.tags());
            } catch (DedupConflictException e) {
                log.debugf("Concurrent insert of hash=%s on %s (attempt %d), retrying as increment",
                        hash, tier.name(), attempt);
            }
        }
        throw new IllegalStateException("Could not resolve file for hash " + hash
                + " after " + MAX_ATTEMPTS + " attempts");
    }

    /**
     * Never throws: a failed extraction falls back to the filename heuristic.
     */
    AudioTags extractTags(byte[] data, String filename, String mimeType) {
        SongTags fromName = FilenameTagParser.parse(filename);
        try {
            AudioTags extracted = tagExtractor.extract(data, mimeType);
            return new AudioTags(extracted.tags().withFallback(fromName), extracted.physical());
        } catch (RuntimeException e) {
            log.warnf("Tag extraction failed for '%s', using filename: %s", filename, e.getMessage());
            return new AudioTags(fromName, AudioTags.NONE.physical());
        }
    }
}
