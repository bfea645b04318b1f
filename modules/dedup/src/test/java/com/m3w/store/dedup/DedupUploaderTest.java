package com.m3w.store.dedup;

import com.m3w.store.formats.AudioTags;
import com.m3w.store.formats.TagExtractionException;
import com.m3w.store.formats.TagExtractor;
import com.m3w.store.types.PhysicalProperties;
import com.m3w.store.types.SongTags;
import com.m3w.store.util.ContentHash;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class DedupUploaderTest {

    private static final byte[] AUDIO = "ID3 pretend mp3 frames".getBytes(StandardCharsets.UTF_8);
    private static final PhysicalProperties PHYSICAL = new PhysicalProperties(215, 320, 44100, 2);

    private InMemoryTier tier;

    @BeforeEach
    void setUp() {
        tier = new InMemoryTier(PurgeTiming.IN_TRANSACTION);
    }

    private DedupUploader uploader(TagExtractor extractor) {
        return new DedupUploader(tier, extractor);
    }

    private static TagExtractor returning(SongTags tags) {
        return (data, mimeType) -> new AudioTags(tags, PHYSICAL);
    }

    @Test
    void shouldCreateFileOnFirstUpload() {
        UploadResult result = uploader(returning(SongTags.titled("Tagged", "Artist")))
                .upload(AUDIO, "whatever.mp3", "audio/mpeg");

        assertThat(result.isNewFile()).isTrue();
        assertThat(result.hash()).isEqualTo(ContentHash.of(AUDIO));
        assertThat(result.physicalProperties()).isEqualTo(PHYSICAL);
        assertThat(result.suggestedTags().title()).isEqualTo("Tagged");

        FileEntry file = tier.file(result.fileId());
        assertThat(file.refCount()).isEqualTo(1);
        assertThat(file.storageKey()).isEqualTo("files/" + result.hash().toHex() + ".mp3");
        assertThat(tier.payloads).containsKey(file.storageKey());
        assertThat(tier.payloadWrites).hasValue(1);
    }

    @Test
    void shouldReuseFileForIdenticalBytesRegardlessOfName() {
        DedupUploader uploader = uploader(returning(SongTags.EMPTY));

        UploadResult first = uploader.upload(AUDIO, "A.mp3", "audio/mpeg");
        UploadResult second = uploader.upload(AUDIO.clone(), "B.mp3", "audio/mpeg");

        assertThat(second.fileId()).isEqualTo(first.fileId());
        assertThat(second.isNewFile()).isFalse();
        assertThat(tier.file(first.fileId()).refCount()).isEqualTo(2);
        assertThat(tier.files).hasSize(1);
        assertThat(tier.payloadWrites).hasValue(1);
    }

    @Test
    void shouldResolveConcurrentInsertAsIncrement() {
        tier.competingInsertsBeforeCreate = 1;

        UploadResult result = uploader(returning(SongTags.EMPTY)).upload(AUDIO, "race.mp3", "audio/mpeg");

        assertThat(result.isNewFile()).isFalse();
        assertThat(result.fileId()).startsWith("winner-");
        assertThat(tier.files).hasSize(1);
        assertThat(tier.file(result.fileId()).refCount()).isEqualTo(2);
        assertThat(tier.payloadWrites).hasValue(0);
    }

    @Test
    void shouldWritePayloadOnlyOnceItsRowExists() {
        UploadResult result = uploader(returning(SongTags.EMPTY)).upload(AUDIO, "a.mp3", "audio/mpeg");

        assertThat(result.isNewFile()).isTrue();
        assertThat(tier.payloadWrites).hasValue(1);
        assertThat(tier.payloadWritesWithoutRow).hasValue(0);
    }

    @Test
    void shouldLeaveNoFileWhenPayloadWriteFails() {
        tier.failPayloadWrites = true;

        assertThatIllegalStateException()
                .isThrownBy(() -> uploader(returning(SongTags.EMPTY)).upload(AUDIO, "a.mp3", "audio/mpeg"))
                .withMessageContaining("disk full");
        assertThat(tier.files).isEmpty();
        assertThat(tier.payloads).isEmpty();
    }

    @Test
    void shouldFallBackToFilenameWhenExtractionThrows() {
        TagExtractor failing = (data, mimeType) -> {
            throw new TagExtractionException("corrupt header", null);
        };

        UploadResult result = uploader(failing).upload(AUDIO, "Massive Attack - Teardrop.mp3", "audio/mpeg");

        assertThat(result.isNewFile()).isTrue();
        assertThat(result.suggestedTags().title()).isEqualTo("Teardrop");
        assertThat(result.suggestedTags().artist()).isEqualTo("Massive Attack");
        assertThat(result.physicalProperties()).isEqualTo(PhysicalProperties.UNKNOWN);
    }

    @Test
    void shouldFillMissingTitleFromFilename() {
        SongTags untitled = new SongTags(null, null, "Mezzanine", null, 1998, null, 4, null, null);

        UploadResult result = uploader(returning(untitled)).upload(AUDIO, "04 - Teardrop.flac", "audio/flac");

        assertThat(result.suggestedTags().title()).isEqualTo("Teardrop");
        assertThat(result.suggestedTags().album()).isEqualTo("Mezzanine");
        assertThat(result.suggestedTags().trackNumber()).isEqualTo(4);
    }

    @Test
    void shouldUseGenericExtensionForUnknownMimeType() {
        UploadResult result = uploader(returning(SongTags.EMPTY)).upload(AUDIO, "x", "application/octet-stream");

        assertThat(tier.file(result.fileId()).storageKey()).endsWith(".audio");
    }

    @Test
    void shouldRejectNullPayload() {
        assertThatNullPointerException()
                .isThrownBy(() -> uploader(returning(SongTags.EMPTY)).upload(null, "x.mp3", "audio/mpeg"));
    }
}
