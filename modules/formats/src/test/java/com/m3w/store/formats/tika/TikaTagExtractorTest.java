package com.m3w.store.formats.tika;

import com.m3w.store.formats.AudioTags;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class TikaTagExtractorTest {

    private final TikaTagExtractor extractor = new TikaTagExtractor();

    @Test
    void shouldReturnEmptyTagsForUnrecognizedPayload() {
        AudioTags result = extractor.extract(new byte[256], null);

        assertThat(result.tags().title()).isNull();
        assertThat(result.physical().durationSeconds()).isNull();
    }

    @Test
    void shouldReadPhysicalPropertiesFromWav() {
        byte[] wav = pcmWav(8000, 1, 8000);

        AudioTags result = extractor.extract(wav, "audio/wav");

        assertThat(result.physical().sampleRate()).isEqualTo(8000);
        assertThat(result.physical().channelCount()).isEqualTo(1);
    }

    /** Builds a 16-bit PCM RIFF/WAVE file of silence. */
    private static byte[] pcmWav(int sampleRate, int channels, int frames) {
        int dataSize = frames * channels * 2;
        ByteBuffer header = ByteBuffer.allocate(44).order(ByteOrder.LITTLE_ENDIAN);
        header.put("RIFF".getBytes(StandardCharsets.US_ASCII));
        header.putInt(36 + dataSize);
        header.put("WAVE".getBytes(StandardCharsets.US_ASCII));
        header.put("fmt ".getBytes(StandardCharsets.US_ASCII));
        header.putInt(16);
        header.putShort((short) 1);
        header.putShort((short) channels);
        header.putInt(sampleRate);
        header.putInt(sampleRate * channels * 2);
        header.putShort((short) (channels * 2));
        header.putShort((short) 16);
        header.put("data".getBytes(StandardCharsets.US_ASCII));
        header.putInt(dataSize);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(header.array());
        out.writeBytes(new byte[dataSize]);
        return out.toByteArray();
    }
}
