package com.m3w.store.formats.tika;

import com.m3w.store.formats.AudioTags;
import com.m3w.store.formats.TagExtractionException;
import com.m3w.store.formats.TagExtractor;
import com.m3w.store.types.PhysicalProperties;
import com.m3w.store.types.SongTags;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.metadata.XMPDM;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.BodyContentHandler;
import org.jboss.logging.Logger;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tag extractor backed by Apache Tika's audio/video parsers (MP3, MP4/M4A,
 * FLAC, Ogg, WAV).
 *
 * <p>Durations are reported in seconds and rounded; when the parser does not
 * report a bitrate it is derived from payload size and duration.
 */
@ApplicationScoped
public class TikaTagExtractor implements TagExtractor {

    private static final Logger log = Logger.getLogger(TikaTagExtractor.class);

    private static final Pattern LEADING_INT = Pattern.compile("^\\s*(\\d+)");

    private final Parser parser = new AutoDetectParser();

    @Override
    public AudioTags extract(byte[] data, String mimeType) {
        Metadata metadata = new Metadata();
        if (mimeType != null) {
            metadata.set(Metadata.CONTENT_TYPE, mimeType);
        }

        try (InputStream stream = new ByteArrayInputStream(data)) {
            parser.parse(stream, new BodyContentHandler(-1), metadata, new ParseContext());
        } catch (Exception e) {
            throw new TagExtractionException("Failed to parse audio metadata", e);
        }

        SongTags tags = new SongTags(
                text(metadata.get(TikaCoreProperties.TITLE)),
                text(metadata.get(XMPDM.ARTIST)),
                text(metadata.get(XMPDM.ALBUM)),
                text(metadata.get(XMPDM.ALBUM_ARTIST)),
                leadingInt(metadata.get(XMPDM.RELEASE_DATE)),
                text(metadata.get(XMPDM.GENRE)),
                leadingInt(metadata.get(XMPDM.TRACK_NUMBER)),
                leadingInt(metadata.get(XMPDM.DISC_NUMBER)),
                text(metadata.get(XMPDM.COMPOSER)));

        Integer duration = roundedSeconds(metadata.get(XMPDM.DURATION));
        Integer bitrate = leadingInt(metadata.get("bitrate"));
        if (bitrate != null && bitrate > 10_000) {
            bitrate = Math.round(bitrate / 1000f);
        }
        if (bitrate == null && duration != null && duration > 0) {
            bitrate = (int) Math.round(data.length * 8.0 / duration / 1000.0);
        }
        PhysicalProperties physical = new PhysicalProperties(
                duration,
                bitrate,
                leadingInt(metadata.get(XMPDM.AUDIO_SAMPLE_RATE)),
                channels(metadata));

        log.debugf("Extracted tags: type=%s title=%s duration=%s",
                metadata.get(Metadata.CONTENT_TYPE), tags.title(), duration);
        return new AudioTags(tags, physical);
    }

    private static Integer channels(Metadata metadata) {
        Integer count = leadingInt(metadata.get("channels"));
        if (count != null) {
            return count;
        }
        String type = metadata.get(XMPDM.AUDIO_CHANNEL_TYPE);
        if (type == null) {
            return null;
        }
        return switch (type.toLowerCase()) {
            case "mono" -> 1;
            case "stereo" -> 2;
            case "5.1" -> 6;
            case "7.1" -> 8;
            default -> leadingInt(type);
        };
    }

    private static Integer roundedSeconds(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return (int) Math.round(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Integer leadingInt(String value) {
        if (value == null) {
            return null;
        }
        Matcher m = LEADING_INT.matcher(value);
        if (!m.find()) {
            return null;
        }
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String text(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
