package com.m3w.store.formats;

import com.m3w.store.types.SongTags;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guesses a title (and sometimes an artist) from an upload's filename.
 *
 * <p>Patterns are tried in order after the extension is stripped:
 * <ol>
 *   <li>{@code "01 - Title"}, {@code "01. Title"}, {@code "01_Title"}: title only</li>
 *   <li>{@code "Artist - Title"}</li>
 *   <li>anything else: the whole name is the title</li>
 * </ol>
 */
public final class FilenameTagParser {

    private static final Pattern EXTENSION = Pattern.compile("\\.[^.]+$");
    private static final Pattern TRACK_TITLE = Pattern.compile("^\\d+\\s*[-_.]\\s*(.+)$");
    private static final Pattern ARTIST_TITLE = Pattern.compile("^(.+?)\\s*-\\s*(.+)$");

    private FilenameTagParser() {
    }

    public static SongTags parse(String filename) {
        String name = stripExtension(filename == null ? "" : filename);

        Matcher track = TRACK_TITLE.matcher(name);
        if (track.matches()) {
            return SongTags.titled(track.group(1).trim(), null);
        }

        Matcher artistTitle = ARTIST_TITLE.matcher(name);
        if (artistTitle.matches()) {
            return SongTags.titled(artistTitle.group(2).trim(), artistTitle.group(1).trim());
        }

        return SongTags.titled(name, null);
    }

    static String stripExtension(String filename) {
        return EXTENSION.matcher(filename).replaceFirst("");
    }
}
