package com.m3w.store.types;

/**
 * Descriptive tags suggested for a song. Every field is optional.
 */
public record SongTags(String title,
                       String artist,
                       String album,
                       String albumArtist,
                       Integer year,
                       String genre,
                       Integer trackNumber,
                       Integer discNumber,
                       String composer) {

    public static final SongTags EMPTY = new SongTags(null, null, null, null, null, null, null, null, null);

    public static SongTags titled(String title, String artist) {
        return new SongTags(title, artist, null, null, null, null, null, null, null);
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    /**
     * Fills a missing title from {@code fallback}, and the artist too when this
     * record has none. Other fields are kept as they are.
     */
    public SongTags withFallback(SongTags fallback) {
        if (hasTitle()) {
            return this;
        }
        String mergedArtist = artist != null && !artist.isBlank() ? artist : fallback.artist();
        return new SongTags(fallback.title(), mergedArtist, album, albumArtist, year, genre,
                trackNumber, discNumber, composer);
    }
}
