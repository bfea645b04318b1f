package com.m3w.store.types;

/**
 * Physical properties of an audio payload. Every field is optional; extractors
 * fill what the container reports.
 *
 * @param durationSeconds rounded playback length
 * @param bitrateKbps     average bitrate in kilobits per second
 * @param sampleRate      samples per second
 * @param channelCount    number of audio channels
 */
public record PhysicalProperties(Integer durationSeconds,
                                 Integer bitrateKbps,
                                 Integer sampleRate,
                                 Integer channelCount) {

    public static final PhysicalProperties UNKNOWN = new PhysicalProperties(null, null, null, null);
}
