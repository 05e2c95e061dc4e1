package com.phillippitts.tunemerge.domain;

import java.util.Locale;

/**
 * Stable identifiers for every music catalog the aggregator knows about.
 *
 * <p>Each constant carries two fixed rankings (lower is better):
 * <ul>
 *   <li><b>streamPriority</b> - preference when several providers can play the same album.
 *       Metadata-only catalogs and local files rank 99.</li>
 *   <li><b>artworkRank</b> - preference when merged releases carry competing cover art.
 *       Discogs ranks first because its images are release scans.</li>
 * </ul>
 */
public enum SourceType {
    PANDORA("pandora", 5, 7),
    YTMUSIC("ytmusic", 1, 4),
    YOUTUBE("youtube", 2, 6),
    LOCAL("local", 99, 8),
    MUSICBRAINZ("musicbrainz", 99, 3),
    DISCOGS("discogs", 99, 0),
    DEEZER("deezer", 99, 2),
    BANDCAMP("bandcamp", 4, 1),
    SOUNDCLOUD("soundcloud", 3, 5);

    private final String key;
    private final int streamPriority;
    private final int artworkRank;

    SourceType(String key, int streamPriority, int artworkRank) {
        this.key = key;
        this.streamPriority = streamPriority;
        this.artworkRank = artworkRank;
    }

    public String key() {
        return key;
    }

    public int streamPriority() {
        return streamPriority;
    }

    public int artworkRank() {
        return artworkRank;
    }

    /**
     * Resolves a source by its key, ignoring case.
     *
     * @param key source key such as {@code "ytmusic"}
     * @return matching source type
     * @throws IllegalArgumentException if the key is null or unknown
     */
    public static SourceType fromKey(String key) {
        if (key != null) {
            String k = key.trim().toLowerCase(Locale.ROOT);
            for (SourceType t : values()) {
                if (t.key.equals(k)) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + key);
    }

    @Override
    public String toString() {
        return key;
    }
}
