package com.phillippitts.tunemerge.domain;

import java.util.Objects;

/**
 * Query sent to metadata catalogs: either free text or a structured title/artist pair.
 */
public record MetadataSearchQuery(Kind kind, String text, String title, String artist) {

    public enum Kind { TEXT, STRUCTURED }

    public MetadataSearchQuery {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.TEXT) {
            Objects.requireNonNull(text, "text");
        } else {
            Objects.requireNonNull(title, "title");
            Objects.requireNonNull(artist, "artist");
        }
    }

    public static MetadataSearchQuery text(String text) {
        return new MetadataSearchQuery(Kind.TEXT, text, null, null);
    }

    public static MetadataSearchQuery structured(String title, String artist) {
        return new MetadataSearchQuery(Kind.STRUCTURED, null, title, artist);
    }

    /** Human-readable form for logging. */
    public String describe() {
        return kind == Kind.TEXT ? text : title + " - " + artist;
    }
}
