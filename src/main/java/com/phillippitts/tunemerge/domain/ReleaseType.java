package com.phillippitts.tunemerge.domain;

import java.util.Locale;

/**
 * Kind of release as reported by metadata catalogs.
 */
public enum ReleaseType {
    ALBUM, EP, SINGLE, COMPILATION, SOUNDTRACK, LIVE, REMIX, OTHER;

    /**
     * Maps a provider's free-form type label, falling back to {@link #OTHER}.
     */
    public static ReleaseType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return OTHER;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
