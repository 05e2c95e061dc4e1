package com.phillippitts.tunemerge.service.source;

import java.util.ArrayList;
import java.util.List;

/**
 * Runtime capability tests used to dispatch over a heterogeneous set of sources.
 *
 * <p>All predicates are pure and null-safe: a null source supports nothing.
 */
public final class SourceCapabilities {

    private SourceCapabilities() {
        // Utility class - prevent instantiation
    }

    public static boolean hasSearchCapability(Object source) {
        return source instanceof SearchCapability;
    }

    /**
     * Requires both listing and track resolution. A source offering only one half is not
     * playlist-capable.
     */
    public static boolean hasPlaylistCapability(Object source) {
        return source instanceof PlaylistListingCapability
                && source instanceof PlaylistTracksCapability;
    }

    public static boolean hasStreamCapability(Object source) {
        return source instanceof StreamCapability;
    }

    public static boolean hasAlbumCapability(Object source) {
        return source instanceof AlbumCapability;
    }

    public static boolean hasReleaseSearchCapability(Object source) {
        return source instanceof ReleaseSearchCapability;
    }

    /**
     * Short labels of every capability the source offers, in a fixed order. Used for health
     * details and startup logging.
     */
    public static List<String> describe(Object source) {
        List<String> caps = new ArrayList<>(5);
        if (hasSearchCapability(source)) {
            caps.add("search");
        }
        if (hasPlaylistCapability(source)) {
            caps.add("playlists");
        }
        if (hasStreamCapability(source)) {
            caps.add("streaming");
        }
        if (hasAlbumCapability(source)) {
            caps.add("album-tracks");
        }
        if (hasReleaseSearchCapability(source)) {
            caps.add("release-search");
        }
        return List.copyOf(caps);
    }
}
