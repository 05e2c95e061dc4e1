package com.phillippitts.tunemerge.service.source;

import com.phillippitts.tunemerge.domain.AlbumTracks;
import com.phillippitts.tunemerge.domain.CanonicalAlbum;
import com.phillippitts.tunemerge.domain.CanonicalPlaylist;
import com.phillippitts.tunemerge.domain.CanonicalTrack;
import com.phillippitts.tunemerge.domain.SearchResult;
import com.phillippitts.tunemerge.domain.SourceId;
import com.phillippitts.tunemerge.domain.SourceType;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Aggregate access to every registered source.
 *
 * <p>The registry is fixed at construction. Aggregate results are ordered by source registration
 * order, never by completion order.
 *
 * <p>Operations that name a single source throw
 * {@link com.phillippitts.tunemerge.exception.CapabilityNotSupportedException} synchronously when
 * the source is not registered or lacks the capability. Otherwise the returned future completes
 * with the source's result or fails with its original exception.
 */
public interface SourceManager {

    Optional<Source> getSource(SourceType type);

    /** Primary sources in registration order. */
    List<Source> getAllSources();

    /** Metadata-only sources in registration order. */
    List<MetadataSource> getAllMetadataSources();

    /**
     * Lists playlists of every playlist-capable source, concatenated in registration order.
     * A failing source fails the returned future.
     */
    CompletableFuture<List<CanonicalPlaylist>> listAllPlaylists();

    CompletableFuture<List<CanonicalTrack>> getPlaylistTracks(SourceType type, String playlistId);

    CompletableFuture<String> getStreamUrl(SourceType type, String trackId);

    CompletableFuture<AlbumTracks> getAlbumTracks(SourceType type, String albumId);

    /**
     * Searches every search-capable source and every metadata source concurrently.
     *
     * <p>A failing source contributes nothing; the returned future never fails because of a
     * source. Tracks are concatenated without deduplication. Albums are deduplicated and merged
     * with metadata releases when at least one metadata source is registered, and returned as
     * reported otherwise.
     *
     * @param query free-text query
     */
    CompletableFuture<SearchResult> searchAll(String query);

    /**
     * Picks the id to play an album from: among the album's source ids whose source is
     * registered and album-capable, the one with the best stream priority.
     */
    Optional<SourceId> getPreferredSourceId(CanonicalAlbum album);
}
