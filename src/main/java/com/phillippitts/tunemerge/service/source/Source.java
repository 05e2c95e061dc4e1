package com.phillippitts.tunemerge.service.source;

import com.phillippitts.tunemerge.domain.SourceType;

/**
 * Identity shared by every music catalog integration.
 *
 * <p>A source implements any subset of the capability interfaces in this package
 * ({@link SearchCapability}, {@link PlaylistListingCapability}, {@link PlaylistTracksCapability},
 * {@link StreamCapability}, {@link AlbumCapability}, {@link ReleaseSearchCapability}). None is
 * required. Callers test for a capability with {@link SourceCapabilities} before dispatching.
 *
 * <p>Lifecycle: constructed once by the application, registered into a single
 * {@link SourceManager}, and never mutated by it.
 *
 * <p>Capability methods are blocking calls against the backing catalog. The manager runs them
 * on its source executor; implementations must be thread-safe and should signal failure with
 * {@link com.phillippitts.tunemerge.exception.SourceException}, usually built through
 * {@link com.phillippitts.tunemerge.exception.SourceExceptionBuilder} so the upstream status and
 * request details end up in the logged message.
 */
public interface Source {

    /**
     * Stable identifier used for lookup and for tagging the ids this source reports.
     */
    SourceType getType();

    /**
     * Display name, e.g. "YouTube Music".
     */
    String getName();
}
