/**
 * Provider-independent music records.
 *
 * <p>Canonical tracks, albums and playlists are what callers see. {@link
 * com.phillippitts.tunemerge.domain.NormalizedRelease} is the shape the release matcher works on;
 * every catalog normalizes its albums into it before merging.
 *
 * <p>All types are immutable records. Collection components are copied on construction.
 */
package com.phillippitts.tunemerge.domain;
