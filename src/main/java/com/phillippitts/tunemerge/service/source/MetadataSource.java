package com.phillippitts.tunemerge.service.source;

/**
 * A catalog used only for release metadata (MusicBrainz, Discogs, ...). Never used for
 * streaming or playlists.
 */
public interface MetadataSource extends Source, ReleaseSearchCapability {
}
