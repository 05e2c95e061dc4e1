package com.phillippitts.tunemerge.service.source;

import com.phillippitts.tunemerge.domain.MetadataSearchQuery;
import com.phillippitts.tunemerge.domain.NormalizedRelease;

import java.util.List;

/**
 * Release search offered by metadata catalogs. Results are already normalized and each
 * carries at least one id of the reporting source.
 */
public interface ReleaseSearchCapability {

    /**
     * @param query text or structured title/artist query
     * @param limit maximum number of releases to return (positive)
     */
    List<NormalizedRelease> searchReleases(MetadataSearchQuery query, int limit);
}
