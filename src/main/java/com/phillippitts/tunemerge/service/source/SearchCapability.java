package com.phillippitts.tunemerge.service.source;

import com.phillippitts.tunemerge.domain.SearchResult;

/**
 * Free-text catalog search returning tracks and albums.
 */
public interface SearchCapability {

    SearchResult search(String query);
}
