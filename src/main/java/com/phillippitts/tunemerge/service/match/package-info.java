/**
 * Release matching: normalization, fingerprints, Jaro-Winkler similarity and the stateful
 * matcher that merges releases reported by different catalogs.
 *
 * <p>A matcher is not thread-safe. Create one per aggregate operation through
 * {@link com.phillippitts.tunemerge.service.match.ReleaseMatcherFactory}.
 */
package com.phillippitts.tunemerge.service.match;
