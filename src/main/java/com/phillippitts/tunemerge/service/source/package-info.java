/**
 * Source contracts and aggregation.
 *
 * <p>A source implements any subset of the capability interfaces. The
 * {@link com.phillippitts.tunemerge.service.source.SourceManager} dispatches on
 * {@link com.phillippitts.tunemerge.service.source.SourceCapabilities} tests rather than on
 * a class hierarchy.
 */
package com.phillippitts.tunemerge.service.source;
