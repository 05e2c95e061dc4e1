/**
 * Service layer.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.source} - capability contracts and the aggregating source manager</li>
 *   <li>{@code service.match} - fingerprints, similarity scoring and release merging</li>
 *   <li>{@code service.enrich} - metadata enrichment of single albums</li>
 *   <li>{@code service.events}, {@code service.metrics}, {@code service.health} - observability</li>
 * </ul>
 *
 * <p>Services use constructor injection and throw unchecked domain exceptions from
 * {@link com.phillippitts.tunemerge.exception}.
 */
package com.phillippitts.tunemerge.service;
