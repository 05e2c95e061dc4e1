/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.tunemerge.config.ThreadPoolConfig} - the {@code sourceExecutor}
 *       every source call runs on</li>
 *   <li>{@link com.phillippitts.tunemerge.config.ThreadPoolMetricsConfig} - Micrometer gauges
 *       for that pool</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - externalized settings bound from application.properties</li>
 *   <li>{@code config.source} - source manager and enrichment wiring</li>
 * </ul>
 */
package com.phillippitts.tunemerge.config;
