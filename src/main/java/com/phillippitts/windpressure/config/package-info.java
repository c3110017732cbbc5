/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.windpressure.config.ThreadPoolConfig} - the bounded
 *       {@code correctionExecutor} that runs per-file tasks</li>
 *   <li>{@link com.phillippitts.windpressure.config.ThreadPoolMetricsConfig} - Micrometer registry
 *       fallback and pool gauges</li>
 * </ul>
 *
 * <p>Typed properties live in {@code config.properties}.
 */
package com.phillippitts.windpressure.config;
