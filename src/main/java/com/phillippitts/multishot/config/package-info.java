/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.multishot.config.ThreadPoolConfig} - dispatch and engine-call
 *       executors with Log4j2 ThreadContext propagation</li>
 *   <li>{@link com.phillippitts.multishot.config.MetricsConfig} - shared performance tracker</li>
 * </ul>
 *
 * <p>Typed properties live in {@code config.properties}.
 */
package com.phillippitts.multishot.config;
