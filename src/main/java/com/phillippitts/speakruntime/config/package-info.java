/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.speakruntime.config.RuntimeConfig} - wires the resource registry,
 *       memory monitor and lifecycle coordinator</li>
 *   <li>{@link com.phillippitts.speakruntime.config.ThreadPoolConfig} - lifecycle executor and
 *       the scheduler behind memory sampling</li>
 *   <li>{@link com.phillippitts.speakruntime.config.RuntimeMetricsConfig} - Micrometer gauges and
 *       the periodic runtime summary</li>
 * </ul>
 *
 * <p>Typed {@code runtime.*} and {@code threadpool.*} properties live in {@code config.properties}.
 *
 * @since 1.0
 */
package com.phillippitts.speakruntime.config;
