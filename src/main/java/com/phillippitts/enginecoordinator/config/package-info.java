/**
 * Spring configuration: executors, typed properties and the coordination wiring.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code @ConfigurationProperties} classes validated at startup</li>
 *   <li>{@code config.coordination} - engine beans and their start/stop lifecycle</li>
 *   <li>{@code config.logging} - request MDC filter</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.enginecoordinator.config;
