/**
 * Model providers and the machinery that routes completions across them.
 *
 * <p>{@link com.phillippitts.enginecoordinator.service.provider.ProviderRegistry} holds the
 * providers in priority order, {@link com.phillippitts.enginecoordinator.service.provider.HealthMonitor}
 * moves them between HEALTHY, DEGRADED and UNHEALTHY, and
 * {@link com.phillippitts.enginecoordinator.service.provider.LlmRouter} walks the chain until one
 * answers. Adapters for concrete endpoints live in {@code adapter}.
 *
 * @since 1.0
 */
package com.phillippitts.enginecoordinator.service.provider;
