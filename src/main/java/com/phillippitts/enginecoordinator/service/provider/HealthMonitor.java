package com.phillippitts.enginecoordinator.service.provider;

import com.phillippitts.enginecoordinator.config.properties.HealthProperties;
import com.phillippitts.enginecoordinator.service.provider.event.ProviderStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks provider health through passive failure counting and active recovery probes.
 *
 * <p>Detection model:
 * <ul>
 *   <li>The router reports every call outcome via {@link #recordSuccess} and {@link #recordFailure}.</li>
 *   <li>K consecutive failures mark a provider DEGRADED (still routed), M mark it UNHEALTHY
 *       (skipped by the router).</li>
 *   <li>A background probe loop calls unhealthy providers once per probe interval; N consecutive
 *       successful probes restore HEALTHY.</li>
 * </ul>
 *
 * <p>All transitions of one provider happen under that provider's lock, so they are linearizable.
 * Probing runs on its own scheduler and executor and never blocks request routing.
 */
public class HealthMonitor {

    private static final Logger LOG = LogManager.getLogger(HealthMonitor.class);

    private final ProviderRegistry registry;
    private final HealthProperties props;
    private final ApplicationEventPublisher publisher;
    private final ExecutorService probeExecutor;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private volatile ScheduledFuture<?> probeLoop;

    public HealthMonitor(ProviderRegistry registry,
                         HealthProperties props,
                         ApplicationEventPublisher publisher,
                         ExecutorService probeExecutor,
                         Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.probeExecutor = Objects.requireNonNull(probeExecutor, "probeExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (props.getFailureThresholdUnhealthy() < props.getFailureThresholdDegraded()) {
            throw new IllegalArgumentException("Unhealthy threshold ("
                    + props.getFailureThresholdUnhealthy() + ") must not be below degraded threshold ("
                    + props.getFailureThresholdDegraded() + ")");
        }
    }

    /**
     * Starts the recovery probe loop. Calling start twice is a no-op.
     */
    public synchronized void start(TaskScheduler scheduler) {
        if (probeLoop != null) {
            return;
        }
        Duration interval = props.getProbeInterval();
        probeLoop = scheduler.scheduleAtFixedRate(this::runProbeCycle, interval);
        LOG.info("Health monitor started: degradedAfter={}, unhealthyAfter={}, recoverAfter={} probes, probeInterval={}ms",
                props.getFailureThresholdDegraded(), props.getFailureThresholdUnhealthy(),
                props.getRecoveryProbeSuccesses(), interval.toMillis());
    }

    public synchronized void stop() {
        if (probeLoop != null) {
            probeLoop.cancel(true);
            probeLoop = null;
            LOG.info("Health monitor stopped");
        }
    }

    public boolean isRunning() {
        return probeLoop != null;
    }

    /**
     * Checks whether a provider may receive request traffic.
     */
    public boolean isAvailable(String providerId) {
        return registry.get(providerId).healthState().acceptsTraffic();
    }

    public HealthState state(String providerId) {
        return registry.get(providerId).healthState();
    }

    /**
     * A request succeeded: the failure streak resets and a degraded provider is healthy again.
     */
    public void recordSuccess(String providerId) {
        ProviderDescriptor d = registry.get(providerId);
        HealthState from;
        d.lock().lock();
        try {
            d.setConsecutiveFailures(0);
            from = d.healthState();
            if (from != HealthState.DEGRADED) {
                return;
            }
            d.setHealthState(HealthState.HEALTHY);
        } finally {
            d.lock().unlock();
        }
        publishTransition(d, from, HealthState.HEALTHY, "request succeeded");
    }

    /**
     * A request failed (timeout or error). Escalates the provider once the thresholds are hit.
     */
    public void recordFailure(String providerId, String reason) {
        ProviderDescriptor d = registry.get(providerId);
        HealthState from;
        HealthState to;
        d.lock().lock();
        try {
            from = d.healthState();
            if (from == HealthState.UNHEALTHY) {
                return;
            }
            int failures = d.consecutiveFailures() + 1;
            d.setConsecutiveFailures(failures);
            to = from;
            if (failures >= props.getFailureThresholdUnhealthy()) {
                to = HealthState.UNHEALTHY;
                d.setConsecutiveProbeSuccesses(0);
                d.setNextProbeAt(clock.instant().plus(props.getProbeInterval()));
            } else if (failures >= props.getFailureThresholdDegraded()) {
                to = HealthState.DEGRADED;
            }
            if (to == from) {
                LOG.debug("Provider {} failure {} ({})", providerId, failures, reason);
                return;
            }
            d.setHealthState(to);
        } finally {
            d.lock().unlock();
        }
        publishTransition(d, from, to, reason);
    }

    /**
     * Probes every unhealthy provider whose probe is due. Overlapping cycles are skipped.
     */
    public void runProbeCycle() {
        if (!cycleLock.tryLock()) {
            LOG.debug("Probe cycle already in progress");
            return;
        }
        try {
            Instant now = clock.instant();
            for (ProviderDescriptor d : registry.listByPriority()) {
                if (d.healthState() != HealthState.UNHEALTHY) {
                    continue;
                }
                Instant due = d.nextProbeAt();
                if (due != null && now.isBefore(due)) {
                    continue;
                }
                Future<?> call;
                try {
                    call = probeExecutor.submit(() -> d.provider().probe(d.perCallTimeout()));
                } catch (RejectedExecutionException e) {
                    // state untouched; the provider is still due next cycle
                    LOG.warn("Probe executor saturated; deferring probe of {} to the next cycle", d.id());
                    return;
                }
                boolean ok = awaitProbe(d, call);
                if (Thread.currentThread().isInterrupted()) {
                    return;
                }
                recordProbeResult(d, ok);
            }
        } finally {
            cycleLock.unlock();
        }
    }

    @Scheduled(fixedRate = 60_000)
    void logHealthSummary() {
        StringBuilder sb = new StringBuilder("Provider states: ");
        for (ProviderDescriptor d : registry.listByPriority()) {
            sb.append(d.id()).append('=').append(d.healthState());
            if (d.consecutiveFailures() > 0) {
                sb.append("(failures=").append(d.consecutiveFailures()).append(')');
            }
            sb.append(' ');
        }
        LOG.info(sb.toString().trim());
    }

    private boolean awaitProbe(ProviderDescriptor d, Future<?> call) {
        Duration timeout = d.perCallTimeout();
        try {
            call.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            call.cancel(true);
            LOG.debug("Probe of {} timed out after {}ms", d.id(), timeout.toMillis());
            return false;
        } catch (ExecutionException e) {
            LOG.debug("Probe of {} failed: {}", d.id(), e.getCause() == null ? e : e.getCause().toString());
            return false;
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void recordProbeResult(ProviderDescriptor d, boolean ok) {
        boolean recovered = false;
        int streak;
        d.lock().lock();
        try {
            if (d.healthState() != HealthState.UNHEALTHY) {
                return;
            }
            Instant now = clock.instant();
            d.setLastProbeAt(now);
            d.setNextProbeAt(now.plus(props.getProbeInterval()));
            streak = ok ? d.consecutiveProbeSuccesses() + 1 : 0;
            d.setConsecutiveProbeSuccesses(streak);
            if (streak >= props.getRecoveryProbeSuccesses()) {
                d.setHealthState(HealthState.HEALTHY);
                d.setConsecutiveFailures(0);
                d.setConsecutiveProbeSuccesses(0);
                recovered = true;
            }
        } finally {
            d.lock().unlock();
        }
        if (recovered) {
            publishTransition(d, HealthState.UNHEALTHY, HealthState.HEALTHY,
                    streak + " consecutive successful probes");
        } else {
            LOG.debug("Probe of {} {}; streak={}", d.id(), ok ? "succeeded" : "failed", streak);
        }
    }

    private void publishTransition(ProviderDescriptor d, HealthState from, HealthState to, String reason) {
        if (to == HealthState.UNHEALTHY) {
            LOG.error("Provider {} {} -> {} after {} consecutive failures ({})",
                    d.id(), from, to, d.consecutiveFailures(), reason);
        } else if (to == HealthState.DEGRADED) {
            LOG.warn("Provider {} {} -> {} after {} consecutive failures ({})",
                    d.id(), from, to, d.consecutiveFailures(), reason);
        } else {
            LOG.info("Provider {} {} -> {} ({})", d.id(), from, to, reason);
        }
        publisher.publishEvent(new ProviderStateChangedEvent(d.id(), from, to, clock.instant(), reason));
    }
}
