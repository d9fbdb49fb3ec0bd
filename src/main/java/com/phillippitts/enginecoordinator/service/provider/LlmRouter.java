package com.phillippitts.enginecoordinator.service.provider;

import com.phillippitts.enginecoordinator.config.properties.RoutingProperties;
import com.phillippitts.enginecoordinator.domain.ProviderAttempt;
import com.phillippitts.enginecoordinator.exception.AllProvidersExhaustedException;
import com.phillippitts.enginecoordinator.exception.ProviderUnavailableException;
import com.phillippitts.enginecoordinator.exception.ProviderUnavailableExceptionBuilder;
import com.phillippitts.enginecoordinator.service.cost.UsageRecord;
import com.phillippitts.enginecoordinator.service.metrics.CoordinationMetricsPublisher;
import com.phillippitts.enginecoordinator.util.LogSanitizer;
import com.phillippitts.enginecoordinator.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Satisfies completion requests by walking the provider chain in priority order.
 *
 * <p>For each provider that accepts traffic the call is bounded by its per-call timeout (and by
 * the caller's remaining budget, when one is given). The first success wins and no further
 * provider is tried. Every call, successful or not, is appended to the cost ledger and reported
 * to the {@link HealthMonitor}.
 *
 * <p>A timeout caused only by the caller's shrinking budget is not held against the provider,
 * and neither is a call the provider executor refused to start.
 */
public class LlmRouter {

    private static final Logger LOG = LogManager.getLogger(LlmRouter.class);

    private final ProviderRegistry registry;
    private final HealthMonitor monitor;
    private final ExecutorService executor;
    private final RoutingProperties props;
    private final CoordinationMetricsPublisher metrics;
    private final Clock clock;

    public LlmRouter(ProviderRegistry registry,
                     HealthMonitor monitor,
                     ExecutorService executor,
                     RoutingProperties props,
                     CoordinationMetricsPublisher metrics,
                     Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = metrics == null ? CoordinationMetricsPublisher.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Routes a completion with no overall budget beyond each provider's own timeout.
     *
     * @throws AllProvidersExhaustedException if no provider produced a response
     */
    public RoutedCompletion routeCompletion(CompletionRequest request) {
        return routeCompletion(request, null);
    }

    /**
     * Routes a completion within an overall budget.
     *
     * @param request completion request
     * @param budget  total time available for the whole chain; null for unbounded
     * @return the first successful response in priority order
     * @throws AllProvidersExhaustedException if no provider produced a response in time
     */
    public RoutedCompletion routeCompletion(CompletionRequest request, Duration budget) {
        Objects.requireNonNull(request, "request");
        long deadline = budget == null ? Long.MAX_VALUE : TimeUtils.deadlineAfter(budget);
        List<ProviderAttempt> attempts = new ArrayList<>();

        for (ProviderDescriptor d : registry.listByPriority()) {
            if (!d.healthState().acceptsTraffic()) {
                attempts.add(new ProviderAttempt(d.id(), "skipped: unhealthy", 0));
                continue;
            }
            if (d.kind() == ProviderKind.CLOUD && cloudBudgetExhausted()) {
                attempts.add(new ProviderAttempt(d.id(), "skipped: daily cloud budget exhausted", 0));
                continue;
            }
            Duration timeout = d.perCallTimeout();
            boolean clipped = false;
            if (budget != null) {
                Duration left = TimeUtils.remaining(deadline);
                if (left.isZero()) {
                    attempts.add(new ProviderAttempt(d.id(), "skipped: routing budget exhausted", 0));
                    break;
                }
                if (left.compareTo(timeout) < 0) {
                    timeout = left;
                    clipped = true;
                }
            }

            long t0 = System.nanoTime();
            try {
                CompletionResponse response = invoke(d, request, timeout).withUsageFallback(request);
                long elapsed = System.nanoTime() - t0;
                long ms = TimeUtils.nanosToMillis(elapsed);
                double cost = d.costFor(response.tokensIn(), response.tokensOut());
                registry.recordUsage(UsageRecord.success(d.id(), d.kind(),
                        response.tokensIn(), response.tokensOut(), cost, ms, clock.instant()));
                monitor.recordSuccess(d.id());
                metrics.recordProviderCall(d.id(), elapsed, true);
                attempts.add(new ProviderAttempt(d.id(), null, ms));
                if (attempts.size() > 1) {
                    LOG.info("Completion served by fallback provider {} after {} attempt(s) (cost={})",
                            d.id(), attempts.size() - 1, cost);
                } else {
                    LOG.debug("Completion served by {} in {}ms", d.id(), ms);
                }
                return new RoutedCompletion(d.id(), d.kind(), response, cost, ms, attempts);
            } catch (TimeoutException te) {
                String reason = "timeout after " + timeout.toMillis() + "ms";
                recordFailure(d, reason, System.nanoTime() - t0, !clipped, attempts);
            } catch (ProviderUnavailableException pue) {
                recordFailure(d, pue.getMessage(), System.nanoTime() - t0, true, attempts);
            } catch (RejectedExecutionException ree) {
                // no call was made; neither the ledger nor the provider's health is touched
                attempts.add(new ProviderAttempt(d.id(), "rejected: provider executor saturated", 0));
                LOG.warn("Provider executor saturated; skipping {}", d.id());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                attempts.add(new ProviderAttempt(d.id(), "interrupted",
                        TimeUtils.nanosToMillis(System.nanoTime() - t0)));
                break;
            }
        }

        LOG.warn("All providers exhausted for prompt '{}': {} attempt(s)",
                LogSanitizer.preview(request.prompt()), attempts.size());
        throw new AllProvidersExhaustedException(attempts);
    }

    /**
     * True when a daily cloud budget is configured and today's cloud spend has reached it.
     *
     * <p>Checked before every cloud attempt. Calls already in flight when the budget is reached
     * still complete and are charged, so concurrent traffic can overshoot the budget by at most
     * the cost of those calls.
     */
    public boolean cloudBudgetExhausted() {
        double budget = props.getDailyCloudBudget();
        if (budget <= 0.0) {
            return false;
        }
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        return registry.ledger().cloudSpendOn(today) >= budget;
    }

    private CompletionResponse invoke(ProviderDescriptor d, CompletionRequest request, Duration timeout)
            throws TimeoutException, InterruptedException {
        Future<CompletionResponse> call = executor.submit(() -> d.provider().complete(request, timeout));
        try {
            return call.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException | InterruptedException e) {
            call.cancel(true);
            throw e;
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof ProviderUnavailableException pue) {
                throw pue;
            }
            throw ProviderUnavailableExceptionBuilder.create("Provider call failed")
                    .provider(d.id())
                    .cause(cause)
                    .metadata("error", cause == null ? null : cause.getClass().getSimpleName())
                    .build();
        }
    }

    private void recordFailure(ProviderDescriptor d, String reason, long elapsedNanos,
                               boolean countsAgainstProvider, List<ProviderAttempt> attempts) {
        long ms = TimeUtils.nanosToMillis(elapsedNanos);
        registry.recordUsage(UsageRecord.failure(d.id(), d.kind(), ms, clock.instant()));
        metrics.recordProviderCall(d.id(), elapsedNanos, false);
        if (countsAgainstProvider) {
            monitor.recordFailure(d.id(), reason);
        }
        attempts.add(new ProviderAttempt(d.id(), reason, ms));
        LOG.warn("Provider {} failed after {}ms: {}", d.id(), ms, reason);
    }
}
