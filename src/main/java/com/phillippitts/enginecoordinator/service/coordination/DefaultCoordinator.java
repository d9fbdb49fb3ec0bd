package com.phillippitts.enginecoordinator.service.coordination;

import com.phillippitts.enginecoordinator.config.properties.CoordinationProperties;
import com.phillippitts.enginecoordinator.domain.CoordinationResult;
import com.phillippitts.enginecoordinator.domain.CoordinationStatus;
import com.phillippitts.enginecoordinator.domain.EngineError;
import com.phillippitts.enginecoordinator.domain.EngineOutcome;
import com.phillippitts.enginecoordinator.domain.EngineType;
import com.phillippitts.enginecoordinator.domain.ErrorKind;
import com.phillippitts.enginecoordinator.domain.Task;
import com.phillippitts.enginecoordinator.service.metrics.CoordinationMetricsPublisher;
import com.phillippitts.enginecoordinator.service.pool.WorkerPool;
import com.phillippitts.enginecoordinator.service.provider.ProviderRegistry;
import com.phillippitts.enginecoordinator.service.recall.RecallStore;
import com.phillippitts.enginecoordinator.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link Coordinator}.
 *
 * <p>Per task: plan the engine calls from the payload, submit them all to the dispatch executor,
 * then join them against the global deadline. Calls still running at the deadline are cancelled.
 * The final status is decided in this order:
 * <ol>
 *   <li>FAILED: a mandatory engine failed on its own (exhausted providers, crash, queue full,
 *       its own timeout).</li>
 *   <li>TIMED_OUT: the global deadline cut off at least one call.</li>
 *   <li>DEGRADED: an optional engine failed or some output is flagged partial.</li>
 *   <li>COMPLETED otherwise.</li>
 * </ol>
 * Completed sub-results are kept in every case.
 */
public class DefaultCoordinator implements Coordinator {

    private static final Logger LOG = LogManager.getLogger(DefaultCoordinator.class);

    static final String MDC_TASK_ID = "taskId";
    static final String MDC_TASK_KIND = "taskKind";

    /**
     * A clipped call that fails this close to the global deadline was cut by the deadline, not
     * by a fault of its own.
     */
    static final Duration DEADLINE_SLACK = Duration.ofMillis(25);

    private final DispatchPlanner planner;
    private final ExecutorService dispatchExecutor;
    private final ProviderRegistry registry;
    private final WorkerPool pool;
    private final RecallStore recall;
    private final CoordinationProperties props;
    private final CoordinationMetricsPublisher metrics;
    private final Clock clock;

    private final Map<String, TaskLifecycle> inFlight = new ConcurrentHashMap<>();
    private final CoordinationStats stats = new CoordinationStats();
    private volatile boolean accepting = true;

    DefaultCoordinator(DispatchPlanner planner,
                       ExecutorService dispatchExecutor,
                       ProviderRegistry registry,
                       WorkerPool pool,
                       RecallStore recall,
                       CoordinationProperties props,
                       CoordinationMetricsPublisher metrics,
                       Clock clock) {
        this.planner = Objects.requireNonNull(planner, "planner");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.recall = Objects.requireNonNull(recall, "recall");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = metrics == null ? CoordinationMetricsPublisher.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public CoordinationResult coordinate(Task task) {
        Objects.requireNonNull(task, "task");
        long t0 = System.nanoTime();
        ThreadContext.put(MDC_TASK_ID, task.id());
        ThreadContext.put(MDC_TASK_KIND, task.kind().name());
        TaskLifecycle lifecycle = new TaskLifecycle(task.id());
        CoordinationResult result;
        try {
            // register before checking the flag so a concurrent shutdown always waits for us
            inFlight.put(task.id(), lifecycle);
            if (!accepting) {
                result = CoordinationResult.rejected(task, ErrorKind.REJECTED,
                        "Coordinator is shutting down", TimeUtils.elapsedMillis(t0));
                LOG.warn("Rejected task {} ({}): coordinator is shutting down", task.id(), task.kind());
            } else {
                result = execute(task, lifecycle, t0);
            }
        } catch (RuntimeException e) {
            LOG.error("Coordination of task {} failed unexpectedly", task.id(), e);
            lifecycle.cancelPending();
            if (!lifecycle.isFinished()) {
                lifecycle.finish(CoordinationStatus.FAILED);
            }
            result = CoordinationResult.rejected(task, ErrorKind.ENGINE_CRASH,
                    "Unexpected coordination failure: " + Failures.describe(e), TimeUtils.elapsedMillis(t0));
        } finally {
            inFlight.remove(task.id());
            ThreadContext.remove(MDC_TASK_ID);
            ThreadContext.remove(MDC_TASK_KIND);
        }
        stats.record(result);
        metrics.recordTask(result, System.nanoTime() - t0);
        return result;
    }

    @Override
    public EngineStatusReport status() {
        return new EngineStatusReport(accepting, inFlight.size(), registry.statuses(), pool.state(),
                recall.size(), stats.snapshot(), clock.instant());
    }

    @Override
    public boolean shutdown(Duration drainTimeout) {
        accepting = false;
        LOG.info("Coordinator draining {} in-flight task(s) (timeout={}ms)", inFlight.size(), drainTimeout.toMillis());
        long deadline = TimeUtils.deadlineAfter(drainTimeout);
        while (!inFlight.isEmpty() && !TimeUtils.remaining(deadline).isZero()) {
            try {
                TimeUnit.MILLISECONDS.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (inFlight.isEmpty()) {
            LOG.info("Coordinator drained");
            return true;
        }
        int cancelled = 0;
        for (TaskLifecycle lifecycle : inFlight.values()) {
            cancelled += lifecycle.cancelPending();
        }
        LOG.warn("Drain timeout: cancelled {} engine call(s) across {} task(s)", cancelled, inFlight.size());
        return false;
    }

    @Override
    public boolean isAccepting() {
        return accepting;
    }

    /** Visible for tests. */
    int inFlightCount() {
        return inFlight.size();
    }

    private CoordinationResult execute(Task task, TaskLifecycle lifecycle, long t0) {
        Duration globalBudget = TimeUtils.min(task.deadline(), props.getTimeout());
        long globalDeadline = TimeUtils.deadlineAfter(globalBudget);

        lifecycle.advance(TaskPhase.DISPATCHING);
        DispatchPlan plan = task.payload().accept(planner);
        Map<EngineType, Future<CallResult>> futures = new EnumMap<>(EngineType.class);
        Map<EngineType, CallResult> results = new EnumMap<>(EngineType.class);
        for (EngineCall call : plan.calls()) {
            Future<CallResult> dependency = call.dependsOn() == null ? null : futures.get(call.dependsOn());
            try {
                Future<CallResult> f = dispatchExecutor.submit(() -> runCall(call, dependency, globalDeadline));
                lifecycle.track(f);
                futures.put(call.engine(), f);
            } catch (RejectedExecutionException e) {
                results.put(call.engine(), CallResult.failed(e, false, 0));
            }
        }
        LOG.debug("Dispatched {} engine call(s) for task {} with budget {}ms",
                futures.size(), task.id(), globalBudget.toMillis());

        lifecycle.advance(TaskPhase.AWAITING_ENGINES);
        boolean deadlineFired = false;
        for (EngineCall call : plan.calls()) {
            Future<CallResult> f = futures.get(call.engine());
            if (f == null) {
                continue;
            }
            try {
                Duration wait = TimeUtils.remaining(globalDeadline);
                results.put(call.engine(), f.get(wait.toNanos(), TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                deadlineFired = true;
                break;
            } catch (CancellationException e) {
                results.put(call.engine(), CallResult.failed(e, true, TimeUtils.elapsedMillis(t0)));
            } catch (ExecutionException e) {
                results.put(call.engine(), CallResult.failed(e.getCause(), false, TimeUtils.elapsedMillis(t0)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                deadlineFired = true;
                break;
            }
        }
        for (EngineCall call : plan.calls()) {
            if (!results.containsKey(call.engine())) {
                Future<CallResult> f = futures.get(call.engine());
                if (f != null) {
                    f.cancel(true);
                }
                results.put(call.engine(), CallResult.cut("Global deadline of " + globalBudget.toMillis()
                        + "ms reached", TimeUtils.elapsedMillis(t0)));
            }
        }

        lifecycle.advance(TaskPhase.MERGING);
        CoordinationResult result = merge(task, plan, results, deadlineFired, TimeUtils.elapsedMillis(t0));
        lifecycle.finish(result.status());
        logOutcome(result);
        return result;
    }

    private CallResult runCall(EngineCall call, Future<CallResult> dependency, long globalDeadline) {
        long start = System.nanoTime();
        EngineValue dependencyValue = null;
        if (dependency != null) {
            try {
                Duration wait = TimeUtils.remaining(globalDeadline);
                CallResult dep = dependency.get(wait.toNanos(), TimeUnit.NANOSECONDS);
                dependencyValue = dep.value() != null && dep.value().hasValue() ? dep.value() : null;
            } catch (TimeoutException | ExecutionException | CancellationException e) {
                LOG.debug("{} proceeds without {} output: {}", call.engine(), call.dependsOn(), e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CallResult.cut("Cancelled while waiting for " + call.dependsOn(), TimeUtils.elapsedMillis(start));
            }
        }

        Duration remaining = TimeUtils.remaining(globalDeadline);
        if (remaining.isZero()) {
            return CallResult.cut("No budget left to start", TimeUtils.elapsedMillis(start));
        }
        boolean clipped = remaining.compareTo(call.defaultTimeout()) < 0;
        Duration budget = clipped ? remaining : call.defaultTimeout();
        try {
            EngineValue value = call.invocation().invoke(budget, dependencyValue);
            return CallResult.of(value, TimeUtils.elapsedMillis(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CallResult.cut("Interrupted", TimeUtils.elapsedMillis(start));
        } catch (Exception e) {
            boolean cutByDeadline = clipped
                    && TimeUtils.remaining(globalDeadline).compareTo(DEADLINE_SLACK) <= 0;
            if (!cutByDeadline) {
                LOG.warn("{} call failed: {}", call.engine(), Failures.describe(e));
            }
            return CallResult.failed(e, cutByDeadline, TimeUtils.elapsedMillis(start));
        }
    }

    private CoordinationResult merge(Task task, DispatchPlan plan, Map<EngineType, CallResult> results,
                                     boolean deadlineFired, long totalMs) {
        Map<EngineType, EngineOutcome> outcomes = new EnumMap<>(EngineType.class);
        Map<String, Long> latency = new LinkedHashMap<>();
        List<EngineError> errors = new ArrayList<>();
        boolean mandatoryFailed = false;
        boolean timedOut = deadlineFired;
        boolean degraded = false;
        double cost = 0.0;
        String providerUsed = null;

        for (EngineCall call : plan.calls()) {
            EngineType engine = call.engine();
            CallResult r = results.get(engine);
            latency.put(engine.name().toLowerCase(Locale.ROOT), r.latencyMs());
            EngineValue v = r.value();
            if (v != null) {
                cost += v.cost();
                if (v.providerId() != null && (providerUsed == null || engine == EngineType.LLM)) {
                    providerUsed = v.providerId();
                }
                errors.addAll(v.issues());
            }
            if (v != null && v.hasValue()) {
                outcomes.put(engine, EngineOutcome.success(engine, v.value(), v.degraded(), r.latencyMs()));
                degraded |= v.degraded();
                continue;
            }
            outcomes.put(engine, EngineOutcome.failure(engine, r.latencyMs()));
            if (r.failure() != null) {
                ErrorKind kind = r.cutByDeadline() ? ErrorKind.COORDINATION_TIMEOUT : Failures.classify(r.failure());
                errors.add(new EngineError(engine, kind, Failures.describe(r.failure())));
            } else if (r.cutReason() != null) {
                errors.add(new EngineError(engine, ErrorKind.COORDINATION_TIMEOUT, r.cutReason()));
            }
            if (r.cutByDeadline()) {
                timedOut = true;
            } else if (call.mandatory()) {
                mandatoryFailed = true;
            } else {
                degraded = true;
            }
        }

        CoordinationStatus status;
        if (mandatoryFailed) {
            status = CoordinationStatus.FAILED;
        } else if (timedOut) {
            status = CoordinationStatus.TIMED_OUT;
        } else if (degraded) {
            status = CoordinationStatus.DEGRADED;
        } else {
            status = CoordinationStatus.COMPLETED;
        }
        return new CoordinationResult(task.id(), task.kind(), status, outcomes, providerUsed, cost,
                latency, totalMs, errors);
    }

    private static void logOutcome(CoordinationResult result) {
        switch (result.status()) {
            case COMPLETED -> LOG.info("Task {} ({}) completed in {}ms (provider={}, cost={})",
                    result.taskId(), result.kind(), result.totalLatencyMs(), result.providerUsed(), result.costIncurred());
            case DEGRADED -> LOG.warn("Task {} ({}) degraded in {}ms: {} issue(s)",
                    result.taskId(), result.kind(), result.totalLatencyMs(), result.errors().size());
            default -> LOG.error("Task {} ({}) {} after {}ms: {}",
                    result.taskId(), result.kind(), result.status(), result.totalLatencyMs(), result.errors());
        }
    }

    /**
     * Outcome of one engine call as seen by the join.
     *
     * @param value         what the engine produced; null when it raised or was cut off
     * @param failure       exception raised by the engine, if any
     * @param cutByDeadline the global deadline, not the engine, ended the call
     * @param cutReason     description when cut off without an exception
     * @param latencyMs     time spent in the call
     */
    record CallResult(EngineValue value, Throwable failure, boolean cutByDeadline, String cutReason, long latencyMs) {

        static CallResult of(EngineValue value, long latencyMs) {
            return new CallResult(value, null, false, null, latencyMs);
        }

        static CallResult failed(Throwable failure, boolean cutByDeadline, long latencyMs) {
            return new CallResult(null, failure, cutByDeadline, null, latencyMs);
        }

        static CallResult cut(String reason, long latencyMs) {
            return new CallResult(null, null, true, reason, latencyMs);
        }
    }
}
