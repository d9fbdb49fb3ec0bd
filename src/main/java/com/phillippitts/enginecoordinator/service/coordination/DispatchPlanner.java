package com.phillippitts.enginecoordinator.service.coordination;

import com.phillippitts.enginecoordinator.config.properties.CoordinationProperties;
import com.phillippitts.enginecoordinator.config.properties.CreativeProperties;
import com.phillippitts.enginecoordinator.config.properties.RecallProperties;
import com.phillippitts.enginecoordinator.domain.CompletionPayload;
import com.phillippitts.enginecoordinator.domain.CompositePayload;
import com.phillippitts.enginecoordinator.domain.CreativePayload;
import com.phillippitts.enginecoordinator.domain.EngineError;
import com.phillippitts.enginecoordinator.domain.EngineType;
import com.phillippitts.enginecoordinator.domain.ErrorKind;
import com.phillippitts.enginecoordinator.domain.ParallelPayload;
import com.phillippitts.enginecoordinator.domain.RecallPayload;
import com.phillippitts.enginecoordinator.domain.TaskPayload;
import com.phillippitts.enginecoordinator.exception.QueueFullException;
import com.phillippitts.enginecoordinator.service.creative.CreativeGenerator;
import com.phillippitts.enginecoordinator.service.creative.CreativeResult;
import com.phillippitts.enginecoordinator.service.pool.TaskHandle;
import com.phillippitts.enginecoordinator.service.pool.WorkerPool;
import com.phillippitts.enginecoordinator.service.provider.CompletionRequest;
import com.phillippitts.enginecoordinator.service.provider.LlmRouter;
import com.phillippitts.enginecoordinator.service.provider.RoutedCompletion;
import com.phillippitts.enginecoordinator.service.recall.RecallQuery;
import com.phillippitts.enginecoordinator.service.recall.RecallResult;
import com.phillippitts.enginecoordinator.service.recall.RecallStore;
import com.phillippitts.enginecoordinator.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Turns a task payload into the engine calls that satisfy it.
 *
 * <table>
 *   <caption>Engines per task kind</caption>
 *   <tr><td>COMPLETION</td><td>LLM (mandatory)</td></tr>
 *   <tr><td>RECALL</td><td>RECALL (mandatory)</td></tr>
 *   <tr><td>PARALLEL</td><td>WORKER_POOL (mandatory), one routed completion per prompt</td></tr>
 *   <tr><td>CREATIVE</td><td>CREATIVE (mandatory)</td></tr>
 *   <tr><td>COMPOSITE</td><td>RECALL, then LLM (mandatory) with the hits as context;
 *       CREATIVE and WORKER_POOL optional</td></tr>
 * </table>
 */
public class DispatchPlanner implements TaskPayload.Visitor<DispatchPlan> {

    private static final Logger LOG = LogManager.getLogger(DispatchPlanner.class);

    static final String CONTEXT_HEADER = "Relevant memories:\n";

    private final LlmRouter router;
    private final WorkerPool pool;
    private final RecallStore recall;
    private final CreativeGenerator creative;
    private final CoordinationProperties coordination;
    private final RecallProperties recallProps;
    private final CreativeProperties creativeProps;

    public DispatchPlanner(LlmRouter router,
                           WorkerPool pool,
                           RecallStore recall,
                           CreativeGenerator creative,
                           CoordinationProperties coordination,
                           RecallProperties recallProps,
                           CreativeProperties creativeProps) {
        this.router = Objects.requireNonNull(router, "router");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.recall = Objects.requireNonNull(recall, "recall");
        this.creative = Objects.requireNonNull(creative, "creative");
        this.coordination = Objects.requireNonNull(coordination, "coordination");
        this.recallProps = Objects.requireNonNull(recallProps, "recallProps");
        this.creativeProps = Objects.requireNonNull(creativeProps, "creativeProps");
    }

    @Override
    public DispatchPlan visitCompletion(CompletionPayload payload) {
        CompletionRequest request = new CompletionRequest(payload.prompt(), null, payload.maxTokens());
        return new DispatchPlan(List.of(
                EngineCall.mandatory(EngineType.LLM, coordination.getLlmTimeout(),
                        (budget, dep) -> complete(request, budget))));
    }

    @Override
    public DispatchPlan visitRecall(RecallPayload payload) {
        return new DispatchPlan(List.of(
                EngineCall.mandatory(EngineType.RECALL, recallProps.getLatencyBudget(),
                        (budget, dep) -> recall(new RecallQuery(payload.query(), payload.vector(),
                                payload.topK(), budget)))));
    }

    @Override
    public DispatchPlan visitParallel(ParallelPayload payload) {
        return new DispatchPlan(List.of(
                EngineCall.mandatory(EngineType.WORKER_POOL, coordination.getPoolTimeout(),
                        (budget, dep) -> runParallel(payload.prompts(), budget))));
    }

    @Override
    public DispatchPlan visitCreative(CreativePayload payload) {
        return new DispatchPlan(List.of(
                EngineCall.mandatory(EngineType.CREATIVE, creativeProps.getGenerationTimeout(),
                        (budget, dep) -> generate(payload.prompt(), payload.count(), budget))));
    }

    @Override
    public DispatchPlan visitComposite(CompositePayload payload) {
        List<EngineCall> calls = new ArrayList<>();
        calls.add(EngineCall.optional(EngineType.RECALL, recallProps.getLatencyBudget(),
                (budget, dep) -> recall(RecallQuery.byKey(payload.prompt(), payload.topK(), budget))));
        calls.add(new EngineCall(EngineType.LLM, true, coordination.getLlmTimeout(), EngineType.RECALL,
                (budget, dep) -> complete(withRecallContext(payload.prompt(), dep), budget)));
        if (payload.creativeCount() > 0) {
            calls.add(EngineCall.optional(EngineType.CREATIVE, creativeProps.getGenerationTimeout(),
                    (budget, dep) -> generate(payload.prompt(), payload.creativeCount(), budget)));
        }
        if (!payload.subPrompts().isEmpty()) {
            calls.add(EngineCall.optional(EngineType.WORKER_POOL, coordination.getPoolTimeout(),
                    (budget, dep) -> runParallel(payload.subPrompts(), budget)));
        }
        return new DispatchPlan(calls);
    }

    static CompletionRequest withRecallContext(String prompt, EngineValue recallValue) {
        CompletionRequest request = CompletionRequest.of(prompt);
        if (recallValue != null && recallValue.value() instanceof RecallResult hits && !hits.isEmpty()) {
            return request.withContext(CONTEXT_HEADER + hits.asContext());
        }
        return request;
    }

    private EngineValue complete(CompletionRequest request, Duration budget) {
        RoutedCompletion routed = router.routeCompletion(request, budget);
        return new EngineValue(routed, false, routed.providerId(), routed.cost(), List.of());
    }

    private EngineValue recall(RecallQuery query) {
        RecallResult result = recall.query(query);
        if (!result.degraded()) {
            return EngineValue.of(result);
        }
        EngineError issue = new EngineError(EngineType.RECALL, ErrorKind.RECALL_DEGRADED,
                "Recall returned " + result.hits().size() + " partial hit(s) after "
                        + result.retrievalLatencyMs() + "ms");
        return new EngineValue(result, true, null, 0.0, List.of(issue));
    }

    private EngineValue generate(String prompt, int count, Duration budget) {
        CreativeResult result = creative.generate(prompt, count, budget);
        String provider = result.primaryProvider();
        if (result.isEmpty()) {
            EngineError none = new EngineError(EngineType.CREATIVE, ErrorKind.GENERATION_PARTIAL,
                    "No candidates produced within " + budget.toMillis() + "ms");
            return new EngineValue(null, false, provider, result.cost(), List.of(none));
        }
        if (!result.partial()) {
            return new EngineValue(result, false, provider, result.cost(), List.of());
        }
        EngineError issue = new EngineError(EngineType.CREATIVE, ErrorKind.GENERATION_PARTIAL,
                "Generated " + result.candidates().size() + " of " + result.requested() + " candidates");
        return new EngineValue(result, true, provider, result.cost(), List.of(issue));
    }

    /**
     * Runs each prompt as a routed completion on the worker pool. Individual failures degrade
     * the batch; the batch fails only when no prompt succeeded.
     */
    private EngineValue runParallel(List<String> prompts, Duration budget) throws InterruptedException {
        long deadline = TimeUtils.deadlineAfter(budget);
        List<TaskHandle<RoutedCompletion>> handles = new ArrayList<>(prompts.size());
        List<EngineError> issues = new ArrayList<>();
        QueueFullException firstRejection = null;
        for (int i = 0; i < prompts.size(); i++) {
            CompletionRequest request = CompletionRequest.of(prompts.get(i));
            try {
                handles.add(pool.submit("parallel-" + i,
                        () -> router.routeCompletion(request, TimeUtils.remaining(deadline))));
            } catch (QueueFullException e) {
                if (firstRejection == null) {
                    firstRejection = e;
                }
                handles.add(null);
            } catch (RejectedExecutionException e) {
                handles.forEach(h -> {
                    if (h != null) {
                        h.cancel();
                    }
                });
                throw e;
            }
        }
        if (firstRejection != null && handles.stream().allMatch(Objects::isNull)) {
            throw firstRejection;
        }

        List<SubtaskOutput> outputs = new ArrayList<>(prompts.size());
        double cost = 0.0;
        String provider = null;
        try {
            for (int i = 0; i < handles.size(); i++) {
                TaskHandle<RoutedCompletion> handle = handles.get(i);
                if (handle == null) {
                    outputs.add(new SubtaskOutput(i, null, null, "queue full"));
                    issues.add(new EngineError(EngineType.WORKER_POOL, ErrorKind.QUEUE_FULL,
                            "Sub-task " + i + " rejected: " + firstRejection.getMessage()));
                    continue;
                }
                try {
                    RoutedCompletion routed = handle.get(TimeUtils.remaining(deadline));
                    outputs.add(new SubtaskOutput(i, routed.text(), routed.providerId(), null));
                    cost += routed.cost();
                    if (provider == null) {
                        provider = routed.providerId();
                    }
                } catch (TimeoutException e) {
                    handle.cancel();
                    outputs.add(new SubtaskOutput(i, null, null, "timed out"));
                    issues.add(new EngineError(EngineType.WORKER_POOL, ErrorKind.COORDINATION_TIMEOUT,
                            "Sub-task " + i + " did not finish within " + budget.toMillis() + "ms"));
                } catch (ExecutionException e) {
                    String reason = Failures.describe(e);
                    outputs.add(new SubtaskOutput(i, null, null, reason));
                    issues.add(new EngineError(EngineType.WORKER_POOL, ErrorKind.ENGINE_CRASH,
                            "Sub-task " + i + " failed: " + reason));
                }
            }
        } catch (InterruptedException e) {
            handles.forEach(h -> {
                if (h != null) {
                    h.cancel();
                }
            });
            throw e;
        }

        long succeeded = outputs.stream().filter(SubtaskOutput::succeeded).count();
        if (succeeded == 0) {
            LOG.warn("All {} parallel sub-tasks failed", prompts.size());
            return new EngineValue(null, false, null, 0.0, issues);
        }
        return new EngineValue(List.copyOf(outputs), !issues.isEmpty(), provider, cost, issues);
    }
}
