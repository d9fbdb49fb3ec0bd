package com.phillippitts.enginecoordinator.service.creative;

import com.phillippitts.enginecoordinator.config.properties.CreativeProperties;
import com.phillippitts.enginecoordinator.service.metrics.CoordinationMetricsPublisher;
import com.phillippitts.enginecoordinator.util.LogSanitizer;
import com.phillippitts.enginecoordinator.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Generates N creative candidates concurrently and ranks them.
 *
 * <p>Drafts are collected until all have arrived or the generation timeout elapses, whichever
 * comes first; drafts still outstanding at that point are cancelled. Collected drafts are scored,
 * near-duplicates dropped, and the rest sorted by combined rank.
 */
public class CreativeGenerator {

    private static final Logger LOG = LogManager.getLogger(CreativeGenerator.class);

    private final CandidateSource source;
    private final CandidateScorer scorer;
    private final ExecutorService executor;
    private final CreativeProperties props;
    private final CoordinationMetricsPublisher metrics;

    public CreativeGenerator(CandidateSource source,
                             CandidateScorer scorer,
                             ExecutorService executor,
                             CreativeProperties props,
                             CoordinationMetricsPublisher metrics) {
        this.source = Objects.requireNonNull(source, "source");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = metrics == null ? CoordinationMetricsPublisher.NOOP : metrics;
    }

    /**
     * Generates with the configured count and timeout.
     */
    public CreativeResult generate(String prompt) {
        return generate(prompt, props.getCount(), props.getGenerationTimeout());
    }

    /**
     * @param prompt            creative prompt
     * @param count             candidates wanted
     * @param generationTimeout hard limit on the whole generation
     * @return ranked candidates, flagged partial when fewer than {@code count} survived
     */
    public CreativeResult generate(String prompt, int count, Duration generationTimeout) {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(generationTimeout, "generationTimeout");
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
        long t0 = System.nanoTime();
        long deadline = TimeUtils.deadlineAfter(generationTimeout);

        CompletionService<Draft> completion = new ExecutorCompletionService<>(executor);
        Map<Future<Draft>, Integer> indexByFuture = new HashMap<>();
        for (int i = 0; i < count; i++) {
            int index = i;
            try {
                Future<Draft> f = completion.submit(() ->
                        source.draft(prompt, index, TimeUtils.remaining(deadline)));
                indexByFuture.put(f, index);
            } catch (RejectedExecutionException e) {
                LOG.warn("Creative draft {} rejected by a saturated executor", index);
            }
        }

        Map<Integer, Draft> drafts = new TreeMap<>();
        int outstanding = indexByFuture.size();
        boolean interrupted = false;
        while (outstanding > 0) {
            Duration left = TimeUtils.remaining(deadline);
            if (left.isZero()) {
                break;
            }
            Future<Draft> done;
            try {
                done = completion.poll(left.toNanos(), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                interrupted = true;
                break;
            }
            if (done == null) {
                break;
            }
            outstanding--;
            Integer index = indexByFuture.remove(done);
            try {
                Draft draft = done.get();
                if (draft != null) {
                    drafts.put(index, draft);
                }
            } catch (ExecutionException e) {
                LOG.debug("Creative draft {} failed: {}", index,
                        e.getCause() == null ? e : e.getCause().toString());
            } catch (InterruptedException e) {
                interrupted = true;
                break;
            }
        }
        indexByFuture.keySet().forEach(f -> f.cancel(true));
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        double cost = 0.0;
        Set<String> providers = new LinkedHashSet<>();
        Map<Integer, String> texts = new TreeMap<>();
        for (Map.Entry<Integer, Draft> e : drafts.entrySet()) {
            Draft draft = e.getValue();
            cost += draft.cost();
            if (draft.providerId() != null) {
                providers.add(draft.providerId());
            }
            if (draft.text() != null && !draft.text().isBlank()) {
                texts.put(e.getKey(), draft.text().trim());
            }
        }

        List<CreativeCandidate> ranked = rank(prompt, texts);
        List<CreativeCandidate> kept = dedupe(ranked, count);
        boolean partial = kept.size() < count;
        long elapsed = System.nanoTime() - t0;
        metrics.recordCreativeGeneration(elapsed, partial);
        if (partial) {
            LOG.warn("Creative generation for '{}' returned {}/{} candidates ({} outstanding cancelled)",
                    LogSanitizer.preview(prompt), kept.size(), count, indexByFuture.size());
        } else {
            LOG.debug("Creative generation produced {} candidates in {}ms", kept.size(), TimeUtils.nanosToMillis(elapsed));
        }
        return new CreativeResult(kept, count, partial, TimeUtils.nanosToMillis(elapsed),
                cost, new ArrayList<>(providers));
    }

    private List<CreativeCandidate> rank(String prompt, Map<Integer, String> drafts) {
        List<CreativeCandidate> out = new ArrayList<>(drafts.size());
        for (Map.Entry<Integer, String> e : drafts.entrySet()) {
            List<String> peers = new ArrayList<>(drafts.size() - 1);
            drafts.forEach((i, text) -> {
                if (!i.equals(e.getKey())) {
                    peers.add(text);
                }
            });
            CandidateScore s = scorer.score(prompt, e.getValue(), peers);
            double combined = props.getNoveltyWeight() * s.novelty() + props.getFeasibilityWeight() * s.feasibility();
            out.add(new CreativeCandidate("c-" + (e.getKey() + 1), e.getValue(),
                    s.novelty(), s.feasibility(), combined));
        }
        out.sort(Comparator.comparingDouble(CreativeCandidate::combinedRank).reversed()
                .thenComparing(CreativeCandidate::id));
        return out;
    }

    private List<CreativeCandidate> dedupe(List<CreativeCandidate> ranked, int limit) {
        List<CreativeCandidate> kept = new ArrayList<>();
        for (CreativeCandidate c : ranked) {
            if (kept.size() == limit) {
                break;
            }
            boolean duplicate = kept.stream().anyMatch(k ->
                    scorer.similarity(k.content(), c.content()) >= props.getSimilarityThreshold());
            if (duplicate) {
                LOG.debug("Dropping near-duplicate candidate {}", c.id());
            } else {
                kept.add(c);
            }
        }
        return kept;
    }
}
