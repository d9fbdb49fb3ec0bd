package com.phillippitts.enginecoordinator.service.recall;

import com.phillippitts.enginecoordinator.config.properties.RecallProperties;
import com.phillippitts.enginecoordinator.util.LogSanitizer;
import com.phillippitts.enginecoordinator.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Latency-budgeted retrieval over a {@link MemoryBackend}.
 *
 * <p>The backend search runs on the supplied executor. If it has not finished when the budget
 * elapses, the search is cancelled and the hits streamed so far are returned with
 * {@code degraded=true}; the caller never waits past the budget. A search the executor refuses
 * to start yields an empty degraded result.
 *
 * <p>Complete results are cached in a bounded LRU that is cleared on every insert.
 */
public class RecallStore {

    private static final Logger LOG = LogManager.getLogger(RecallStore.class);

    private final MemoryBackend backend;
    private final ExecutorService executor;
    private final RecallProperties props;
    private final Map<String, RecallResult> cache;
    // bumped on insert so a query that straddles an insert is not cached
    private final AtomicLong generation = new AtomicLong();

    public RecallStore(MemoryBackend backend, ExecutorService executor, RecallProperties props) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.props = Objects.requireNonNull(props, "props");
        int capacity = props.getCacheSize();
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, RecallResult> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * Runs a query within its latency budget (or the configured default).
     *
     * @return ranked hits; degraded when the backend was cut off or failed
     */
    public RecallResult query(RecallQuery query) {
        Objects.requireNonNull(query, "query");
        if (query.latencyBudget() == null) {
            query = query.withBudget(props.getLatencyBudget());
        }
        String cacheKey = query.cacheKey();
        RecallResult cached = cached(cacheKey);
        if (cached != null) {
            LOG.debug("Recall cache hit for {}", LogSanitizer.preview(query.key()));
            return new RecallResult(cached.hits(), 0, false);
        }

        long startGeneration = generation.get();
        long t0 = System.nanoTime();
        ConcurrentLinkedQueue<RecallHit> collected = new ConcurrentLinkedQueue<>();
        RecallQuery q = query;
        Future<?> search;
        try {
            search = executor.submit(() -> {
                backend.search(q, collected::add);
                return null;
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("Recall executor saturated; returning empty degraded result");
            return new RecallResult(List.of(), TimeUtils.elapsedMillis(t0), true);
        }
        boolean degraded = false;
        Duration budget = query.latencyBudget();
        try {
            search.get(budget.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            search.cancel(true);
            degraded = true;
            LOG.warn("Recall exceeded {}ms budget; returning {} partial hit(s)",
                    budget.toMillis(), collected.size());
        } catch (ExecutionException e) {
            degraded = true;
            LOG.warn("Recall backend failed; returning {} partial hit(s): {}",
                    collected.size(), e.getCause() == null ? e : e.getCause().toString());
        } catch (InterruptedException e) {
            search.cancel(true);
            Thread.currentThread().interrupt();
            degraded = true;
        }

        RecallResult result = new RecallResult(rank(collected, query.topK()),
                TimeUtils.elapsedMillis(t0), degraded);
        if (!degraded) {
            cache(cacheKey, result, startGeneration);
        }
        return result;
    }

    /**
     * Stores a memory; cached results are invalidated.
     */
    public MemoryEntry remember(String id, String content, Map<String, String> metadata) {
        Objects.requireNonNull(id, "id");
        MemoryEntry entry = backend.insert(id, content, metadata);
        synchronized (cache) {
            generation.incrementAndGet();
            cache.clear();
        }
        LOG.debug("Stored memory {} ({} chars)", id, entry.content().length());
        return entry;
    }

    public int size() {
        return backend.size();
    }

    public int defaultTopK() {
        return props.getDefaultTopK();
    }

    private static List<RecallHit> rank(ConcurrentLinkedQueue<RecallHit> collected, int topK) {
        List<RecallHit> hits = new ArrayList<>(collected);
        hits.sort(RecallHit.RANKING);
        return hits.size() > topK ? hits.subList(0, topK) : hits;
    }

    private RecallResult cached(String key) {
        if (props.getCacheSize() == 0) {
            return null;
        }
        synchronized (cache) {
            return cache.get(key);
        }
    }

    private void cache(String key, RecallResult result, long startGeneration) {
        if (props.getCacheSize() == 0) {
            return;
        }
        synchronized (cache) {
            if (generation.get() == startGeneration) {
                cache.put(key, result);
            }
        }
    }
}
