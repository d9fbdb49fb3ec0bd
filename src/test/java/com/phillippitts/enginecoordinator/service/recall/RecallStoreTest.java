package com.phillippitts.enginecoordinator.service.recall;

import com.phillippitts.enginecoordinator.config.properties.RecallProperties;
import com.phillippitts.enginecoordinator.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

class RecallStoreTest {

    private ExecutorService executor;
    private RecallProperties props;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        props = new RecallProperties();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /** Emits one hit at once, then needs 200ms for the next. */
    private static final class SlowBackend implements MemoryBackend {
        final AtomicInteger searches = new AtomicInteger();
        volatile boolean interrupted;

        @Override
        public void search(RecallQuery query, Consumer<RecallHit> sink) throws InterruptedException {
            searches.incrementAndGet();
            sink.accept(new RecallHit("fast", 0.9, "early memory", 1));
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                interrupted = true;
                throw e;
            }
            sink.accept(new RecallHit("slow", 0.95, "late memory", 2));
        }

        @Override
        public MemoryEntry insert(String id, String content, Map<String, String> metadata) {
            throw new UnsupportedOperationException();
        }

        @Override
        public int size() {
            return 2;
        }
    }

    private static final class BrokenBackend implements MemoryBackend {
        @Override
        public void search(RecallQuery query, Consumer<RecallHit> sink) {
            sink.accept(new RecallHit("before-crash", 0.5, "partial", 1));
            throw new IllegalStateException("index corrupted");
        }

        @Override
        public MemoryEntry insert(String id, String content, Map<String, String> metadata) {
            throw new UnsupportedOperationException();
        }

        @Override
        public int size() {
            return 0;
        }
    }

    private RecallStore inMemoryStore() {
        return new RecallStore(new InMemoryVectorBackend(new HashingEmbedder(), new MutableClock()), executor, props);
    }

    @Test
    void saturatedExecutorYieldsDegradedResultWithinBudget() throws InterruptedException {
        ThreadPoolExecutor saturated = new ThreadPoolExecutor(1, 1, 0, TimeUnit.MILLISECONDS,
                new SynchronousQueue<>(), new ThreadPoolExecutor.AbortPolicy());
        CountDownLatch release = new CountDownLatch(1);
        try {
            saturated.execute(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            SlowBackend backend = new SlowBackend();
            RecallStore store = new RecallStore(backend, saturated, props);

            long t0 = System.nanoTime();
            RecallResult result = store.query(RecallQuery.byKey("memories", 5, Duration.ofMillis(50)));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

            assertThat(elapsedMs).isLessThan(150);
            assertThat(result.degraded()).isTrue();
            assertThat(result.hits()).isEmpty();
            assertThat(backend.searches.get()).isZero();
        } finally {
            release.countDown();
            saturated.shutdownNow();
        }
    }

    @Test
    void slowBackendIsCutAtBudgetWithPartialResults() {
        SlowBackend backend = new SlowBackend();
        RecallStore store = new RecallStore(backend, executor, props);

        long t0 = System.nanoTime();
        RecallResult result = store.query(RecallQuery.byKey("anything", 5, Duration.ofMillis(50)));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        assertThat(elapsedMs).isLessThan(150);
        assertThat(result.degraded()).isTrue();
        assertThat(result.hits()).extracting(RecallHit::id).containsExactly("fast");
        assertThat(result.retrievalLatencyMs()).isLessThan(150);
    }

    @Test
    void degradedResultsAreNotCached() {
        SlowBackend backend = new SlowBackend();
        RecallStore store = new RecallStore(backend, executor, props);
        RecallQuery query = RecallQuery.byKey("anything", 5, Duration.ofMillis(50));

        store.query(query);
        store.query(query);

        assertThat(backend.searches.get()).isEqualTo(2);
    }

    @Test
    void generousBudgetReturnsCompleteRankedResult() {
        RecallStore store = new RecallStore(new SlowBackend(), executor, props);

        RecallResult result = store.query(RecallQuery.byKey("anything", 5, Duration.ofSeconds(2)));

        assertThat(result.degraded()).isFalse();
        assertThat(result.hits()).extracting(RecallHit::id).containsExactly("slow", "fast");
    }

    @Test
    void backendFailureDegradesInsteadOfThrowing() {
        RecallStore store = new RecallStore(new BrokenBackend(), executor, props);

        RecallResult result = store.query(RecallQuery.byKey("anything", 5, Duration.ofSeconds(1)));

        assertThat(result.degraded()).isTrue();
        assertThat(result.hits()).extracting(RecallHit::id).containsExactly("before-crash");
    }

    @Test
    void ranksBySimilarityAndHonoursTopK() {
        RecallStore store = inMemoryStore();
        store.remember("m1", "The user prefers green tea in the morning", Map.of());
        store.remember("m2", "Quarterly budget review is on Friday", Map.of());
        store.remember("m3", "Green tea with honey is the usual morning drink", Map.of());

        RecallResult result = store.query(RecallQuery.byKey("morning green tea", 2, null));

        assertThat(result.degraded()).isFalse();
        assertThat(result.hits()).hasSize(2);
        assertThat(result.hits()).extracting(RecallHit::id).containsExactlyInAnyOrder("m1", "m3");
        assertThat(result.hits().get(0).score()).isGreaterThanOrEqualTo(result.hits().get(1).score());
    }

    @Test
    void unrelatedQueryReturnsNoHits() {
        RecallStore store = inMemoryStore();
        store.remember("m1", "green tea preference", Map.of());

        RecallResult result = store.query(RecallQuery.byKey("kubernetes deployment", 3, null));

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.degraded()).isFalse();
    }

    @Test
    void repeatedQueryIsServedFromCacheUntilNextInsert() {
        AtomicInteger searches = new AtomicInteger();
        InMemoryVectorBackend delegate = new InMemoryVectorBackend(new HashingEmbedder(), new MutableClock());
        MemoryBackend counting = new MemoryBackend() {
            @Override
            public void search(RecallQuery query, Consumer<RecallHit> sink) throws InterruptedException {
                searches.incrementAndGet();
                delegate.search(query, sink);
            }

            @Override
            public MemoryEntry insert(String id, String content, Map<String, String> metadata) {
                return delegate.insert(id, content, metadata);
            }

            @Override
            public int size() {
                return delegate.size();
            }
        };
        RecallStore store = new RecallStore(counting, executor, props);
        store.remember("m1", "green tea preference", Map.of());
        RecallQuery query = RecallQuery.byKey("green tea", 3, null);

        store.query(query);
        RecallResult cached = store.query(query);
        assertThat(searches.get()).isEqualTo(1);
        assertThat(cached.hits()).hasSize(1);

        store.remember("m2", "more green tea notes", Map.of());
        RecallResult fresh = store.query(query);
        assertThat(searches.get()).isEqualTo(2);
        assertThat(fresh.hits()).hasSize(2);
    }

    @Test
    void contextRendersPayloadsAsBullets() {
        RecallResult result = new RecallResult(List.of(
                new RecallHit("a", 0.9, "first", 1),
                new RecallHit("b", 0.8, "second", 2)), 3, false);

        assertThat(result.asContext()).isEqualTo("- first\n- second");
    }
}
