package com.phillippitts.enginecoordinator.service.pool;

import com.phillippitts.enginecoordinator.config.properties.WorkerPoolProperties;
import com.phillippitts.enginecoordinator.exception.EngineCrashException;
import com.phillippitts.enginecoordinator.exception.QueueFullException;
import com.phillippitts.enginecoordinator.testutil.MutableClock;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class WorkerPoolTest {

    private final MutableClock clock = new MutableClock();
    private final CountDownLatch release = new CountDownLatch(1);
    private WorkerPool pool;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (pool != null) {
            pool.shutdown(Duration.ofSeconds(2));
        }
        ThreadContext.clearAll();
    }

    private WorkerPool startPool(int min, int max, int queueLimit) {
        return startPool(min, max, queueLimit, Duration.ofSeconds(30));
    }

    private WorkerPool startPool(int min, int max, int queueLimit, Duration scaleDownCooldown) {
        WorkerPoolProperties props = new WorkerPoolProperties();
        props.setMinWorkers(min);
        props.setMaxWorkers(max);
        props.setQueueLimit(queueLimit);
        props.setScaleUpStep(2);
        props.setScaleDownStep(1);
        props.setScaleDownCooldown(scaleDownCooldown);
        pool = new WorkerPool(props, new CustomizableThreadFactory("test-worker-"), clock);
        pool.start();
        return pool;
    }

    private TaskHandle<String> blocking(String name) {
        return pool.submit(name, () -> {
            release.await();
            return name;
        });
    }

    @Test
    void startsWithMinimumWorkers() {
        startPool(2, 6, 10);

        WorkerPoolState state = pool.state();
        assertThat(state.activeWorkers()).isEqualTo(2);
        assertThat(state.minWorkers()).isEqualTo(2);
        assertThat(state.maxWorkers()).isEqualTo(6);
        assertThat(pool.liveWorkerThreads()).isEqualTo(2);
    }

    @Test
    void runsSubmittedTasks() throws Exception {
        startPool(2, 4, 10);

        TaskHandle<Integer> handle = pool.submit("sum", () -> 20 + 22);

        assertThat(handle.get(Duration.ofSeconds(2))).isEqualTo(42);
        assertThat(handle.isDone()).isTrue();
        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.state().completedTasks() == 1);
    }

    @Test
    void fullQueueRejectsImmediately() {
        startPool(1, 1, 2);
        blocking("running");
        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.state().busyWorkers() == 1);
        blocking("queued-1");
        blocking("queued-2");

        long t0 = System.nanoTime();
        assertThatThrownBy(() -> blocking("overflow"))
                .isInstanceOf(QueueFullException.class)
                .satisfies(e -> assertThat(((QueueFullException) e).getLimit()).isEqualTo(2));
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0)).isLessThan(100);
        assertThat(pool.state().queueDepth()).isEqualTo(2);
    }

    @Test
    void raisingTaskFailsOnlyItsOwnHandle() throws Exception {
        startPool(1, 2, 10);

        TaskHandle<String> bad = pool.submit("bad", () -> {
            throw new IllegalStateException("boom");
        });
        TaskHandle<String> good = pool.submit("good", () -> "fine");

        assertThatThrownBy(() -> bad.get(Duration.ofSeconds(2)))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(EngineCrashException.class)
                .hasRootCauseMessage("boom");
        assertThat(good.get(Duration.ofSeconds(2))).isEqualTo("fine");
        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.state().failedTasks() == 1);
        assertThat(pool.state().replacedWorkers()).isZero();
    }

    @Test
    void workerKilledByErrorIsReplaced() throws Exception {
        startPool(2, 4, 10);

        TaskHandle<String> fatal = pool.submit("fatal", () -> {
            throw new Error("worker killer");
        });

        assertThatThrownBy(() -> fatal.get(Duration.ofSeconds(2))).isInstanceOf(ExecutionException.class);
        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.state().replacedWorkers() == 1);
        assertThat(pool.liveWorkerThreads()).isEqualTo(2);
        assertThat(pool.submit("after", () -> "alive").get(Duration.ofSeconds(2))).isEqualTo("alive");
    }

    @Test
    void scalesUpUnderLoadWithoutExceedingMax() {
        startPool(2, 5, 20);
        for (int i = 0; i < 8; i++) {
            blocking("load-" + i);
        }
        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.state().busyWorkers() == 2);

        assertThat(pool.autoscale()).isEqualTo(2);
        assertThat(pool.autoscale()).isEqualTo(1);
        assertThat(pool.autoscale()).isZero();

        assertThat(pool.state().activeWorkers()).isEqualTo(5);
        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.state().busyWorkers() == 5);
        assertThat(pool.liveWorkerThreads()).isEqualTo(5);
    }

    @Test
    void scalesDownAfterCooldownButNeverBelowMin() {
        startPool(1, 4, 20);
        List<TaskHandle<String>> handles = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            handles.add(blocking("load-" + i));
        }
        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.state().busyWorkers() == 1);
        pool.autoscale();
        pool.autoscale();
        assertThat(pool.state().activeWorkers()).isEqualTo(4);

        release.countDown();
        await().atMost(2, TimeUnit.SECONDS).until(() -> handles.stream().allMatch(TaskHandle::isDone));
        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.state().busyWorkers() == 0);

        assertThat(pool.autoscale()).isEqualTo(-1);
        assertThat(pool.autoscale()).as("cooldown").isZero();
        clock.advance(Duration.ofSeconds(31));
        assertThat(pool.autoscale()).isEqualTo(-1);
        clock.advance(Duration.ofSeconds(31));
        assertThat(pool.autoscale()).isEqualTo(-1);
        clock.advance(Duration.ofSeconds(31));
        assertThat(pool.autoscale()).isZero();

        assertThat(pool.state().activeWorkers()).isEqualTo(1);
        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.liveWorkerThreads() == 1);
    }

    @Test
    void scaleUpRightAfterScaleDownNeverRunsMoreThreadsThanMax() {
        startPool(1, 3, 20, Duration.ZERO);
        CountDownLatch firstWave = new CountDownLatch(1);
        List<TaskHandle<String>> warmup = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            warmup.add(pool.submit("warmup-" + i, () -> {
                firstWave.await();
                return "done";
            }));
        }
        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.state().busyWorkers() == 1);
        assertThat(pool.autoscale()).isEqualTo(2);
        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.state().busyWorkers() == 3);
        firstWave.countDown();
        await().atMost(2, TimeUnit.SECONDS).until(() -> warmup.stream().allMatch(TaskHandle::isDone));
        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.state().busyWorkers() == 0);

        assertThat(pool.autoscale()).isEqualTo(-1);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        for (int i = 0; i < 6; i++) {
            pool.submit("burst-" + i, () -> {
                peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                try {
                    release.await();
                    return "done";
                } finally {
                    running.decrementAndGet();
                }
            });
        }
        assertThat(pool.autoscale()).isEqualTo(1);

        await().atMost(2, TimeUnit.SECONDS).until(() -> running.get() == 3);
        await().during(300, TimeUnit.MILLISECONDS).atMost(2, TimeUnit.SECONDS)
                .until(() -> pool.liveWorkerThreads() <= 3 && peak.get() <= 3);
        assertThat(pool.state().activeWorkers()).isEqualTo(3);
        assertThat(peak.get()).isEqualTo(3);
    }

    @Test
    void cancellingQueuedTaskRemovesIt() {
        startPool(1, 1, 5);
        blocking("running");
        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.state().busyWorkers() == 1);
        TaskHandle<String> queued = blocking("queued");

        assertThat(queued.cancel()).isTrue();

        assertThat(pool.state().queueDepth()).isZero();
        assertThatThrownBy(() -> queued.get(Duration.ofMillis(100))).isInstanceOf(CancellationException.class);
        assertThat(queued.cancel()).isFalse();
    }

    @Test
    void cancellingRunningTaskInterruptsIt() {
        startPool(1, 1, 5);
        TaskHandle<String> running = blocking("running");
        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.state().busyWorkers() == 1);

        assertThat(running.cancel()).isTrue();

        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.state().busyWorkers() == 0);
        assertThat(running.isDone()).isTrue();
    }

    @Test
    void propagatesThreadContextToWorker() throws Exception {
        startPool(1, 2, 5);
        ThreadContext.put("taskId", "task-42");

        TaskHandle<String> handle = pool.submit("mdc", () -> ThreadContext.get("taskId"));

        assertThat(handle.get(Duration.ofSeconds(2))).isEqualTo("task-42");
    }

    @Test
    void shutdownDrainsThenRejectsNewWork() {
        startPool(2, 2, 10);
        List<TaskHandle<Integer>> handles = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            int n = i;
            handles.add(pool.submit("short-" + i, () -> {
                Thread.sleep(20);
                return n;
            }));
        }

        assertThat(pool.shutdown(Duration.ofSeconds(2))).isTrue();

        assertThat(handles).allMatch(TaskHandle::isDone);
        assertThat(pool.isRunning()).isFalse();
        assertThatThrownBy(() -> pool.submit("late", () -> 1)).isInstanceOf(RejectedExecutionException.class);
        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.liveWorkerThreads() == 0);
    }

    @Test
    void shutdownPastDrainTimeoutCancelsLeftovers() {
        startPool(1, 1, 10);
        TaskHandle<String> running = blocking("stuck");
        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.state().busyWorkers() == 1);
        TaskHandle<String> queued = blocking("never-started");

        assertThat(pool.shutdown(Duration.ofMillis(100))).isFalse();

        assertThatThrownBy(() -> queued.get(Duration.ofMillis(100))).isInstanceOf(CancellationException.class);
        await().atMost(2, TimeUnit.SECONDS).until(running::isDone);
    }

    @Test
    void rejectsMinAboveMax() {
        WorkerPoolProperties props = new WorkerPoolProperties();
        props.setMinWorkers(5);
        props.setMaxWorkers(2);

        assertThatThrownBy(() -> new WorkerPool(props, new CustomizableThreadFactory("x-"), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsWorkBeforeStart() {
        pool = new WorkerPool(new WorkerPoolProperties(), new CustomizableThreadFactory("x-"), clock);

        assertThatThrownBy(() -> pool.submit("early", () -> 1)).isInstanceOf(RejectedExecutionException.class);
    }
}
