package com.phillippitts.enginecoordinator.config.coordination;

import com.phillippitts.enginecoordinator.service.coordination.Coordinator;
import com.phillippitts.enginecoordinator.service.pool.WorkerPool;
import com.phillippitts.enginecoordinator.service.provider.HealthMonitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CoordinationLifecycleTest {

    private Coordinator coordinator;
    private WorkerPool pool;
    private HealthMonitor monitor;
    private TaskScheduler scheduler;
    private CoordinationLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        coordinator = mock(Coordinator.class);
        pool = mock(WorkerPool.class);
        monitor = mock(HealthMonitor.class);
        scheduler = mock(TaskScheduler.class);
        lifecycle = new CoordinationLifecycle(coordinator, pool, monitor, scheduler,
                Duration.ofSeconds(2), Duration.ofSeconds(3));
    }

    @Test
    void startBringsUpPoolAndBackgroundLoops() {
        lifecycle.start();
        lifecycle.start();

        assertThat(lifecycle.isRunning()).isTrue();
        verify(pool, times(1)).start();
        verify(pool, times(1)).startAutoscaling(scheduler);
        verify(monitor, times(1)).start(scheduler);
    }

    @Test
    void stopDrainsCoordinatorBeforePool() {
        when(coordinator.shutdown(any())).thenReturn(true);
        when(pool.shutdown(any())).thenReturn(false);
        lifecycle.start();

        lifecycle.stop();

        assertThat(lifecycle.isRunning()).isFalse();
        InOrder order = inOrder(coordinator, pool, monitor);
        order.verify(coordinator).shutdown(Duration.ofSeconds(2));
        order.verify(pool).shutdown(Duration.ofSeconds(3));
        order.verify(monitor).stop();
    }

    @Test
    void stopBeforeStartIsNoOp() {
        lifecycle.stop();

        verifyNoInteractions(coordinator, pool, monitor);
    }
}
