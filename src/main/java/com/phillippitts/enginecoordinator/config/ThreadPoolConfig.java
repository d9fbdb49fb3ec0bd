package com.phillippitts.enginecoordinator.config;

import com.phillippitts.enginecoordinator.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors and the scheduler used by the coordinator.
 *
 * <p>Pool sizes come from {@link ThreadPoolProperties} ({@code threadpool.*}). Every executor
 * copies the Log4j2 ThreadContext of the submitting thread, so request and task ids survive the
 * hop to worker threads.
 *
 * <p>Every executor aborts when its threads and queue are full. Work must never run on the
 * submitting thread: callers bound their waits with {@code Future.get(timeout)} and map a
 * {@code RejectedExecutionException} to a degraded or failed outcome.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs the coordinator's engine calls.
     */
    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor() {
        return executor(threadPoolProperties.getDispatch());
    }

    /**
     * Runs provider calls for the router and recovery probes for the health monitor.
     */
    @Bean(name = "providerExecutor")
    public ThreadPoolTaskExecutor providerExecutor() {
        return executor(threadPoolProperties.getProvider());
    }

    /**
     * Runs recall searches and creative drafts.
     */
    @Bean(name = "engineExecutor")
    public ThreadPoolTaskExecutor engineExecutor() {
        return executor(threadPoolProperties.getEngine());
    }

    /**
     * Drives the background loops (recovery probes, autoscaling) and {@code @Scheduled} summaries.
     */
    @Bean(name = "coordinatorScheduler")
    public ThreadPoolTaskScheduler coordinatorScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(threadPoolProperties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("coordinator-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Copies the submitting thread's ThreadContext onto the worker thread for the task's duration.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }

    private static ThreadPoolTaskExecutor executor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }
}
