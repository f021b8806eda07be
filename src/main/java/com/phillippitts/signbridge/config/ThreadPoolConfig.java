package com.phillippitts.signbridge.config;

import com.phillippitts.signbridge.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for asynchronous work.
 *
 * <ul>
 *   <li>{@code pipelineExecutor}: handles mediation completions (fallback, output dispatch)</li>
 *   <li>{@code eventExecutor}: {@code @Async} Spring event listeners</li>
 *   <li>{@code idleScheduler}: single timer thread for the avatar idle-state manager</li>
 * </ul>
 *
 * <p>Both task executors use {@link ThreadPoolExecutor.CallerRunsPolicy} for backpressure
 * and copy the Log4j2 ThreadContext (MDC) from the submitting thread to the worker.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for mediation completion handling. Sized small: the work per completion is
     * a few status emissions and an output dispatch, never the mediation itself.
     *
     * @return configured executor (defaults: core 2, max 4, queue 20, prefix {@code pipeline-})
     */
    @Bean(name = "pipelineExecutor")
    public Executor pipelineExecutor() {
        return buildExecutor(threadPoolProperties.getPipeline());
    }

    /**
     * Executor for event listener offload.
     *
     * @return configured executor (defaults: core 1, max 2, queue 50, prefix {@code event-pool-})
     */
    @Bean(name = "eventExecutor")
    public Executor eventExecutor() {
        return buildExecutor(threadPoolProperties.getEvent());
    }

    /**
     * Timer thread for idle-state transitions. Daemon so it never blocks JVM exit.
     */
    @Bean(name = "idleScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService idleScheduler() {
        String name = threadPoolProperties.getIdleSchedulerThreadName();
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread t = new Thread(runnable, name);
            t.setDaemon(true);
            return t;
        });
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(props.getCorePoolSize(), props.getMaxPoolSize()));
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

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
}
