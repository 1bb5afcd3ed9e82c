package com.phillippitts.watchkeeper.config;

import com.phillippitts.watchkeeper.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread model of the daemon.
 *
 * <p>Two pools exist:
 * <ul>
 *   <li>{@code taskScheduler}: exactly one thread ({@code control-loop-1}). Every
 *       {@code @Scheduled} method runs here, so reconcile ticks and signal draining are
 *       naturally serialized with each other.</li>
 *   <li>{@code streamExecutor}: pumps child stdout/stderr into loggers. Direct hand-off
 *       (no queue) so a pump never waits behind another pump.</li>
 * </ul>
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Single-threaded scheduler backing every {@code @Scheduled} method.
     *
     * <p>Named {@code taskScheduler} so Spring's scheduling infrastructure picks it up
     * instead of creating its own.
     *
     * @return the control loop scheduler
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("control-loop-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Executor for output pumps.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A pump that cannot be
     * scheduled surfaces as a registration failure instead of running on the control loop,
     * where a blocking read would stall reconciliation.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext of the registering thread so pump
     * output carries the watcher name.
     *
     * @return configured executor for stream pumps
     */
    @Bean(name = "streamExecutor")
    public ThreadPoolTaskExecutor streamExecutor() {
        ThreadPoolProperties.StreamPoolProperties streamProps = threadPoolProperties.getStream();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(streamProps.getCorePoolSize());
        executor.setMaxPoolSize(streamProps.getMaxPoolSize());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(streamProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(streamProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
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
