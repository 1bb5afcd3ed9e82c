package com.phillippitts.watchkeeper.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the stream pump pool via Micrometer.
 *
 * <ul>
 *   <li>stream.pool.size - Current number of pump threads</li>
 *   <li>stream.pool.active - Pumps currently reading a child stream</li>
 *   <li>stream.pool.completed - Pumps that reached end of stream or were cancelled</li>
 *   <li>stream.pool.max.size - Configured maximum pool size</li>
 * </ul>
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> streamExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("streamExecutor") ObjectProvider<ThreadPoolTaskExecutor> streamExecutorProvider) {
        this.streamExecutorProvider = streamExecutorProvider;
    }

    @Bean
    public MeterBinder streamExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = this.streamExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("stream.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the stream pump pool")
                    .register(registry);

            Gauge.builder("stream.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of pumps actively reading child output")
                    .register(registry);

            Gauge.builder("stream.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of finished pumps")
                    .register(registry);

            Gauge.builder("stream.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured maximum pool size for stream pumps")
                    .register(registry);

            LOG.info("Stream pool metrics registered: stream.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = this.streamExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Stream Pool Health: size={}/{}, active={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getCompletedTaskCount()
        );
    }
}
