package com.phillippitts.tunemerge.config;

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
 * Exposes the source executor through Micrometer gauges:
 * <ul>
 *   <li>source.pool.size - current number of threads</li>
 *   <li>source.pool.active - threads executing a source call</li>
 *   <li>source.pool.queued - calls waiting in the queue</li>
 *   <li>source.pool.completed - cumulative completed calls</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> sourceExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("sourceExecutor") ObjectProvider<ThreadPoolTaskExecutor> sourceExecutorProvider) {
        this.sourceExecutorProvider = sourceExecutorProvider;
    }

    @Bean
    public MeterBinder sourceExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = sourceExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("source.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the source pool")
                    .register(registry);

            Gauge.builder("source.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads executing source calls")
                    .register(registry);

            Gauge.builder("source.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of source calls waiting in the queue")
                    .register(registry);

            Gauge.builder("source.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed source calls")
                    .register(registry);

            LOG.info("Source thread pool metrics registered: source.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = sourceExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Source Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
